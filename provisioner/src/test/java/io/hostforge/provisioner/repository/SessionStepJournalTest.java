package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.config.ProvisionerConfig;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.Session;
import io.hostforge.provisioner.model.SetupMode;
import io.hostforge.provisioner.model.StepFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Session persistence and the positional completion rules of the wizard
 * journal. Real files under a temp directory.
 */
class SessionStepJournalTest {

    static final List<String> ORDER = List.of("welcome", "credentials", "project-config");

    @TempDir Path projectPath;

    SessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SessionRepository(new JsonDocumentStore(ProvisionerConfig.newObjectMapper()));
    }

    // ------------------------------------------------------------------
    // Cursor
    // ------------------------------------------------------------------

    @Test
    void markStepCompleted_currentStep_advancesCursorAndPersistsResult() {
        Session session = newSession();
        SessionStepJournal journal = new SessionStepJournal(repository, session);

        journal.markStepCompleted("welcome", Map.of("mode", "QUICK"));

        Session stored = repository.findById(projectPath, session.getId()).orElseThrow();
        assertThat(stored.getCurrentStepIndex()).isEqualTo(1);
        assertThat(stored.resultOf("welcome")).containsEntry("mode", "QUICK");
        assertThat(journal.isStepCompleted("welcome")).isTrue();
        assertThat(journal.isStepDone("credentials")).isFalse();
    }

    @Test
    void markStepCompleted_outOfOrder_isRefused() {
        SessionStepJournal journal = new SessionStepJournal(repository, newSession());

        assertThatThrownBy(() -> journal.markStepCompleted("credentials", Map.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(journal.session().getCurrentStepIndex()).isZero();
    }

    @Test
    void markStepSkipped_countsAsDoneButNotCompleted() {
        SessionStepJournal journal = new SessionStepJournal(repository, newSession());

        journal.markStepSkipped("welcome", "not needed");

        assertThat(journal.isStepDone("welcome")).isTrue();
        assertThat(journal.isStepCompleted("welcome")).isFalse();
        assertThat(journal.session().getSkippedSteps()).containsEntry("welcome", "not needed");
    }

    @Test
    void resetStepData_onDoneStep_isRefused() {
        SessionStepJournal journal = new SessionStepJournal(repository, newSession());
        journal.markStepCompleted("welcome", Map.of());

        assertThatThrownBy(() -> journal.resetStepData("welcome")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordError_isPersisted() {
        Session session = newSession();
        SessionStepJournal journal = new SessionStepJournal(repository, session);

        journal.recordError("credentials", StepFailure.of(FailureKind.CONFIGURATION, "region missing", null));

        Session stored = repository.findById(projectPath, session.getId()).orElseThrow();
        assertThat(stored.getErrors()).extracting(e -> e.message()).containsExactly("region missing");
    }

    @Test
    void resumeHint_namesSessionAndPath() {
        Session session = newSession();
        assertThat(new SessionStepJournal(repository, session).resumeHint())
                .isEqualTo("hostforge resume " + session.getId() + " --path " + projectPath);
    }

    // ------------------------------------------------------------------
    // Repository lookups
    // ------------------------------------------------------------------

    @Test
    void findMostRecent_returnsLastUpdatedSession() throws Exception {
        Session older = newSession();
        Thread.sleep(5);
        Session newer = newSession();
        Thread.sleep(5);
        new SessionStepJournal(repository, older).markStepCompleted("welcome", Map.of());

        assertThat(repository.findMostRecent(projectPath)).get()
                .extracting(Session::getId).isEqualTo(older.getId());
        assertThat(repository.listSessions(projectPath)).extracting(Session::getId)
                .containsExactlyInAnyOrder(older.getId(), newer.getId());
    }

    @Test
    void listSessions_skipsUnreadableFiles() throws Exception {
        Session session = newSession();
        Files.writeString(repository.sessionDir(projectPath).resolve("broken.json"), "{ not json");

        assertThat(repository.listSessions(projectPath)).extracting(Session::getId)
                .containsExactly(session.getId());
    }

    @Test
    void findMostRecent_noSessionDirectory_isEmpty() {
        assertThat(repository.findMostRecent(projectPath.resolve("elsewhere"))).isEmpty();
    }

    private Session newSession() {
        Session session = Session.start("shop", projectPath.toString(), SetupMode.QUICK, false, ORDER);
        repository.save(session);
        return session;
    }
}
