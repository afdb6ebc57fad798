package io.hostforge.provisioner.service;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.config.ProvisionerConfig;
import io.hostforge.provisioner.model.Session;
import io.hostforge.provisioner.model.SetupMode;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.repository.JsonDocumentStore;
import io.hostforge.provisioner.repository.SessionRepository;
import io.hostforge.provisioner.repository.SessionStepJournal;
import io.hostforge.provisioner.step.StepRegistry;
import io.hostforge.provisioner.step.wizard.WizardContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/** Session lookup and resume guards. The orchestrator itself is mocked. */
@ExtendWith(MockitoExtension.class)
class WizardServiceTest {

    static final List<String> ORDER = List.of("welcome", "credentials", "deployment");

    @TempDir Path projectPath;

    @Mock StepRegistry<WizardContext> registry;
    @Mock SessionOrchestrator         orchestrator;

    SessionRepository sessions;
    WizardService     service;

    @BeforeEach
    void setUp() {
        sessions = new SessionRepository(new JsonDocumentStore(ProvisionerConfig.newObjectMapper()));
        service  = new WizardService(sessions, registry, orchestrator);
    }

    @Test
    void start_persistsSessionAndDrivesIt() {
        when(registry.stepNames()).thenReturn(ORDER);
        when(orchestrator.run(eq(registry), any(WizardContext.class), any(SessionStepJournal.class)))
                .thenAnswer(inv -> WorkflowResult.completed(((WizardContext) inv.getArgument(1)).session().getId()));

        WorkflowResult result = service.start("shop", projectPath, SetupMode.ADVANCED, true);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.COMPLETED);
        Session stored = sessions.findById(projectPath, result.workflowId()).orElseThrow();
        assertThat(stored.getStepOrder()).isEqualTo(ORDER);
        assertThat(stored.isDryRun()).isTrue();
        assertThat(stored.getSetupMode()).isEqualTo(SetupMode.ADVANCED);
        assertThat(Files.exists(sessions.sessionDir(projectPath).resolve(stored.getId() + ".lock"))).isFalse();
    }

    @Test
    void resume_withoutId_picksMostRecentSession() {
        Session session = Session.start("shop", projectPath.toString(), SetupMode.QUICK, false, ORDER);
        session.setCurrentStepIndex(1);
        sessions.save(session);
        when(registry.stepNames()).thenReturn(ORDER);
        when(orchestrator.run(eq(registry), any(WizardContext.class), any(SessionStepJournal.class)))
                .thenReturn(WorkflowResult.completed(session.getId()));

        service.resume(projectPath, null);

        ArgumentCaptor<WizardContext> ctx = ArgumentCaptor.forClass(WizardContext.class);
        verify(orchestrator).run(eq(registry), ctx.capture(), any(SessionStepJournal.class));
        assertThat(ctx.getValue().session().getId()).isEqualTo(session.getId());
        assertThat(ctx.getValue().session().getCurrentStepIndex()).isEqualTo(1);
    }

    @Test
    void resume_nothingFound_isConfigurationError() {
        assertThatThrownBy(() -> service.resume(projectPath, "missing"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void resume_idWithPathSegments_isRejectedBeforeAnyRead() throws Exception {
        Session outside = Session.start("shop", projectPath.resolve("elsewhere").toString(), SetupMode.QUICK,
                false, ORDER);
        sessions.save(outside);

        assertThatThrownBy(() -> service.resume(projectPath, "../../elsewhere/.hostforge/wizard/" + outside.getId()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid session id");
        assertThatThrownBy(() -> sessions.findById(projectPath, ".."))
                .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void resume_completedSession_reportsWithoutRunning() {
        Session session = Session.start("shop", projectPath.toString(), SetupMode.QUICK, false, ORDER);
        session.markCompleted();
        sessions.save(session);

        WorkflowResult result = service.resume(projectPath, session.getId());

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.COMPLETED);
        assertThat(result.message()).startsWith("Session already completed");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void resume_differentStepOrder_isRefused() {
        Session session = Session.start("shop", projectPath.toString(), SetupMode.QUICK, false,
                List.of("welcome", "deployment"));
        sessions.save(session);
        when(registry.stepNames()).thenReturn(ORDER);

        assertThatThrownBy(() -> service.resume(projectPath, session.getId()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown step order");
        verifyNoInteractions(orchestrator);
    }
}
