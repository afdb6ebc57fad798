package io.hostforge.provisioner.service;

import io.hostforge.provisioner.config.RecoveryPolicy;
import io.hostforge.provisioner.connection.LockoutException;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.recovery.RecoveryController;
import io.hostforge.provisioner.recovery.Resolution;
import io.hostforge.provisioner.remote.RemoteConnectionException;
import io.hostforge.provisioner.step.InMemoryJournal;
import io.hostforge.provisioner.step.StepException;
import io.hostforge.provisioner.step.StepRegistry;
import io.hostforge.provisioner.step.StubStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionOrchestrator.
 *
 * Real executor and in-memory journal; only the recovery decisions are
 * mocked, so each test scripts what the operator chooses.
 */
@ExtendWith(MockitoExtension.class)
class SessionOrchestratorTest {

    static final RuntimeException BLIP = new RemoteConnectionException("web-1:22", false, null);

    @Mock RecoveryController recovery;

    SessionOrchestrator orchestrator;
    InMemoryJournal     journal = new InMemoryJournal();

    @BeforeEach
    void setUp() {
        orchestrator = new SessionOrchestrator(new StepExecutor(new SimpleMeterRegistry()), recovery,
                new RecoveryPolicy(3, Duration.ZERO));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void run_allStepsSucceed_completesInOrder() {
        StubStep a = new StubStep("a", true).then(Map.of("k", "v"));
        StubStep b = new StubStep("b", false);

        WorkflowResult result = orchestrator.run(registry(a, b), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.COMPLETED);
        assertThat(result.exitCode()).isZero();
        assertThat(journal.completed).containsOnlyKeys("a", "b");
        assertThat(journal.completed.get("a")).containsEntry("k", "v");
        assertThat(journal.phases).containsExactly("a", "b");
        assertThat(journal.workflowCompleted).isTrue();
        verifyNoInteractions(recovery);
    }

    @Test
    void run_resumedWorkflow_startsAtFirstIncompleteStep() {
        StubStep a = new StubStep("a", true);
        StubStep b = new StubStep("b", true);
        journal.markStepCompleted("a", Map.of());

        orchestrator.run(registry(a, b), null, journal);

        assertThat(a.runs).isZero();
        assertThat(b.runs).isEqualTo(1);
    }

    @Test
    void run_transientFailureThenRetry_succeedsOnSecondAttempt() {
        StubStep a = new StubStep("a", true).then(BLIP, Map.of());
        when(recovery.handle(eq("a"), eq(1), eq(true), any(), any())).thenReturn(Resolution.RETRY);

        WorkflowResult result = orchestrator.run(registry(a), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.COMPLETED);
        assertThat(a.runs).isEqualTo(2);
        assertThat(journal.errors).containsExactly("a:TRANSIENT");
    }

    @Test
    void run_attemptCounterPassedToRecovery_growsPerStep() {
        StubStep a = new StubStep("a", true).then(BLIP);
        when(recovery.handle(eq("a"), anyInt(), anyBoolean(), any(), any()))
                .thenReturn(Resolution.RETRY, Resolution.RETRY, Resolution.SAVE_AND_EXIT);

        WorkflowResult result = orchestrator.run(registry(a), null, journal);

        verify(recovery).handle(eq("a"), eq(1), eq(true), any(), any());
        verify(recovery).handle(eq("a"), eq(2), eq(true), any(), any());
        verify(recovery).handle(eq("a"), eq(3), eq(true), any(), any());
        assertThat(result.status()).isEqualTo(WorkflowResult.Status.SAVED_AND_EXITED);
        assertThat(result.exitCode()).isZero();
        assertThat(result.resumeHint()).isEqualTo("hostforge resume wf-1");
        assertThat(journal.saves).isEqualTo(1);
    }

    @Test
    void run_retryFresh_resetsAttemptCounter() {
        StubStep a = new StubStep("a", true).then(BLIP, BLIP, Map.of());
        when(recovery.handle(eq("a"), anyInt(), anyBoolean(), any(), any()))
                .thenReturn(Resolution.RETRY_FRESH, Resolution.RETRY_FRESH);

        orchestrator.run(registry(a), null, journal);

        verify(recovery, times(2)).handle(eq("a"), eq(1), eq(true), any(), any());
    }

    @Test
    void run_skip_marksStepSkippedAndContinues() {
        StubStep a = new StubStep("a", false).then(new StepException(FailureKind.CONFIGURATION, "no ufw"));
        StubStep b = new StubStep("b", false);
        when(recovery.handle(eq("a"), eq(1), eq(false), any(), any())).thenReturn(Resolution.SKIP);

        WorkflowResult result = orchestrator.run(registry(a, b), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.COMPLETED);
        assertThat(journal.skipped).containsKey("a");
        assertThat(journal.completed).containsOnlyKeys("b");
    }

    @Test
    void run_cancel_stopsWithExitCodeOne() {
        StubStep a = new StubStep("a", true).then(BLIP);
        StubStep b = new StubStep("b", true);
        when(recovery.handle(any(), anyInt(), anyBoolean(), any(), any())).thenReturn(Resolution.CANCEL);

        WorkflowResult result = orchestrator.run(registry(a, b), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.CANCELLED);
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(b.runs).isZero();
    }

    @Test
    void run_lockout_stopsWithoutRecoveryMenu() {
        StubStep a = new StubStep("a", true).then(new LockoutException("198.51.100.7", List.of("ubuntu@...:22")));

        WorkflowResult result = orchestrator.run(registry(a), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.LOCKED_OUT);
        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.message()).contains("Locked out of 198.51.100.7", "serial console");
        assertThat(journal.errors).containsExactly("a:LOCKOUT");
        verifyNoInteractions(recovery);
    }

    @Test
    void run_interrupted_savesAndStops() {
        StubStep a = new StubStep("a", true).then(new InterruptedException());
        StubStep b = new StubStep("b", true);

        WorkflowResult result = orchestrator.run(registry(a, b), null, journal);

        assertThat(result.status()).isEqualTo(WorkflowResult.Status.INTERRUPTED);
        assertThat(result.exitCode()).isEqualTo(130);
        assertThat(journal.saves).isEqualTo(1);
        assertThat(journal.errors).isEmpty();
        assertThat(b.runs).isZero();
        verifyNoInteractions(recovery);
    }

    @Test
    void saveActive_outsideAnyRun_doesNothing() {
        orchestrator.saveActive();
        assertThat(journal.saves).isZero();
    }

    private static StepRegistry<Object> registry(StubStep... steps) {
        return new StepRegistry<>("test", List.of(steps));
    }
}
