package io.hostforge.provisioner.service;

import io.hostforge.provisioner.config.RecoveryPolicy;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.model.StepOutcome;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.recovery.RecoveryController;
import io.hostforge.provisioner.recovery.Resolution;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepJournal;
import io.hostforge.provisioner.step.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Drives a workflow from its first incomplete step to the end.
 *
 * <pre>
 *   next step → executor → success: markStepCompleted → next
 *                        → failure: recordError → recovery → retry | skip | save-and-exit | cancel
 *                        → lockout / interrupt: stop, no menu
 * </pre>
 *
 * Every transition is durable before the next action starts. Retries are a
 * loop with a local attempt counter; the counter resets when the sequencer
 * moves to a different step.
 */
@Component
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final StepExecutor       executor;
    private final RecoveryController recovery;
    private final RecoveryPolicy     policy;

    // Journals of the running workflows, innermost last; flushed by the shutdown hook.
    private final Deque<StepJournal> active = new ConcurrentLinkedDeque<>();

    public SessionOrchestrator(StepExecutor executor, RecoveryController recovery, RecoveryPolicy policy) {
        this.executor = executor;
        this.recovery = recovery;
        this.policy   = policy;
    }

    public <C> WorkflowResult run(StepRegistry<C> registry, C context, StepJournal journal) {
        active.addLast(journal);
        try {
            return loop(registry, context, journal);
        } finally {
            active.removeLastOccurrence(journal);
        }
    }

    private <C> WorkflowResult loop(StepRegistry<C> registry, C context, StepJournal journal) {
        String currentStep = null;
        int attempt = 0;

        while (true) {
            Optional<Step<C>> next = registry.nextIncompleteStep(journal);
            if (next.isEmpty()) {
                break;
            }
            Step<C> step = next.get();
            if (!step.name().equals(currentStep)) {
                currentStep = step.name();
                attempt = 0;
            }
            attempt++;

            StepRegistry.Progress progress = registry.progress(journal);
            log.info("[{}/{}] {} (attempt {})", progress.done() + 1, progress.total(), step.name(), attempt);
            journal.updatePhase(step.name());

            StepOutcome outcome = executor.run(step, context, journal, attempt);
            switch (outcome.status()) {
                case SUCCESS -> {
                    journal.markStepCompleted(step.name(), outcome.data());
                    continue;
                }
                case SKIPPED -> {
                    journal.markStepSkipped(step.name(), String.valueOf(outcome.data().get("skipReason")));
                    continue;
                }
                case FAILURE -> { }
            }

            StepFailure failure = outcome.failure();
            if (failure.kind() == FailureKind.INTERRUPTED) {
                return interrupted(journal, step.name());
            }

            journal.recordError(step.name(), failure);

            if (failure.kind() == FailureKind.LOCKOUT) {
                log.error("Lockout during {}: {}", step.name(), failure.message());
                return new WorkflowResult(journal.workflowId(), WorkflowResult.Status.LOCKED_OUT, step.name(),
                        failure.remediation() == null ? failure.message()
                                : failure.message() + System.lineSeparator() + failure.remediation(),
                        null);
            }

            Resolution resolution = recovery.handle(step.name(), attempt, step.isCritical(), failure, journal);
            switch (resolution) {
                case RETRY -> {
                    if (!pause()) {
                        return interrupted(journal, step.name());
                    }
                }
                case RETRY_FRESH -> attempt = 0;
                case SKIP -> journal.markStepSkipped(step.name(), "Skipped after failure: " + failure.message());
                case SAVE_AND_EXIT -> {
                    journal.save();
                    log.info("Progress saved at {}", step.name());
                    return new WorkflowResult(journal.workflowId(), WorkflowResult.Status.SAVED_AND_EXITED,
                            step.name(), "Progress saved", journal.resumeHint());
                }
                case CANCEL -> {
                    journal.save();
                    log.warn("Workflow {} cancelled at {}", journal.workflowId(), step.name());
                    return new WorkflowResult(journal.workflowId(), WorkflowResult.Status.CANCELLED,
                            step.name(), "Cancelled at '" + step.name() + "'", journal.resumeHint());
                }
            }
        }

        journal.markWorkflowCompleted();
        log.info("Workflow {} completed", journal.workflowId());
        return WorkflowResult.completed(journal.workflowId());
    }

    /** Best-effort flush of every running workflow. Called from the shutdown hook. */
    public void saveActive() {
        for (StepJournal journal : active) {
            try {
                journal.save();
                log.info("Saved progress of {}", journal.workflowId());
            } catch (RuntimeException e) {
                log.error("Could not save progress of {}: {}", journal.workflowId(), e.getMessage());
            }
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(policy.retryDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static WorkflowResult interrupted(StepJournal journal, String stepName) {
        journal.save();
        return new WorkflowResult(journal.workflowId(), WorkflowResult.Status.INTERRUPTED, stepName,
                "Interrupted during '" + stepName + "'", journal.resumeHint());
    }
}
