package io.hostforge.provisioner.service;

import io.hostforge.provisioner.HostforgeException;
import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.connection.LockoutException;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.model.StepOutcome;
import io.hostforge.provisioner.remote.RemoteCommandException;
import io.hostforge.provisioner.remote.RemoteConnectionException;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepException;
import io.hostforge.provisioner.step.StepJournal;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.util.Map;

/**
 * Runs one step once and turns whatever happened into a {@link StepOutcome}.
 *
 * Never persists anything; recording the outcome is the orchestrator's job.
 * Raw exceptions stop here: callers only ever see a classified
 * {@link StepFailure}.
 *
 * <pre>
 *   hostforge.step.duration{workflow, step}
 *   hostforge.step.calls{workflow, step, status="success|transient|timeout|configuration|lockout|interrupted"}
 * </pre>
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final MeterRegistry meterRegistry;

    public StepExecutor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <C> StepOutcome run(Step<C> step, C context, StepJournal journal, int attempt) {
        Map<String, String> outerMdc = MDC.getCopyOfContextMap();
        MDC.put("workflow", journal.workflowId());
        MDC.put("step",     step.name());
        MDC.put("attempt",  String.valueOf(attempt));

        Timer.Sample sample = Timer.start(meterRegistry);
        StepOutcome outcome = null;
        try {
            for (String prerequisite : step.prerequisites()) {
                if (!journal.isStepCompleted(prerequisite)) {
                    log.error("Refusing to run {}: prerequisite {} is not completed", step.name(), prerequisite);
                    outcome = StepOutcome.failure(step.name(), StepFailure.of(FailureKind.CONFIGURATION,
                            "Step '" + step.name() + "' requires '" + prerequisite + "' to be completed first",
                            "Complete '" + prerequisite + "' (it cannot be skipped) and resume."));
                    return outcome;
                }
            }
            log.info("Running {}: {}", step.name(), step.description());
            Map<String, Object> data = step.run(context);
            outcome = StepOutcome.success(step.name(), data);
            log.info("{} succeeded", step.name());
            return outcome;
        } catch (Exception e) {
            StepFailure failure = classify(e);
            if (failure.kind() == FailureKind.INTERRUPTED) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted", step.name());
            } else {
                log.warn("{} failed [{}]: {}", step.name(), failure.kind(), failure.message());
                log.debug("{} failure detail", step.name(), e);
            }
            outcome = StepOutcome.failure(step.name(), failure);
            return outcome;
        } finally {
            String status = outcome == null ? "error"
                    : outcome.failed() ? outcome.failure().kind().name().toLowerCase()
                    : outcome.status().name().toLowerCase();
            sample.stop(meterRegistry.timer("hostforge.step.duration",
                    "workflow", workflowTag(journal), "step", step.name()));
            meterRegistry.counter("hostforge.step.calls",
                    "workflow", workflowTag(journal), "step", step.name(), "status", status).increment();
            restore(outerMdc);
        }
    }

    /** Exception to failure kind. Interrupts win over everything else. */
    static StepFailure classify(Exception e) {
        if (e instanceof InterruptedException || e instanceof InterruptedIOException
                || Thread.currentThread().isInterrupted()) {
            return StepFailure.of(FailureKind.INTERRUPTED, e, "Resume to continue from this step.");
        }
        if (e instanceof LockoutException lockout) {
            return StepFailure.of(FailureKind.LOCKOUT, e, lockout.getRemediation());
        }
        if (e instanceof StepException stepException) {
            return StepFailure.of(stepException.getKind(), e, stepException.getRemediation());
        }
        if (e instanceof RemoteConnectionException remote) {
            return StepFailure.of(remote.isTimedOut() ? FailureKind.TIMEOUT : FailureKind.TRANSIENT,
                    e, remote.getRemediation());
        }
        if (e instanceof RemoteCommandException remote) {
            return StepFailure.of(remote.isTimedOut() ? FailureKind.TIMEOUT : FailureKind.TRANSIENT,
                    e, remote.getRemediation());
        }
        if (e instanceof ConfigurationException config) {
            return StepFailure.of(FailureKind.CONFIGURATION, e, config.getRemediation());
        }
        if (e instanceof IllegalArgumentException) {
            return StepFailure.of(FailureKind.CONFIGURATION, e, "Check the values passed to this step.");
        }
        if (e instanceof HostforgeException other) {
            return StepFailure.of(FailureKind.TRANSIENT, e, other.getRemediation());
        }
        return StepFailure.of(FailureKind.TRANSIENT, e, null);
    }

    // Session ids are unique per run; tag by workflow kind to keep cardinality bounded.
    private static String workflowTag(StepJournal journal) {
        return journal.getClass().getSimpleName().replace("StepJournal", "").toLowerCase();
    }

    private static void restore(Map<String, String> outerMdc) {
        if (outerMdc == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(outerMdc);
        }
    }
}
