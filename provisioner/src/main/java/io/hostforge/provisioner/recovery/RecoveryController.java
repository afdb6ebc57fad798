package io.hostforge.provisioner.recovery;

import io.hostforge.provisioner.config.RecoveryPolicy;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.step.StepJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The bounded recovery decision tree for a failed step.
 *
 * <pre>
 *   attempt &lt; max, retryable  : RETRY, SKIP*, SAVE_AND_EXIT, ENTER_RECOVERY_MODE, CANCEL
 *   attempt == max or config  :        SKIP*, SAVE_AND_EXIT, ENTER_RECOVERY_MODE, CANCEL
 *   lockout / interrupted     : nothing (handled by the caller)
 *   * non-critical steps only
 * </pre>
 */
@Component
public class RecoveryController {

    private static final Logger log = LoggerFactory.getLogger(RecoveryController.class);

    private final RecoveryPolicy         policy;
    private final DecisionSource         source;
    private final EnvironmentDiagnostics diagnostics;
    private final DiagnosticBundleWriter bundles;

    public RecoveryController(RecoveryPolicy policy,
                              DecisionSource source,
                              EnvironmentDiagnostics diagnostics,
                              DiagnosticBundleWriter bundles) {
        this.policy      = policy;
        this.source      = source;
        this.diagnostics = diagnostics;
        this.bundles     = bundles;
    }

    public int maxAttempts() {
        return policy.maxAttempts();
    }

    /** Actions available after {@code attempt} failed attempts. Pure. */
    public Set<RecoveryAction> offeredActions(int attempt, boolean critical, FailureKind kind) {
        if (kind == FailureKind.LOCKOUT || kind == FailureKind.INTERRUPTED) {
            return EnumSet.noneOf(RecoveryAction.class);
        }
        Set<RecoveryAction> offered = EnumSet.of(
                RecoveryAction.SAVE_AND_EXIT, RecoveryAction.ENTER_RECOVERY_MODE, RecoveryAction.CANCEL);
        if (attempt < policy.maxAttempts() && kind.isRetryable()) {
            offered.add(RecoveryAction.RETRY);
        }
        if (!critical) {
            offered.add(RecoveryAction.SKIP);
        }
        return offered;
    }

    /**
     * Ask for a decision and, for recovery mode, run the menu until it hands
     * back control.
     *
     * @throws IllegalArgumentException for lockout and interrupt, which have no menu
     */
    public Resolution handle(String stepName, int attempt, boolean critical,
                             StepFailure failure, StepJournal journal) {
        Set<RecoveryAction> offered = offeredActions(attempt, critical, failure.kind());
        if (offered.isEmpty()) {
            throw new IllegalArgumentException(failure.kind() + " failures are not recoverable from the menu");
        }
        FailureContext context = new FailureContext(journal.workflowId(), stepName, attempt,
                policy.maxAttempts(), critical, failure, offered);

        source.show(summary(context));
        while (true) {
            RecoveryAction action = source.decide(context);
            if (!offered.contains(action)) {
                source.show(action + " is not available here. Choose one of: " + labels(offered));
                continue;
            }
            log.info("Recovery decision for {} (attempt {}/{}): {}", stepName, attempt, policy.maxAttempts(), action);
            switch (action) {
                case RETRY:               return Resolution.RETRY;
                case SKIP:                return Resolution.SKIP;
                case SAVE_AND_EXIT:       return Resolution.SAVE_AND_EXIT;
                case CANCEL:              return Resolution.CANCEL;
                case ENTER_RECOVERY_MODE: return recoveryMode(context, journal);
                default: throw new IllegalStateException("Unhandled action " + action);
            }
        }
    }

    private Resolution recoveryMode(FailureContext context, StepJournal journal) {
        while (true) {
            RecoveryModeAction action = source.decideRecoveryMode(context);
            log.info("Recovery mode for {}: {}", context.stepName(), action);
            switch (action) {
                case SHOW_ERROR_DETAILS -> source.show(details(context.failure()));
                case RUN_DIAGNOSTICS -> source.show(diagnostics.run().stream()
                        .map(DiagnosticCheck::toString)
                        .collect(Collectors.joining(System.lineSeparator())));
                case RESET_STEP -> {
                    journal.resetStepData(context.stepName());
                    source.show("Data of step '" + context.stepName() + "' cleared; retrying.");
                    return Resolution.RETRY_FRESH;
                }
                case WRITE_DIAGNOSTIC_BUNDLE -> {
                    List<DiagnosticCheck> checks = diagnostics.run();
                    Path file = bundles.write(context, journal.document(), checks);
                    source.show("Support report written to " + file);
                }
                case RETURN -> {
                    return Resolution.RETRY_FRESH;
                }
            }
        }
    }

    private static String summary(FailureContext context) {
        StepFailure failure = context.failure();
        StringBuilder sb = new StringBuilder()
                .append("Step '").append(context.stepName()).append("' failed (attempt ")
                .append(context.attempt()).append('/').append(context.maxAttempts()).append(")")
                .append(System.lineSeparator())
                .append("  ").append(failure.message());
        if (failure.remediation() != null) {
            sb.append(System.lineSeparator()).append("  Hint: ").append(failure.remediation());
        }
        return sb.toString();
    }

    private static String details(StepFailure failure) {
        return "Kind: " + failure.kind() + System.lineSeparator()
                + "Message: " + failure.message() + System.lineSeparator()
                + (failure.remediation() != null ? "Remediation: " + failure.remediation() + System.lineSeparator() : "")
                + (failure.detail() != null ? failure.detail() : "(no stack trace)");
    }

    private static String labels(Set<RecoveryAction> offered) {
        return offered.stream().map(RecoveryAction::name).collect(Collectors.joining(", "));
    }
}
