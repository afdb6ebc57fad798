package io.hostforge.provisioner.recovery;

import io.hostforge.provisioner.model.StepFailure;

import java.util.Set;

/**
 * Everything a {@link DecisionSource} gets to see about a failure.
 *
 * @param attempt attempts made so far, including the one that just failed
 * @param offered the only actions the source may choose from
 */
public record FailureContext(
        String              workflowId,
        String              stepName,
        int                 attempt,
        int                 maxAttempts,
        boolean             critical,
        StepFailure         failure,
        Set<RecoveryAction> offered) {

    public FailureContext {
        offered = Set.copyOf(offered);
    }
}
