package io.hostforge.provisioner.step;

import io.hostforge.provisioner.model.StepFailure;

import java.util.Map;

/**
 * The persisted progress of one workflow, as seen by the sequencer.
 *
 * Every mutating method is durable before it returns: the next action may be
 * destructive, so nothing is batched or deferred.
 */
public interface StepJournal {

    /** Session id or host identifier. */
    String workflowId();

    /** Completed or explicitly skipped. */
    boolean isStepDone(String stepName);

    /** Completed (skipping does not count). */
    boolean isStepCompleted(String stepName);

    /** The only way to flip a step to completed; stamps the time and persists. */
    void markStepCompleted(String stepName, Map<String, Object> data);

    void markStepSkipped(String stepName, String reason);

    void recordError(String stepName, StepFailure failure);

    /** Clears one incomplete step's recorded data. Never un-completes anything. */
    void resetStepData(String stepName);

    void updatePhase(String stepName);

    void markWorkflowCompleted();

    /** Best-effort flush, used on interrupt. */
    void save();

    /** The underlying document, for diagnostic bundles. */
    Object document();

    /** Command that resumes this workflow. */
    String resumeHint();
}
