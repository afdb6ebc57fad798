package io.hostforge.provisioner.model;

/**
 * How a workflow run ended.
 *
 * @param workflowId  session id or host identifier
 * @param stepName    the step the run stopped at (null when COMPLETED)
 * @param message     operator-facing summary
 * @param resumeHint  command that picks the run up again (null when not resumable)
 */
public record WorkflowResult(
        String workflowId,
        Status status,
        String stepName,
        String message,
        String resumeHint) {

    public enum Status {
        COMPLETED,
        SAVED_AND_EXITED,
        CANCELLED,
        LOCKED_OUT,
        INTERRUPTED
    }

    public static WorkflowResult completed(String workflowId) {
        return new WorkflowResult(workflowId, Status.COMPLETED, null, "All steps completed", null);
    }

    /** Saving and exiting is a normal exit; only cancel and lockout are failures. */
    public int exitCode() {
        return switch (status) {
            case COMPLETED, SAVED_AND_EXITED -> 0;
            case CANCELLED                   -> 1;
            case LOCKED_OUT                  -> 2;
            case INTERRUPTED                 -> 130;
        };
    }
}
