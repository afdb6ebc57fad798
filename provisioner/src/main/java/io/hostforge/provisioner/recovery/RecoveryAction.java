package io.hostforge.provisioner.recovery;

/** What the operator can do after a step failed. */
public enum RecoveryAction {
    RETRY("Retry this step"),
    SKIP("Skip this step"),
    SAVE_AND_EXIT("Save progress and exit"),
    ENTER_RECOVERY_MODE("Enter recovery mode"),
    CANCEL("Cancel");

    private final String label;

    RecoveryAction(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
