package io.hostforge.provisioner.recovery;

/** The closed recovery-mode menu. */
public enum RecoveryModeAction {
    SHOW_ERROR_DETAILS("Show error details"),
    RUN_DIAGNOSTICS("Check system requirements"),
    RESET_STEP("Reset this step's data and retry"),
    WRITE_DIAGNOSTIC_BUNDLE("Write a support report"),
    RETURN("Return to the step");

    private final String label;

    RecoveryModeAction(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
