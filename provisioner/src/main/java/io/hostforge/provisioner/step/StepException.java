package io.hostforge.provisioner.step;

import io.hostforge.provisioner.model.FailureKind;

/**
 * A step failure the step has classified itself.
 *
 * Unchecked so steps only catch it when they have a specific recovery
 * strategy; everything else propagates to the executor.
 */
public class StepException extends RuntimeException {

    private final FailureKind kind;
    private final String      remediation;

    public StepException(FailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public StepException(FailureKind kind, String message, String remediation) {
        this(kind, message, remediation, null);
    }

    public StepException(FailureKind kind, String message, String remediation, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind        = kind;
        this.remediation = remediation;
    }

    public FailureKind getKind()        { return kind; }
    public String      getRemediation() { return remediation; }
}
