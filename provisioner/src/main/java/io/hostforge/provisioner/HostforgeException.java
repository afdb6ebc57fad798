package io.hostforge.provisioner;

/**
 * Base class for failures that are shown to the operator.
 *
 * Every instance carries a remediation hint: the one line that tells the
 * operator what to do next. The message says what went wrong; the hint says
 * how to get out of it.
 */
public class HostforgeException extends RuntimeException {

    private final String remediation;

    public HostforgeException(String message, String remediation) {
        super(message);
        this.remediation = remediation;
    }

    public HostforgeException(String message, String remediation, Throwable cause) {
        super(message, cause);
        this.remediation = remediation;
    }

    public String getRemediation() { return remediation; }
}
