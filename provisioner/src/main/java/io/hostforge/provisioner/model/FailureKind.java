package io.hostforge.provisioner.model;

/**
 * Classification of a failed step attempt.
 *
 * TRANSIENT    : network blip or a remote command that failed; retrying may help.
 * TIMEOUT      : a bounded call ran out of time; handled like TRANSIENT.
 * CONFIGURATION: missing or invalid input; retrying cannot help.
 * LOCKOUT      : no known access path works; terminal for this run.
 * INTERRUPTED  : the operator aborted; not a failure of the step.
 */
public enum FailureKind {
    TRANSIENT,
    TIMEOUT,
    CONFIGURATION,
    LOCKOUT,
    INTERRUPTED;

    public boolean isRetryable() {
        return this == TRANSIENT || this == TIMEOUT;
    }
}
