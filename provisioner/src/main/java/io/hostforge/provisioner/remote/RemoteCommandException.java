package io.hostforge.provisioner.remote;

import io.hostforge.provisioner.HostforgeException;

/** A remote command could not be run to completion, or exited non-zero where success was required. */
public class RemoteCommandException extends HostforgeException {

    private final boolean timedOut;

    public RemoteCommandException(String message, boolean timedOut, Throwable cause) {
        super(message, "Inspect the host's system log; the command is safe to re-run.", cause);
        this.timedOut = timedOut;
    }

    public RemoteCommandException(String description, CommandResult result) {
        super(description + " failed with exit code " + result.exitCode()
                        + (result.diagnostic().isEmpty() ? "" : ": " + result.diagnostic()),
                "Inspect the output above; the command is safe to re-run.");
        this.timedOut = false;
    }

    public boolean isTimedOut() { return timedOut; }
}
