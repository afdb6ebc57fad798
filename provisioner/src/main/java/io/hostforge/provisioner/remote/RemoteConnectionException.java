package io.hostforge.provisioner.remote;

import io.hostforge.provisioner.HostforgeException;

/** A login attempt failed: unreachable, refused, timed out, or key rejected. */
public class RemoteConnectionException extends HostforgeException {

    private final boolean timedOut;

    public RemoteConnectionException(String target, boolean timedOut, Throwable cause) {
        super("Could not connect to " + target + (timedOut ? " (timed out)" : "")
                        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
                "Check that the host is running and that its security group allows the SSH port.",
                cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() { return timedOut; }
}
