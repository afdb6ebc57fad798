package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.HostforgeException;

import java.nio.file.Path;

/** A state document could not be read or written. */
public class StateStoreException extends HostforgeException {

    public StateStoreException(String message, Path file, Throwable cause) {
        super(message + ": " + file, "Check that " + file.getParent()
                + " exists, is writable, and has free disk space.", cause);
    }
}
