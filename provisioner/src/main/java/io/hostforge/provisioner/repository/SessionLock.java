package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.HostforgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Advisory lock that keeps two processes from driving the same workflow.
 *
 * The lock file holds the owner's PID. A lock whose owner is no longer alive
 * is stale and gets taken over.
 */
public final class SessionLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLock.class);

    private final Path file;

    private SessionLock(Path file) {
        this.file = file;
    }

    public static SessionLock acquire(Path lockFile) {
        long self = ProcessHandle.current().pid();
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            try {
                Files.writeString(lockFile, Long.toString(self), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE);
                return new SessionLock(lockFile);
            } catch (FileAlreadyExistsException e) {
                Optional<Long> owner = readOwner(lockFile);
                if (owner.isPresent() && owner.get() != self
                        && ProcessHandle.of(owner.get()).map(ProcessHandle::isAlive).orElse(false)) {
                    throw new HostforgeException(
                            "Workflow is already running in process " + owner.get(),
                            "Wait for the other run to finish, or stop it. Lock file: " + lockFile);
                }
                log.warn("Taking over stale lock {} (owner {})", lockFile, owner.map(String::valueOf).orElse("unknown"));
                Files.writeString(lockFile, Long.toString(self), StandardCharsets.UTF_8);
                return new SessionLock(lockFile);
            }
        } catch (IOException e) {
            throw new StateStoreException("Could not acquire lock", lockFile, e);
        }
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not release lock {}: {}", file, e.getMessage());
        }
    }

    private static Optional<Long> readOwner(Path lockFile) throws IOException {
        try {
            return Optional.of(Long.parseLong(Files.readString(lockFile, StandardCharsets.UTF_8).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
