package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.HostforgeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLockTest {

    @TempDir Path dir;

    @Test
    void acquire_writesOwnPidAndCloseRemovesFile() throws Exception {
        Path lockFile = dir.resolve("hosts/web-1.lock");

        try (SessionLock lock = SessionLock.acquire(lockFile)) {
            assertThat(Files.readString(lockFile)).isEqualTo(Long.toString(ProcessHandle.current().pid()));
        }
        assertThat(Files.exists(lockFile)).isFalse();
    }

    @Test
    void acquire_heldByLiveProcess_fails() throws Exception {
        Path lockFile = dir.resolve("web-1.lock");
        long parent = ProcessHandle.current().parent().orElseThrow().pid();
        Files.writeString(lockFile, Long.toString(parent));

        assertThatThrownBy(() -> SessionLock.acquire(lockFile))
                .isInstanceOf(HostforgeException.class)
                .hasMessageContaining("already running");
        assertThat(Files.readString(lockFile)).isEqualTo(Long.toString(parent));
    }

    @Test
    void acquire_staleLock_isTakenOver() throws Exception {
        Path lockFile = dir.resolve("web-1.lock");
        Files.writeString(lockFile, "not-a-pid");

        try (SessionLock lock = SessionLock.acquire(lockFile)) {
            assertThat(Files.readString(lockFile)).isEqualTo(Long.toString(ProcessHandle.current().pid()));
        }
    }
}
