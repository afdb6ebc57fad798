package io.hostforge.provisioner.remote;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Opens authenticated shell sessions on a remote host.
 *
 * Public-key authentication only. Connect, key exchange and authentication
 * together are bounded by {@code timeout}.
 */
public interface RemoteShell {

    /**
     * @throws RemoteConnectionException when the host is unreachable, the
     *         timeout expires, or the key is refused
     */
    RemoteSession connect(String host, String username, int port, Path privateKey, Duration timeout);
}
