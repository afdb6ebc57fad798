package io.hostforge.provisioner.remote;

import io.hostforge.provisioner.config.SshSettings;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@link RemoteShell} on the Apache MINA SSHD client.
 *
 * One {@link SshClient} per process, started on first use. Host keys are
 * accepted without a known_hosts check: the hosts are freshly created and
 * their keys are not known in advance.
 */
@Component
public class SshdRemoteShell implements RemoteShell, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SshdRemoteShell.class);

    private final Duration commandTimeout;

    private SshClient client;

    public SshdRemoteShell(SshSettings settings) {
        this.commandTimeout = settings.commandTimeout();
    }

    @Override
    public RemoteSession connect(String host, String username, int port, Path privateKey, Duration timeout) {
        String target = username + "@" + host + ":" + port;
        ClientSession session = null;
        try {
            session = client().connect(username, host, port)
                    .verify(timeout.toMillis())
                    .getSession();
            session.setKeyIdentityProvider(new FileKeyPairProvider(privateKey));
            session.auth().verify(timeout.toMillis());
            log.debug("Connected to {}", target);
            return new SshdSession(session, username, port);
        } catch (IOException | RuntimeException e) {
            closeQuietly(session);
            throw new RemoteConnectionException(target, isTimeout(e), e);
        }
    }

    @Override
    public synchronized void destroy() throws IOException {
        if (client != null) {
            client.stop();
            client.close();
            client = null;
        }
    }

    private synchronized SshClient client() {
        if (client == null) {
            client = SshClient.setUpDefaultClient();
            client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
            client.start();
        }
        return client;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) return true;
            String message = t.getMessage();
            if (message != null && message.toLowerCase().contains("timeout")) return true;
        }
        return false;
    }

    private static void closeQuietly(ClientSession session) {
        if (session == null) return;
        try {
            session.close();
        } catch (IOException e) {
            log.debug("Error closing half-open session: {}", e.getMessage());
        }
    }

    // ------------------------------------------------------------------

    private final class SshdSession implements RemoteSession {

        private final ClientSession session;
        private final String        username;
        private final int           port;

        SshdSession(ClientSession session, String username, int port) {
            this.session  = session;
            this.username = username;
            this.port     = port;
        }

        @Override public String username() { return username; }
        @Override public int port()        { return port; }

        @Override
        public CommandResult execute(String command) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            try (ChannelExec channel = session.createExecChannel(command)) {
                channel.setOut(out);
                channel.setErr(err);
                channel.open().verify(commandTimeout.toMillis());
                Set<ClientChannelEvent> events =
                        channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), commandTimeout.toMillis());
                if (events.contains(ClientChannelEvent.TIMEOUT)) {
                    throw new RemoteCommandException("Remote command timed out after "
                            + commandTimeout.toSeconds() + "s", true, null);
                }
                Integer status = channel.getExitStatus();
                return new CommandResult(status == null ? -1 : status,
                        out.toString(StandardCharsets.UTF_8),
                        err.toString(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new RemoteCommandException("Remote command failed: " + e.getMessage(), isTimeout(e), e);
            }
        }

        @Override
        public void close() {
            closeQuietly(session);
        }
    }
}
