package io.hostforge.provisioner.connection;

import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.config.SshSettings;
import io.hostforge.provisioner.model.ConnectionRecord;
import io.hostforge.provisioner.model.ConnectionScenario;
import io.hostforge.provisioner.model.ProvisioningState;
import io.hostforge.provisioner.remote.CommandResult;
import io.hostforge.provisioner.remote.RemoteCommandException;
import io.hostforge.provisioner.remote.RemoteConnectionException;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.remote.RemoteShell;
import io.hostforge.provisioner.repository.ProvisioningStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds out which (user, port, key) combination currently grants access to a
 * host that may be partially hardened, and records the answer.
 *
 * <ul>
 *   <li>Fast path: once hardening is known to be applied, only the persisted
 *       access path is tried. Probing the closed default port would only feed
 *       failed logins to the host's intrusion prevention.</li>
 *   <li>Probe path: (a) original user on the default port, (b) deployment
 *       user on the target port, (c) original user on the target port.
 *       First success wins.</li>
 * </ul>
 *
 * The connection record is only written after a scenario actually worked.
 * When every scenario was refused or rejected a {@link LockoutException} is
 * raised and the state is left untouched. If any of them timed out instead,
 * the timeout is rethrown: a slow host is retryable, not a lockout.
 */
@Component
public class ConnectionNegotiator {

    private static final Logger log = LoggerFactory.getLogger(ConnectionNegotiator.class);

    private final RemoteShell                 shell;
    private final ProvisioningStateRepository repository;
    private final SshSettings                 settings;

    public ConnectionNegotiator(RemoteShell shell,
                                ProvisioningStateRepository repository,
                                SshSettings settings) {
        this.shell      = shell;
        this.repository = repository;
        this.settings   = settings;
    }

    /**
     * Return an open session to the host, persisting the scenario that worked.
     *
     * @throws LockoutException when every candidate scenario is refused or rejected
     * @throws RemoteConnectionException (timed out) when no scenario worked and at least one timed out
     */
    public RemoteSession ensureConnected(ProvisioningState state, HardeningTarget target) {
        String host = state.getHostAddress();
        List<ConnectionScenario> scenarios = scenarios(state.getConnection(), target);
        List<String> attempted = new ArrayList<>();
        RuntimeException timedOut = null;

        for (ConnectionScenario scenario : scenarios) {
            if (scenario.privateKeyPath() == null) {
                log.debug("Skipping scenario {}: no private key recorded", scenario.label());
                continue;
            }
            attempted.add(scenario.describe(host));
            log.info("Trying {}", scenario.describe(host));
            RemoteSession session;
            try {
                session = open(host, scenario);
            } catch (RemoteConnectionException e) {
                log.info("Scenario {} failed: {}", scenario.label(), e.getMessage());
                if (e.isTimedOut() && timedOut == null) timedOut = e;
                continue;
            } catch (RemoteCommandException e) {
                log.info("Scenario {} failed: {}", scenario.label(), e.getMessage());
                if (e.isTimedOut() && timedOut == null) timedOut = e;
                continue;
            }
            repository.recordVerifiedAccess(state, scenario.port(), scenario.username());
            return session;
        }
        if (timedOut != null) {
            log.warn("No access path to {} worked and an attempt timed out; reporting a timeout", host);
            throw timedOut;
        }
        throw new LockoutException(host, attempted);
    }

    /**
     * Prove that {@code scenario} can log in, without touching the state.
     * Steps call this before they narrow the access that currently works.
     *
     * @throws RemoteConnectionException or {@link RemoteCommandException} when it cannot
     */
    public void verify(String host, ConnectionScenario scenario) {
        try (RemoteSession session = open(host, scenario)) {
            log.info("Verified {}", scenario.describe(host));
        }
    }

    /** Candidate scenarios in the order they are tried. */
    public List<ConnectionScenario> scenarios(ConnectionRecord connection, HardeningTarget target) {
        String key = connection.getPrivateKeyPath();
        if (connection.isHardeningApplied()) {
            int port = connection.getCurrentPort() != null ? connection.getCurrentPort() : target.targetPort();
            return List.of(new ConnectionScenario(connection.effectiveUsername(), port, key, false, "verified"));
        }
        String original = connection.getOriginalUsername() != null
                ? connection.getOriginalUsername() : target.originalUsername();
        String deploy = connection.getDeploymentUsername() != null
                ? connection.getDeploymentUsername() : target.deploymentUsername();
        return List.of(
                new ConnectionScenario(original, target.defaultPort(), key, true,  "initial"),
                new ConnectionScenario(deploy,   target.targetPort(),  key, false, "hardened"),
                new ConnectionScenario(original, target.targetPort(),  key, false, "port-only"));
    }

    // Connect and run an identity check; the session is returned open.
    private RemoteSession open(String host, ConnectionScenario scenario) {
        RemoteSession session = shell.connect(host, scenario.username(), scenario.port(),
                Path.of(scenario.privateKeyPath()), settings.connectTimeout());
        try {
            CommandResult whoami = session.execute("whoami");
            if (!whoami.succeeded() || !scenario.username().equals(whoami.stdout().trim())) {
                throw new RemoteCommandException("Identity check failed for " + scenario.describe(host)
                        + ": got '" + whoami.stdout().trim() + "'", false, null);
            }
            return session;
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }
}
