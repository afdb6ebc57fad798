package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.ConnectionScenario;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepException;

import java.util.Map;

/**
 * Base for hardening steps that run commands on the host.
 *
 * Opens a session through the negotiator, so every step starts from an
 * access path that has just been proven, and closes it afterwards.
 */
public abstract class RemoteHardeningStep implements Step<HardeningContext> {

    protected final ConnectionNegotiator negotiator;
    protected final SshKeyService        keys;

    protected RemoteHardeningStep(ConnectionNegotiator negotiator, SshKeyService keys) {
        this.negotiator = negotiator;
        this.keys       = keys;
    }

    @Override
    public final Map<String, Object> run(HardeningContext ctx) throws Exception {
        try (RemoteSession session = negotiator.ensureConnected(ctx.state(), ctx.target())) {
            return apply(session, ctx);
        }
    }

    protected abstract Map<String, Object> apply(RemoteSession session, HardeningContext ctx) throws Exception;

    protected SshKeyService.HostKey hostKey(HardeningContext ctx) {
        return keys.load(ctx.state().getHostIdentifier())
                .orElseThrow(() -> new StepException(FailureKind.CONFIGURATION,
                        "No key pair found for " + ctx.state().getHostIdentifier(),
                        "Run 'hostforge security-reset' to regenerate and redeploy the key."));
    }

    /** Prove that {@code username} can log in on {@code port} with the host key. */
    protected void verifyLogin(HardeningContext ctx, String username, int port, String label) {
        negotiator.verify(ctx.host(),
                new ConnectionScenario(username, port, hostKey(ctx).privateKeyPath(), false, label));
    }
}
