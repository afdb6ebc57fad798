package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.repository.ProvisioningStateRepository;
import org.springframework.stereotype.Component;

import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;

/**
 * Authorizes the generated key for the user we are currently logged in as,
 * proves it works, and from then on connects with it.
 */
@Component
public class DeployPublicKeyStep extends RemoteHardeningStep {

    private final ProvisioningStateRepository repository;

    public DeployPublicKeyStep(ConnectionNegotiator negotiator, SshKeyService keys,
                               ProvisioningStateRepository repository) {
        super(negotiator, keys);
        this.repository = repository;
    }

    @Override public String  name()        { return HardeningStepName.DEPLOY_PUBLIC_KEY.key(); }
    @Override public String  description() { return "Deploy public key to the host"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        SshKeyService.HostKey key = hostKey(ctx);
        runChecked(session, "Authorize key for " + session.username(),
                HardeningScripts.authorizeKeyForCurrentUser(key.publicKey()));

        verifyLogin(ctx, session.username(), session.port(), "new-key");
        repository.updateConnection(ctx.state(), c -> c.setPrivateKeyPath(key.privateKeyPath()));

        return Map.of("authorizedFor", session.username(), "fingerprint", key.fingerprint());
    }
}
