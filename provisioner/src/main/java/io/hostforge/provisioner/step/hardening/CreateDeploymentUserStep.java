package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.repository.ProvisioningStateRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;

/**
 * Creates the deployment user with sudo rights and the host key authorized.
 *
 * Completes only once that user has actually logged in with the key, so
 * "deployment user reachable" is part of this step's completion, not an
 * assumption carried into the hardening step.
 */
@Component
public class CreateDeploymentUserStep extends RemoteHardeningStep {

    private final ProvisioningStateRepository repository;

    public CreateDeploymentUserStep(ConnectionNegotiator negotiator, SshKeyService keys,
                                    ProvisioningStateRepository repository) {
        super(negotiator, keys);
        this.repository = repository;
    }

    @Override public String  name()        { return HardeningStepName.CREATE_DEPLOYMENT_USER.key(); }
    @Override public String  description() { return "Create deployment user"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public List<String> prerequisites() {
        return List.of(HardeningStepName.DEPLOY_PUBLIC_KEY.key());
    }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        String user = ctx.target().deploymentUsername();
        SshKeyService.HostKey key = hostKey(ctx);

        runChecked(session, "Create user " + user, HardeningScripts.createUserIfAbsent(user));
        runChecked(session, "Grant admin group to " + user, HardeningScripts.grantAdminGroup(user));
        runChecked(session, "Install sudoers entry for " + user, HardeningScripts.grantPasswordlessSudo(user));
        runChecked(session, "Authorize key for " + user, HardeningScripts.authorizeKeyForUser(user, key.publicKey()));

        verifyLogin(ctx, user, session.port(), "deploy-user");
        repository.updateConnection(ctx.state(), c -> c.setDeploymentUsername(user));

        return Map.of("username", user, "verifiedOnPort", session.port());
    }
}
