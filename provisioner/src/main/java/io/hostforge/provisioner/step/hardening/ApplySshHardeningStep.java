package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.CommandResult;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.repository.ProvisioningStateRepository;
import io.hostforge.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;

/**
 * Moves sshd to the target port and turns off password logins.
 *
 * The only step that narrows access. It runs only once the key and the
 * deployment user are recorded as done, re-proves the deployment user's
 * login before touching sshd, and records the new access path only after
 * logging in through it.
 */
@Component
public class ApplySshHardeningStep extends RemoteHardeningStep {

    private static final Logger log = LoggerFactory.getLogger(ApplySshHardeningStep.class);

    private final ProvisioningStateRepository repository;

    public ApplySshHardeningStep(ConnectionNegotiator negotiator, SshKeyService keys,
                                 ProvisioningStateRepository repository) {
        super(negotiator, keys);
        this.repository = repository;
    }

    @Override public String  name()        { return HardeningStepName.APPLY_SSH_HARDENING.key(); }
    @Override public String  description() { return "Harden sshd (port, key-only login)"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public List<String> prerequisites() {
        return List.of(HardeningStepName.DEPLOY_PUBLIC_KEY.key(), HardeningStepName.CREATE_DEPLOYMENT_USER.key());
    }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        String user = ctx.target().deploymentUsername();
        int    port = ctx.target().targetPort();

        // The new access path must work before the old one is narrowed.
        verifyLogin(ctx, user, session.port(), "pre-hardening");

        runChecked(session, "Enable sshd drop-in directory", HardeningScripts.ensureSshdIncludesDropIns());
        runChecked(session, "Open port " + port + " in active firewall", HardeningScripts.openPortIfFirewallActive(port));
        runChecked(session, "Write sshd hardening config", HardeningScripts.writeFile(
                HardeningScripts.SSHD_DROP_IN, HardeningScripts.sshdDropIn(port, ctx.target().keyAuthOnly()), "644"));

        CommandResult check = session.execute(HardeningScripts.validateSshdConfig());
        if (!check.succeeded()) {
            session.execute(HardeningScripts.removeSshdDropIn());
            throw new StepException(FailureKind.CONFIGURATION,
                    "sshd rejected the hardening config: " + check.diagnostic(),
                    "The config was removed again and sshd was not restarted. Check the host's sshd version.");
        }
        runChecked(session, "Restart sshd", HardeningScripts.restartSshd());
        log.info("sshd restarted on {} with port {}", ctx.host(), port);

        verifyLogin(ctx, user, port, "hardened");
        repository.recordVerifiedAccess(ctx.state(), port, user);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sshPort", port);
        data.put("username", user);
        data.put("passwordAuthentication", !ctx.target().keyAuthOnly());
        return data;
    }
}
