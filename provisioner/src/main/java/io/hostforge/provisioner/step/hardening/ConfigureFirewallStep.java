package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.config.FirewallPolicy;
import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.RemoteSession;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;

/** ufw: deny inbound except SSH and the configured service ports. */
@Component
public class ConfigureFirewallStep extends RemoteHardeningStep {

    private final FirewallPolicy policy;

    public ConfigureFirewallStep(ConnectionNegotiator negotiator, SshKeyService keys, FirewallPolicy policy) {
        super(negotiator, keys);
        this.policy = policy;
    }

    @Override public String  name()        { return HardeningStepName.CONFIGURE_FIREWALL.key(); }
    @Override public String  description() { return "Configure firewall"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        int sshPort = session.port();
        List<String> rules = HardeningScripts.firewallRules(sshPort, ctx.target().defaultPort(), policy);
        for (String rule : rules) {
            runChecked(session, "Firewall: " + rule, rule);
        }
        // Enabling the firewall must not have cut off the path we use.
        verifyLogin(ctx, session.username(), sshPort, "post-firewall");

        return Map.of("sshPort", sshPort, "allowedPorts", policy.allowedPorts());
    }
}
