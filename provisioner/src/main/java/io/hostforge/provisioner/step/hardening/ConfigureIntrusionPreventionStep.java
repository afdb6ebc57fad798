package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.config.IntrusionPreventionPolicy;
import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.RemoteSession;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;

/** fail2ban with an sshd jail on the port we actually use. */
@Component
public class ConfigureIntrusionPreventionStep extends RemoteHardeningStep {

    private final IntrusionPreventionPolicy policy;

    public ConfigureIntrusionPreventionStep(ConnectionNegotiator negotiator, SshKeyService keys,
                                            IntrusionPreventionPolicy policy) {
        super(negotiator, keys);
        this.policy = policy;
    }

    @Override public String  name()        { return HardeningStepName.CONFIGURE_INTRUSION_PREVENTION.key(); }
    @Override public String  description() { return "Configure fail2ban"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        runChecked(session, "Install fail2ban", HardeningScripts.installPackage("fail2ban"));
        runChecked(session, "Write fail2ban jail", HardeningScripts.writeFile(
                HardeningScripts.FAIL2BAN_JAIL, HardeningScripts.fail2banJail(session.port(), policy), "644"));
        runChecked(session, "Start fail2ban", HardeningScripts.enableService("fail2ban"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sshPort", session.port());
        data.put("banTime", policy.banTimeSec());
        data.put("findTime", policy.findTimeSec());
        data.put("maxRetry", policy.maxRetry());
        return data;
    }
}
