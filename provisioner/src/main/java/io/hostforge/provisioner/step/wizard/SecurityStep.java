package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.FirewallPolicy;
import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.config.IntrusionPreventionPolicy;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Records the hardening settings the deployment step will apply. */
@Component
public class SecurityStep implements Step<WizardContext> {

    private final HardeningTarget           target;
    private final FirewallPolicy            firewall;
    private final IntrusionPreventionPolicy intrusionPrevention;

    public SecurityStep(HardeningTarget target, FirewallPolicy firewall,
                        IntrusionPreventionPolicy intrusionPrevention) {
        this.target              = target;
        this.firewall            = firewall;
        this.intrusionPrevention = intrusionPrevention;
    }

    @Override public String  name()        { return WizardStepNames.SECURITY; }
    @Override public String  description() { return "Configure host security"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sshPort", target.targetPort());
        data.put("deploymentUser", target.deploymentUsername());
        data.put("keyAuthOnly", target.keyAuthOnly());
        data.put("firewallPorts", firewall.allowedPorts());
        data.put("banTime", intrusionPrevention.banTimeSec());
        data.put("maxRetry", intrusionPrevention.maxRetry());
        data.put("autoUpdates", true);
        return data;
    }
}
