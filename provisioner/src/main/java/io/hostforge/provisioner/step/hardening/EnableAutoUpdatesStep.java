package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.connection.ConnectionNegotiator;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.remote.RemoteSession;
import io.hostforge.provisioner.step.StepException;
import org.springframework.stereotype.Component;

import java.util.Map;

import static io.hostforge.provisioner.remote.RemoteCommands.runChecked;
import static io.hostforge.provisioner.remote.RemoteCommands.test;

/** unattended-upgrades for security patches. Debian family only. */
@Component
public class EnableAutoUpdatesStep extends RemoteHardeningStep {

    public EnableAutoUpdatesStep(ConnectionNegotiator negotiator, SshKeyService keys) {
        super(negotiator, keys);
    }

    @Override public String  name()        { return HardeningStepName.ENABLE_AUTO_UPDATES.key(); }
    @Override public String  description() { return "Enable automatic security updates"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    protected Map<String, Object> apply(RemoteSession session, HardeningContext ctx) {
        if (!test(session, "command -v apt-get > /dev/null 2>&1")) {
            throw new StepException(FailureKind.CONFIGURATION,
                    "Automatic updates are only supported on apt-based hosts",
                    "Skip this step and enable the distribution's update service by hand.");
        }
        runChecked(session, "Install unattended-upgrades", HardeningScripts.installPackage("unattended-upgrades"));
        runChecked(session, "Write auto-upgrades config", HardeningScripts.writeFile(
                HardeningScripts.AUTO_UPGRADES, HardeningScripts.autoUpgradesConfig(), "644"));
        runChecked(session, "Start unattended-upgrades", HardeningScripts.enableService("unattended-upgrades"));

        return Map.of("package", "unattended-upgrades");
    }
}
