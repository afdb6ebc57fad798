package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.model.Session;
import io.hostforge.provisioner.model.SetupMode;

import java.util.List;
import java.util.Map;

/** Session and settings builders shared by the wizard step tests. */
final class WizardSteps {

    private WizardSteps() {}

    static WizardSettings settings(String domain, String email) {
        return new WizardSettings("t3.small", "ubuntu", domain, List.of("www", " api "), email,
                "http-01", "node", 3000);
    }

    static WizardContext context(boolean dryRun, Map<String, Map<String, Object>> results) {
        Session session = Session.start("My Shop", "/tmp/my-shop", SetupMode.QUICK, dryRun,
                List.of("welcome", "credentials", "project-config", "infrastructure", "dns-config",
                        "ssl-config", "security", "application", "validation", "deployment"));
        session.getStepResults().putAll(results);
        return new WizardContext(session);
    }
}
