package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class SslConfigStep implements Step<WizardContext> {

    private final WizardSettings settings;

    public SslConfigStep(WizardSettings settings) {
        this.settings = settings;
    }

    @Override public String  name()        { return WizardStepNames.SSL_CONFIG; }
    @Override public String  description() { return "Configure certificates"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        Map<String, Object> dns = ctx.result(WizardStepNames.DNS_CONFIG);
        Map<String, Object> data = new LinkedHashMap<>();
        if (!Boolean.TRUE.equals(dns.get("enabled"))) {
            data.put("enabled", false);
            data.put("provider", "manual");
            data.put("reason", "DNS automation disabled");
            return data;
        }
        String email = settings.certificateEmail();
        if (email == null || !email.matches("[^\\s@]+@[^\\s@]+\\.[^\\s@]+")) {
            throw new StepException(FailureKind.CONFIGURATION,
                    "A valid contact email is required for certificates, got '" + email + "'",
                    "Set hostforge.wizard.certificate-email, or skip this step to manage certificates by hand.");
        }
        data.put("enabled", true);
        data.put("provider", "letsencrypt");
        data.put("email", email);
        data.put("challengeType", settings.challengeType());
        data.put("domains", dns.get("domains"));
        data.put("autoRenewal", true);
        return data;
    }
}
