package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.step.Step;
import io.hostforge.provisioner.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Cross-checks everything collected so far before anything is created. */
@Component
public class ValidationStep implements Step<WizardContext> {

    private static final Logger log = LoggerFactory.getLogger(ValidationStep.class);

    @Override public String  name()        { return WizardStepNames.VALIDATION; }
    @Override public String  description() { return "Validate configuration"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        List<String> errors   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Map<String, Object> credentials = ctx.result(WizardStepNames.CREDENTIALS);
        if (credentials.get("region") == null) {
            errors.add("cloud region is missing");
        }
        if (!Boolean.TRUE.equals(credentials.get("dnsToken")) && !"manual".equals(credentials.get("dnsProvider"))) {
            warnings.add("no DNS token; records will have to be created by hand");
        }

        Map<String, Object> infrastructure = ctx.result(WizardStepNames.INFRASTRUCTURE);
        if (infrastructure.get("instanceName") == null) {
            errors.add("infrastructure plan is missing (was the infrastructure step skipped?)");
        }

        Map<String, Object> ssl = ctx.result(WizardStepNames.SSL_CONFIG);
        if (Boolean.TRUE.equals(ssl.get("enabled")) && ssl.get("email") == null) {
            errors.add("certificates are enabled without a contact email");
        }

        Map<String, Object> security = ctx.result(WizardStepNames.SECURITY);
        if (security.isEmpty()) {
            warnings.add("security step skipped; default hardening settings will be used");
        }

        warnings.forEach(w -> log.warn("Validation warning: {}", w));
        if (!errors.isEmpty()) {
            throw new StepException(FailureKind.CONFIGURATION,
                    "Configuration validation failed: " + String.join("; ", errors),
                    "Earlier answers are recorded in the session; start a new session with corrected settings.");
        }
        return Map.of("valid", true, "warnings", warnings);
    }
}
