package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ApplicationStep implements Step<WizardContext> {

    private final WizardSettings settings;

    public ApplicationStep(WizardSettings settings) {
        this.settings = settings;
    }

    @Override public String  name()        { return WizardStepNames.APPLICATION; }
    @Override public String  description() { return "Configure application deployment"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        boolean gitToken = Boolean.TRUE.equals(ctx.result(WizardStepNames.CREDENTIALS).get("gitToken"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("deploymentType", gitToken ? "git" : "manual");
        data.put("applicationType", settings.applicationType());
        data.put("port", settings.applicationPort());
        data.put("healthCheckPath", "/health");
        if (!gitToken) {
            data.put("reason", "No git token configured");
        }
        return data;
    }
}
