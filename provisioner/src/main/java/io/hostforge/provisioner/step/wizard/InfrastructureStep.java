package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.OperatingSystem;
import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Decides what to provision. Nothing is created until the deployment step. */
@Component
public class InfrastructureStep implements Step<WizardContext> {

    private final WizardSettings settings;

    public InfrastructureStep(WizardSettings settings) {
        this.settings = settings;
    }

    @Override public String  name()        { return WizardStepNames.INFRASTRUCTURE; }
    @Override public String  description() { return "Plan infrastructure"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        OperatingSystem os = OperatingSystem.parse(settings.operatingSystem());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("instanceName", instanceName(ctx.projectName()));
        data.put("instanceType", settings.instanceType());
        data.put("operatingSystem", os.name().toLowerCase(Locale.ROOT).replace('_', '-'));
        data.put("defaultUsername", os.defaultUsername());
        data.put("region", ctx.result(WizardStepNames.CREDENTIALS).get("region"));
        return data;
    }

    static String instanceName(String projectName) {
        String slug = projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return (slug.isEmpty() ? "project" : slug) + "-server";
    }
}
