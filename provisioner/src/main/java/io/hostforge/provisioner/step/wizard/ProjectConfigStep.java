package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.integration.ProjectScaffolder;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ProjectConfigStep implements Step<WizardContext> {

    private final ProjectScaffolder scaffolder;
    private final WizardSettings    settings;

    public ProjectConfigStep(ProjectScaffolder scaffolder, WizardSettings settings) {
        this.scaffolder = scaffolder;
        this.settings   = settings;
    }

    @Override public String  name()        { return WizardStepNames.PROJECT_CONFIG; }
    @Override public String  description() { return "Configure project"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("setupMode", ctx.session().getSetupMode().name().toLowerCase());
        config.put("applicationType", settings.applicationType());
        if (settings.dnsEnabled()) {
            config.put("domain", settings.domain());
        }
        Path file = scaffolder.scaffold(ctx.projectName(), ctx.projectPath(), config, ctx.dryRun());

        Map<String, Object> data = new LinkedHashMap<>(config);
        data.put("configFile", file.toString());
        return data;
    }
}
