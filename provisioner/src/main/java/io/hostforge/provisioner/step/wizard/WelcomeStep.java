package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WelcomeStep implements Step<WizardContext> {

    @Override public String  name()        { return WizardStepNames.WELCOME; }
    @Override public String  description() { return "Welcome"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectName", ctx.projectName());
        data.put("setupMode", ctx.session().getSetupMode().name());
        data.put("dryRun", ctx.dryRun());
        return data;
    }
}
