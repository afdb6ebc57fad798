package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.config.WizardSettings;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DnsConfigStep implements Step<WizardContext> {

    private final WizardSettings settings;

    public DnsConfigStep(WizardSettings settings) {
        this.settings = settings;
    }

    @Override public String  name()        { return WizardStepNames.DNS_CONFIG; }
    @Override public String  description() { return "Configure DNS"; }
    @Override public boolean isCritical()  { return false; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (!settings.dnsEnabled()) {
            data.put("enabled", false);
            data.put("manualSetup", true);
            data.put("provider", "manual");
            return data;
        }
        List<String> domains = new ArrayList<>();
        domains.add(settings.domain());
        settings.subdomains().forEach(sub -> domains.add(sub + "." + settings.domain()));

        data.put("enabled", true);
        data.put("provider", ctx.result(WizardStepNames.CREDENTIALS).getOrDefault("dnsProvider", "manual"));
        data.put("primaryDomain", settings.domain());
        data.put("subdomains", settings.subdomains());
        data.put("domains", domains);
        return data;
    }
}
