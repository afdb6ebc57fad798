package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.integration.CredentialCollector;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Collects provider credentials. Only a masked summary is kept in the session. */
@Component
public class CredentialsStep implements Step<WizardContext> {

    private final CredentialCollector collector;

    public CredentialsStep(CredentialCollector collector) {
        this.collector = collector;
    }

    @Override public String  name()        { return WizardStepNames.CREDENTIALS; }
    @Override public String  description() { return "Collect provider credentials"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public Map<String, Object> run(WizardContext ctx) {
        return collector.collect(ctx.dryRun()).summary();
    }
}
