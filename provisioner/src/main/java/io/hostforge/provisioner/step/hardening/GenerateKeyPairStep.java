package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.step.Step;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Creates (or reuses) the host's key pair on this machine. No remote access. */
@Component
public class GenerateKeyPairStep implements Step<HardeningContext> {

    private final SshKeyService keys;

    public GenerateKeyPairStep(SshKeyService keys) {
        this.keys = keys;
    }

    @Override public String  name()        { return HardeningStepName.GENERATE_KEY_PAIR.key(); }
    @Override public String  description() { return "Generate SSH key pair"; }
    @Override public boolean isCritical()  { return true; }

    @Override
    public Map<String, Object> run(HardeningContext ctx) {
        SshKeyService.HostKey key = keys.ensureKeyPair(ctx.state().getHostIdentifier());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("privateKeyPath", key.privateKeyPath());
        data.put("fingerprint", key.fingerprint());
        data.put("reused", key.reused());
        return data;
    }
}
