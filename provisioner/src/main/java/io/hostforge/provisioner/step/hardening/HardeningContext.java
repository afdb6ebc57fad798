package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.model.ProvisioningState;

/**
 * What every hardening step reads.
 *
 * @param state  the host's live document; steps read it, the repository writes it
 * @param target the access configuration the host should end up with
 */
public record HardeningContext(ProvisioningState state, HardeningTarget target) {

    public String host() {
        return state.getHostAddress();
    }

    /** A value recorded by an earlier, completed step; null when absent. */
    public Object stepData(String stepName, String key) {
        return state.step(stepName).getData().get(key);
    }
}
