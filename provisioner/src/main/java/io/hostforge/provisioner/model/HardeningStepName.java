package io.hostforge.provisioner.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The seven security-hardening phases, in their one fixed order.
 *
 * {@code key} is the name written to the state document; {@code legacyKey} is
 * the name older documents used for the same phase and is migrated on load.
 */
public enum HardeningStepName {
    GENERATE_KEY_PAIR              ("generateKeyPair",              "sshKeyGeneration"),
    DEPLOY_PUBLIC_KEY              ("deployPublicKey",              "sshKeyDeployment"),
    CREATE_DEPLOYMENT_USER         ("createDeploymentUser",         "deploymentUserCreation"),
    APPLY_SSH_HARDENING            ("applySSHHardening",            "sshHardening"),
    CONFIGURE_FIREWALL             ("configureFirewall",            "firewallConfiguration"),
    CONFIGURE_INTRUSION_PREVENTION ("configureIntrusionPrevention", "fail2banConfiguration"),
    ENABLE_AUTO_UPDATES            ("enableAutoUpdates",            "autoUpdatesConfiguration");

    private final String key;
    private final String legacyKey;

    HardeningStepName(String key, String legacyKey) {
        this.key       = key;
        this.legacyKey = legacyKey;
    }

    public String key()       { return key; }
    public String legacyKey() { return legacyKey; }

    public static List<String> keys() {
        return Arrays.stream(values()).map(HardeningStepName::key).toList();
    }

    public static Optional<HardeningStepName> fromLegacyKey(String legacyKey) {
        return Arrays.stream(values()).filter(s -> s.legacyKey.equals(legacyKey)).findFirst();
    }
}
