package io.hostforge.provisioner.model;

/**
 * One hypothesis about what currently grants access to a host. Never persisted.
 *
 * @param label short tag used in logs ("initial", "hardened", "port-only", "verified")
 */
public record ConnectionScenario(
        String  username,
        int     port,
        String  privateKeyPath,
        boolean initialConnection,
        String  label) {

    public String describe(String host) {
        return username + "@" + host + ":" + port + " [" + label + "]";
    }
}
