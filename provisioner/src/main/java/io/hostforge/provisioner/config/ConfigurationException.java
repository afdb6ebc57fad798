package io.hostforge.provisioner.config;

import io.hostforge.provisioner.HostforgeException;

/**
 * A required setting is missing or invalid.
 *
 * Retrying cannot fix this, so the recovery menu never offers an automatic
 * retry for it; the operator has to change the input first.
 */
public class ConfigurationException extends HostforgeException {

    public ConfigurationException(String message, String remediation) {
        super(message, remediation);
    }
}
