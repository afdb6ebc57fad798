package io.hostforge.provisioner.integration;

/** Source of provider credentials. */
public interface CredentialCollector {

    /**
     * @param dryRun when true, missing cloud credentials are tolerated
     * @throws io.hostforge.provisioner.config.ConfigurationException when required values are missing
     */
    Credentials collect(boolean dryRun);
}
