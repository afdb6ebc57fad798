package io.hostforge.provisioner.config;

import java.util.List;

/**
 * Answers the setup wizard uses where an interactive run would ask.
 *
 * @param domain           primary domain; blank disables DNS and certificates
 * @param certificateEmail contact address for the certificate authority
 * @param challengeType    "http-01" or "dns-01"
 */
public record WizardSettings(
        String       instanceType,
        String       operatingSystem,
        String       domain,
        List<String> subdomains,
        String       certificateEmail,
        String       challengeType,
        String       applicationType,
        int          applicationPort) {

    public WizardSettings {
        subdomains = subdomains == null ? List.of()
                : subdomains.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        if (!"http-01".equals(challengeType) && !"dns-01".equals(challengeType)) {
            throw new ConfigurationException("Unknown certificate challenge type: " + challengeType,
                    "Set hostforge.wizard.challenge-type to http-01 or dns-01.");
        }
    }

    public boolean dnsEnabled() {
        return domain != null && !domain.isBlank();
    }
}
