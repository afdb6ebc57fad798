package io.hostforge.provisioner.integration;

import java.util.List;

/**
 * @param status "issued", "manual" or "simulated"
 */
public record CertificateResult(List<String> domains, String challengeType, String status) {

    public CertificateResult {
        domains = List.copyOf(domains);
    }
}
