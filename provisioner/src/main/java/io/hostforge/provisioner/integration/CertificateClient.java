package io.hostforge.provisioner.integration;

import java.util.List;

/** Certificate authority boundary (ACME or manual). */
public interface CertificateClient {

    CertificateResult requestCertificate(List<String> domains, String email, String challengeType, boolean dryRun);
}
