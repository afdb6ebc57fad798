package io.hostforge.provisioner.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/** No ACME integration: records what needs a certificate and leaves issuance to the operator. */
@Component
public class ManualCertificateClient implements CertificateClient {

    private static final Logger log = LoggerFactory.getLogger(ManualCertificateClient.class);

    @Override
    public CertificateResult requestCertificate(List<String> domains, String email, String challengeType,
                                                boolean dryRun) {
        log.info("Certificate needed for {} (contact {}, {} challenge)", domains, email, challengeType);
        return new CertificateResult(domains, challengeType, dryRun ? "simulated" : "manual");
    }
}
