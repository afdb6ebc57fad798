package io.hostforge.provisioner.integration;

import java.util.List;

/** DNS provider boundary. */
public interface DnsClient {

    /** Point {@code primaryDomain} and each subdomain at {@code address}. Idempotent. */
    List<DnsRecord> upsertRecords(String primaryDomain, List<String> subdomains, String address, boolean dryRun);
}
