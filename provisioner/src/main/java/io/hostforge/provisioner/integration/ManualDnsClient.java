package io.hostforge.provisioner.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** No DNS provider: logs the A records the operator has to create. */
@Component
public class ManualDnsClient implements DnsClient {

    private static final Logger log = LoggerFactory.getLogger(ManualDnsClient.class);

    @Override
    public List<DnsRecord> upsertRecords(String primaryDomain, List<String> subdomains, String address, boolean dryRun) {
        String status = dryRun ? "simulated" : "manual";
        List<DnsRecord> records = new ArrayList<>();
        records.add(new DnsRecord(primaryDomain, "A", address, status));
        for (String sub : subdomains) {
            records.add(new DnsRecord(sub + "." + primaryDomain, "A", address, status));
        }
        for (DnsRecord record : records) {
            log.info("Create DNS record: {} {} {}", record.name(), record.type(), record.value());
        }
        return records;
    }
}
