package io.hostforge.provisioner.integration;

import io.hostforge.provisioner.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cloud client for hosts that already exist.
 *
 * No provider API is called: "creating" an instance resolves it to the host
 * configured under {@code hostforge.cloud.host-address}. Without one, only
 * dry runs work.
 */
@Component
public class StaticInventoryCloudClient implements CloudResourceClient {

    private static final Logger log = LoggerFactory.getLogger(StaticInventoryCloudClient.class);

    private final String hostAddress;
    private final String privateKeyPath;

    public StaticInventoryCloudClient(
            @Value("${hostforge.cloud.host-address:}") String hostAddress,
            @Value("${hostforge.cloud.private-key-path:}") String privateKeyPath) {
        this.hostAddress    = hostAddress;
        this.privateKeyPath = privateKeyPath;
    }

    @Override
    public CloudResource create(String name, String type, Map<String, String> properties, boolean dryRun) {
        if (dryRun) {
            log.info("[dry-run] Would create {} '{}' with {}", type, name, properties);
            return CloudResource.simulated(name, type, properties);
        }
        CloudResource resource = existing(name, type, properties);
        log.info("Using existing host {} for {} '{}'", resource.address(), type, name);
        return resource;
    }

    @Override
    public Optional<CloudResource> describe(String name, boolean dryRun) {
        if (dryRun) {
            return Optional.of(CloudResource.simulated(name, "compute-instance", Map.of()));
        }
        return hostAddress.isBlank() ? Optional.empty() : Optional.of(existing(name, "compute-instance", Map.of()));
    }

    @Override
    public void delete(String name, boolean dryRun) {
        log.warn("{}'{}' is not managed by hostforge; delete it in the provider console",
                dryRun ? "[dry-run] " : "", name);
    }

    private CloudResource existing(String name, String type, Map<String, String> requested) {
        if (hostAddress.isBlank()) {
            throw new ConfigurationException("No host available for '" + name + "'",
                    "Set hostforge.cloud.host-address to the address of an existing host, or run with --dry-run.");
        }
        Map<String, String> properties = new LinkedHashMap<>(requested);
        if (!privateKeyPath.isBlank()) {
            properties.put("privateKeyPath", privateKeyPath);
        }
        return new CloudResource(name, type, name, hostAddress, "running", properties, false);
    }
}
