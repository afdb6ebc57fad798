package io.hostforge.provisioner.integration;

import java.util.Map;

/**
 * A cloud resource as reported by a {@link CloudResourceClient}.
 *
 * @param simulated true for dry-run results; nothing was created
 */
public record CloudResource(
        String              name,
        String              type,
        String              id,
        String              address,
        String              status,
        Map<String, String> properties,
        boolean             simulated) {

    public CloudResource {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static CloudResource simulated(String name, String type, Map<String, String> properties) {
        return new CloudResource(name, type, "dry-run-" + name, "203.0.113.10", "simulated", properties, true);
    }
}
