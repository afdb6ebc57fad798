package io.hostforge.provisioner.integration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider credentials. Held in memory only; {@link #summary()} is what gets
 * written to disk.
 */
public record Credentials(
        String cloudProvider,
        String accessKeyId,
        String secretAccessKey,
        String region,
        String dnsProvider,
        String dnsToken,
        String gitToken) {

    /** Non-secret view: identifiers masked, secrets reduced to presence flags. */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("cloudProvider", cloudProvider);
        summary.put("accessKeyId", mask(accessKeyId));
        summary.put("region", region);
        summary.put("dnsProvider", dnsProvider);
        summary.put("dnsToken", present(dnsToken));
        summary.put("gitToken", present(gitToken));
        return summary;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    static String mask(String value) {
        if (!present(value)) return null;
        return value.length() <= 4 ? "****" : "****" + value.substring(value.length() - 4);
    }
}
