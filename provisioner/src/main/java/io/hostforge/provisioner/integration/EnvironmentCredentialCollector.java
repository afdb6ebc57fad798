package io.hostforge.provisioner.integration;

import io.hostforge.provisioner.config.ConfigurationException;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads credentials from the Spring environment, so they can come from
 * environment variables ({@code HOSTFORGE_CREDENTIALS_ACCESS_KEY_ID}) or a
 * local, uncommitted application.yml.
 */
@Component
public class EnvironmentCredentialCollector implements CredentialCollector {

    private final Environment env;

    public EnvironmentCredentialCollector(Environment env) {
        this.env = env;
    }

    @Override
    public Credentials collect(boolean dryRun) {
        Credentials credentials = new Credentials(
                env.getProperty("hostforge.credentials.cloud-provider", "aws"),
                env.getProperty("hostforge.credentials.access-key-id"),
                env.getProperty("hostforge.credentials.secret-access-key"),
                env.getProperty("hostforge.credentials.region"),
                env.getProperty("hostforge.credentials.dns-provider", "manual"),
                env.getProperty("hostforge.credentials.dns-token"),
                env.getProperty("hostforge.credentials.git-token"));

        List<String> missing = new ArrayList<>();
        if (isBlank(credentials.region())) missing.add("hostforge.credentials.region");
        if (!dryRun) {
            if (isBlank(credentials.accessKeyId()))     missing.add("hostforge.credentials.access-key-id");
            if (isBlank(credentials.secretAccessKey())) missing.add("hostforge.credentials.secret-access-key");
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing credentials: " + String.join(", ", missing),
                    "Set them as environment variables (e.g. HOSTFORGE_CREDENTIALS_REGION), then save, exit and resume.");
        }
        return credentials;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
