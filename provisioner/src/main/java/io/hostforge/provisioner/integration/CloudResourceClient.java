package io.hostforge.provisioner.integration;

import java.util.Map;
import java.util.Optional;

/**
 * Cloud provider boundary. Every operation is keyed by a stable resource name
 * and idempotent: creating an existing resource returns it.
 *
 * With {@code dryRun} set, no side effect happens and a simulated result of
 * the same shape is returned.
 */
public interface CloudResourceClient {

    CloudResource create(String name, String type, Map<String, String> properties, boolean dryRun);

    Optional<CloudResource> describe(String name, boolean dryRun);

    void delete(String name, boolean dryRun);
}
