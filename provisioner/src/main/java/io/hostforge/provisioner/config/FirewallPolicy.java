package io.hostforge.provisioner.config;

import java.util.List;

/** Ports opened besides SSH when the host firewall is configured. */
public record FirewallPolicy(List<Integer> allowedPorts) {

    public FirewallPolicy {
        allowedPorts = List.copyOf(allowedPorts);
    }
}
