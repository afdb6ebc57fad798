package io.hostforge.provisioner.config;

import java.util.Locale;

/**
 * Operating systems the hardening scripts know how to drive.
 *
 * Each image ships with its own default login user; that user is the
 * "original" user the negotiator tries before hardening has been applied.
 */
public enum OperatingSystem {
    UBUNTU("ubuntu"),
    DEBIAN("admin"),
    AMAZON_LINUX("ec2-user"),
    CENTOS("centos"),
    RHEL("ec2-user");

    private final String defaultUsername;

    OperatingSystem(String defaultUsername) {
        this.defaultUsername = defaultUsername;
    }

    public String defaultUsername() { return defaultUsername; }

    /** Parses "amazon-linux", "Ubuntu", etc. Unknown or blank values fall back to UBUNTU. */
    public static OperatingSystem parse(String value) {
        if (value == null || value.isBlank()) return UBUNTU;
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OperatingSystem os : values()) {
            if (os.name().equals(normalized)) return os;
        }
        return UBUNTU;
    }
}
