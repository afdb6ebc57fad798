package io.hostforge.provisioner.model;

/** QUICK takes the secure defaults everywhere; ADVANCED lets every step be customised. */
public enum SetupMode {
    QUICK,
    ADVANCED
}
