package io.hostforge.provisioner.integration;

/**
 * @param status "created", "unchanged", "manual" or "simulated"
 */
public record DnsRecord(String name, String type, String value, String status) {}
