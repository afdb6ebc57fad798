package io.hostforge.provisioner.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Client-side SSH settings.
 *
 * @param connectTimeout bound on TCP connect + key exchange + authentication
 * @param commandTimeout bound on a single remote command
 * @param keyDirectory   where generated key pairs are written
 * @param keyType        "rsa" or "ecdsa"
 * @param keySize        RSA modulus size, or EC curve size (256, 384, 521)
 */
public record SshSettings(
        Duration connectTimeout,
        Duration commandTimeout,
        Path     keyDirectory,
        String   keyType,
        int      keySize) {}
