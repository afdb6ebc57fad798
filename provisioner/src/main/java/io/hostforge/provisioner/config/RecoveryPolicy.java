package io.hostforge.provisioner.config;

import java.time.Duration;

/**
 * @param maxAttempts attempts of one step before the retry option is withdrawn
 * @param retryDelay  pause before a retried attempt
 */
public record RecoveryPolicy(int maxAttempts, Duration retryDelay) {

    public static RecoveryPolicy defaults() {
        return new RecoveryPolicy(3, Duration.ofSeconds(1));
    }
}
