package io.hostforge.provisioner.config;

import java.util.List;

/**
 * fail2ban jail settings.
 *
 * @param banTimeSec  how long an offending address stays banned
 * @param findTimeSec window in which maxRetry failures trigger a ban
 * @param maxRetry    failures tolerated inside the window
 * @param ignoreIps   never banned
 */
public record IntrusionPreventionPolicy(
        int          banTimeSec,
        int          findTimeSec,
        int          maxRetry,
        List<String> ignoreIps) {

    public IntrusionPreventionPolicy {
        if (banTimeSec < 300) {
            throw new ConfigurationException("fail2ban ban time of " + banTimeSec + "s is too short",
                    "Set hostforge.intrusion-prevention.ban-time to at least 300 seconds.");
        }
        if (maxRetry < 1 || maxRetry > 10) {
            throw new ConfigurationException("fail2ban max retry must be between 1 and 10, got " + maxRetry,
                    "Adjust hostforge.intrusion-prevention.max-retry.");
        }
        ignoreIps = List.copyOf(ignoreIps);
    }
}
