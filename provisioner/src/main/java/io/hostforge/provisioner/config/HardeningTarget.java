package io.hostforge.provisioner.config;

/**
 * The access configuration a host should end up with.
 *
 * @param defaultPort        SSH port of a freshly provisioned host (22)
 * @param targetPort         port sshd listens on once hardening is applied
 * @param originalUsername   the image's default login user (ubuntu, admin, ec2-user, ...)
 * @param deploymentUsername the user created for all further access
 * @param keyAuthOnly        disable password authentication when hardening
 */
public record HardeningTarget(
        int     defaultPort,
        int     targetPort,
        String  originalUsername,
        String  deploymentUsername,
        boolean keyAuthOnly) {

    public HardeningTarget {
        if (targetPort < 1024 || targetPort > 65535) {
            throw new ConfigurationException("Invalid SSH target port: " + targetPort,
                    "Set hostforge.ssh.target-port to a value between 1024 and 65535.");
        }
        if (deploymentUsername == null || deploymentUsername.isBlank()) {
            throw new ConfigurationException("No deployment username configured",
                    "Set hostforge.ssh.deployment-username (for example: deploy).");
        }
    }

    /** Same target, different original user (e.g. after the OS was detected). */
    public HardeningTarget withOriginalUsername(String username) {
        return new HardeningTarget(defaultPort, targetPort, username, deploymentUsername, keyAuthOnly);
    }

    public HardeningTarget withTargetPort(int port) {
        return new HardeningTarget(defaultPort, port, originalUsername, deploymentUsername, keyAuthOnly);
    }
}
