package io.hostforge.provisioner.connection;

import io.hostforge.provisioner.HostforgeException;

import java.util.List;

/**
 * No known access path to the host works.
 *
 * Terminal for the current run: it is never offered for retry, and the
 * state document is left exactly as it was.
 */
public class LockoutException extends HostforgeException {

    private final String       host;
    private final List<String> attempted;

    public LockoutException(String host, List<String> attempted) {
        this("Locked out of " + host + ": none of " + attempted.size() + " known access paths worked "
                + attempted, host, attempted);
    }

    private LockoutException(String message, String host, List<String> attempted) {
        super(message, remediation(host));
        this.host      = host;
        this.attempted = List.copyOf(attempted);
    }

    /** Re-raise a lockout that a nested workflow already reported. */
    public static LockoutException reported(String host, String message) {
        return new LockoutException(message, host, List.of());
    }

    public String       getHost()      { return host; }
    public List<String> getAttempted() { return attempted; }

    private static String remediation(String host) {
        return String.join(System.lineSeparator(),
                "1. Check in the provider console that " + host + " is running.",
                "2. Check that its security group / firewall allows the SSH port (default and hardened).",
                "3. Check that the private key on this machine matches an authorized key on the host.",
                "4. Use the provider's serial console to restore access, then run "
                        + "'hostforge security-reset --host-id <id> --yes' to start over.");
    }
}
