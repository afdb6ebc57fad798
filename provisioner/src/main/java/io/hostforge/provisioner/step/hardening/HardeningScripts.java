package io.hostforge.provisioner.step.hardening;

import io.hostforge.provisioner.config.FirewallPolicy;
import io.hostforge.provisioner.config.IntrusionPreventionPolicy;

import java.util.ArrayList;
import java.util.List;

import static io.hostforge.provisioner.remote.RemoteCommands.quote;

/**
 * Shell commands run by the hardening steps. Pure string builders.
 *
 * Every command converges when re-run: files are written whole, users and
 * keys are added only when absent, and firewall rules are set, not appended.
 */
public final class HardeningScripts {

    public static final String SSHD_DROP_IN     = "/etc/ssh/sshd_config.d/99-hostforge.conf";
    public static final String SUDOERS_DROP_IN  = "/etc/sudoers.d/90-hostforge";
    public static final String FAIL2BAN_JAIL    = "/etc/fail2ban/jail.local";
    public static final String AUTO_UPGRADES    = "/etc/apt/apt.conf.d/20auto-upgrades";

    private HardeningScripts() {}

    // ------------------------------------------------------------------
    // Generic helpers
    // ------------------------------------------------------------------

    /** Replace {@code path} with {@code content} as root and set its mode. */
    public static String writeFile(String path, String content, String mode) {
        return "printf '%s' " + quote(content) + " | sudo tee " + path + " > /dev/null"
                + " && sudo chmod " + mode + " " + path;
    }

    public static String installPackage(String pkg) {
        return "if command -v apt-get > /dev/null 2>&1; then"
                + " sudo DEBIAN_FRONTEND=noninteractive apt-get install -y -q " + pkg + ";"
                + " else sudo yum install -y -q " + pkg + "; fi";
    }

    // ------------------------------------------------------------------
    // Keys and users
    // ------------------------------------------------------------------

    /** Append {@code publicKey} to the login user's authorized_keys unless present. */
    public static String authorizeKeyForCurrentUser(String publicKey) {
        String key = quote(publicKey);
        return "mkdir -p ~/.ssh && chmod 700 ~/.ssh && touch ~/.ssh/authorized_keys"
                + " && chmod 600 ~/.ssh/authorized_keys"
                + " && (grep -qxF " + key + " ~/.ssh/authorized_keys"
                + " || echo " + key + " >> ~/.ssh/authorized_keys)";
    }

    public static String createUserIfAbsent(String username) {
        return "id -u " + username + " > /dev/null 2>&1 || sudo useradd -m -s /bin/bash " + username;
    }

    /** Add the user to whichever admin group the distribution has. */
    public static String grantAdminGroup(String username) {
        return "if getent group sudo > /dev/null; then sudo usermod -aG sudo " + username + ";"
                + " else sudo usermod -aG wheel " + username + "; fi";
    }

    /** Passwordless sudo through a drop-in, installed only if visudo accepts it. */
    public static String grantPasswordlessSudo(String username) {
        String tmp = "/tmp/hostforge-sudoers";
        return "printf '%s\\n' " + quote(username + " ALL=(ALL) NOPASSWD:ALL") + " > " + tmp
                + " && sudo visudo -cf " + tmp
                + " && sudo install -m 440 -o root -g root " + tmp + " " + SUDOERS_DROP_IN
                + " && rm -f " + tmp;
    }

    public static String authorizeKeyForUser(String username, String publicKey) {
        String key  = quote(publicKey);
        String home = "$(getent passwd " + username + " | cut -d: -f6)";
        String file = home + "/.ssh/authorized_keys";
        return "sudo install -d -m 700 -o " + username + " -g " + username + " " + home + "/.ssh"
                + " && sudo touch " + file
                + " && (sudo grep -qxF " + key + " " + file
                + " || echo " + key + " | sudo tee -a " + file + " > /dev/null)"
                + " && sudo chown " + username + ":" + username + " " + file
                + " && sudo chmod 600 " + file;
    }

    // ------------------------------------------------------------------
    // sshd
    // ------------------------------------------------------------------

    public static String sshdDropIn(int port, boolean keyAuthOnly) {
        List<String> lines = new ArrayList<>();
        lines.add("# Managed by hostforge");
        lines.add("Port " + port);
        lines.add("PermitRootLogin no");
        lines.add("PubkeyAuthentication yes");
        if (keyAuthOnly) {
            lines.add("PasswordAuthentication no");
            lines.add("KbdInteractiveAuthentication no");
            lines.add("ChallengeResponseAuthentication no");
        }
        lines.add("MaxAuthTries 3");
        lines.add("X11Forwarding no");
        lines.add("ClientAliveInterval 300");
        lines.add("ClientAliveCountMax 2");
        return String.join("\n", lines) + "\n";
    }

    /** Older images do not read sshd_config.d; make sure ours is. */
    public static String ensureSshdIncludesDropIns() {
        return "sudo mkdir -p /etc/ssh/sshd_config.d"
                + " && (sudo grep -q '^Include /etc/ssh/sshd_config.d/' /etc/ssh/sshd_config"
                + " || sudo sed -i '1i Include /etc/ssh/sshd_config.d/*.conf' /etc/ssh/sshd_config)";
    }

    /** If a firewall is already active, open the new port before sshd moves to it. */
    public static String openPortIfFirewallActive(int port) {
        return "if command -v ufw > /dev/null 2>&1 && sudo ufw status | grep -q 'Status: active';"
                + " then sudo ufw allow " + port + "/tcp; fi";
    }

    public static String validateSshdConfig() {
        return "sudo sshd -t";
    }

    public static String removeSshdDropIn() {
        return "sudo rm -f " + SSHD_DROP_IN;
    }

    /**
     * Restart sshd. Socket-activated sshd ignores the Port setting, so the
     * socket unit is switched off first.
     */
    public static String restartSshd() {
        return "(sudo systemctl disable --now ssh.socket > /dev/null 2>&1 || true)"
                + " && (sudo systemctl restart ssh || sudo systemctl restart sshd)";
    }

    // ------------------------------------------------------------------
    // Firewall
    // ------------------------------------------------------------------

    public static List<String> firewallRules(int sshPort, int defaultPort, FirewallPolicy policy) {
        List<String> commands = new ArrayList<>();
        commands.add("command -v ufw > /dev/null 2>&1 || (" + installPackage("ufw") + ")");
        commands.add("sudo ufw default deny incoming");
        commands.add("sudo ufw default allow outgoing");
        commands.add("sudo ufw allow " + sshPort + "/tcp");
        for (int port : policy.allowedPorts()) {
            commands.add("sudo ufw allow " + port + "/tcp");
        }
        commands.add("sudo ufw --force enable");
        if (sshPort != defaultPort) {
            commands.add("sudo ufw delete allow " + defaultPort + "/tcp || true");
        }
        return commands;
    }

    // ------------------------------------------------------------------
    // Intrusion prevention
    // ------------------------------------------------------------------

    public static String fail2banJail(int sshPort, IntrusionPreventionPolicy policy) {
        return String.join("\n",
                "# Managed by hostforge",
                "[DEFAULT]",
                "bantime = " + policy.banTimeSec(),
                "findtime = " + policy.findTimeSec(),
                "maxretry = " + policy.maxRetry(),
                "ignoreip = " + String.join(" ", policy.ignoreIps()),
                "",
                "[sshd]",
                "enabled = true",
                "port = " + sshPort,
                "") + "\n";
    }

    public static String enableService(String unit) {
        return "sudo systemctl enable " + unit + " && sudo systemctl restart " + unit;
    }

    // ------------------------------------------------------------------
    // Automatic updates
    // ------------------------------------------------------------------

    public static String autoUpgradesConfig() {
        return "APT::Periodic::Update-Package-Lists \"1\";\n"
                + "APT::Periodic::Unattended-Upgrade \"1\";\n"
                + "APT::Periodic::AutocleanInterval \"7\";\n";
    }
}
