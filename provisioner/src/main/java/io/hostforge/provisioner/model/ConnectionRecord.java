package io.hostforge.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The last access configuration that was proven to work against the host.
 *
 * Only the negotiator and steps that have just verified a login write here;
 * nothing in this record is ever a guess.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionRecord {

    private Integer currentPort;
    private String  currentUsername;
    private String  originalUsername;
    private String  deploymentUsername;
    private String  privateKeyPath;

    @JsonAlias("sshHardeningApplied")
    private boolean hardeningApplied;

    public ConnectionRecord() {}

    public ConnectionRecord(int currentPort, String originalUsername) {
        this.currentPort      = currentPort;
        this.originalUsername = originalUsername;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Integer getCurrentPort()        { return currentPort; }
    public String  getCurrentUsername()    { return currentUsername; }
    public String  getOriginalUsername()   { return originalUsername; }
    public String  getDeploymentUsername() { return deploymentUsername; }
    public String  getPrivateKeyPath()     { return privateKeyPath; }
    public boolean isHardeningApplied()    { return hardeningApplied; }

    public void setCurrentPort(Integer port)            { this.currentPort = port; }
    public void setCurrentUsername(String username)     { this.currentUsername = username; }
    public void setOriginalUsername(String username)    { this.originalUsername = username; }
    public void setDeploymentUsername(String username)  { this.deploymentUsername = username; }
    public void setPrivateKeyPath(String path)          { this.privateKeyPath = path; }
    public void setHardeningApplied(boolean applied)    { this.hardeningApplied = applied; }

    /**
     * Record a scenario that just succeeded. Hardening counts as applied as
     * soon as access works on anything other than the default port.
     */
    public void applyVerified(int port, String username, int defaultPort) {
        this.currentPort      = port;
        this.currentUsername  = username;
        this.hardeningApplied = port != defaultPort;
    }

    /** Username to log in with: the verified one, else the image default. */
    public String effectiveUsername() {
        return currentUsername != null ? currentUsername : originalUsername;
    }
}
