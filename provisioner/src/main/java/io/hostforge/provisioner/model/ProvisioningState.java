package io.hostforge.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hardening progress of one target host.
 *
 * One JSON document per host under {@code <state-dir>/hosts/}. Written after
 * every transition, so it is always a faithful record of what has been
 * applied to the host and how it can currently be reached.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProvisioningState {

    public static final int SCHEMA_VERSION = 2;

    public static final String PHASE_NOT_STARTED = "not_started";
    public static final String PHASE_COMPLETED   = "completed";

    private int schemaVersion = SCHEMA_VERSION;

    @JsonAlias("instanceId")
    private String hostIdentifier;

    private String  hostAddress;
    private Instant startedAt   = Instant.now();
    private Instant lastUpdated = Instant.now();
    private String  currentPhase = PHASE_NOT_STARTED;

    private ConnectionRecord connection = new ConnectionRecord();

    // Insertion order follows HardeningStepName order for new documents.
    private Map<String, StepRecord> steps = new LinkedHashMap<>();

    @JsonAlias("config")
    private Map<String, Object> configSnapshot;

    private List<ErrorEntry> errors = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public ProvisioningState() {}   // required by Jackson

    /** A fresh, all-incomplete document. */
    public static ProvisioningState fresh(String hostIdentifier, String hostAddress,
                                          int defaultPort, String originalUsername) {
        ProvisioningState state = new ProvisioningState();
        state.hostIdentifier = hostIdentifier;
        state.hostAddress    = hostAddress;
        state.connection     = new ConnectionRecord(defaultPort, originalUsername);
        for (String key : HardeningStepName.keys()) {
            state.steps.put(key, new StepRecord());
        }
        return state;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public StepRecord step(String name) {
        StepRecord record = steps.get(name);
        if (record == null) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
        return record;
    }

    public boolean isStepCompleted(String name) {
        StepRecord record = steps.get(name);
        return record != null && record.isCompleted();
    }

    public List<String> completedSteps() {
        return steps.entrySet().stream()
                .filter(e -> e.getValue().isCompleted())
                .map(Map.Entry::getKey)
                .toList();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public int                     getSchemaVersion()  { return schemaVersion; }
    public String                  getHostIdentifier() { return hostIdentifier; }
    public String                  getHostAddress()    { return hostAddress; }
    public Instant                 getStartedAt()      { return startedAt; }
    public Instant                 getLastUpdated()    { return lastUpdated; }
    public String                  getCurrentPhase()   { return currentPhase; }
    public ConnectionRecord        getConnection()     { return connection; }
    public Map<String, StepRecord> getSteps()          { return steps; }
    public Map<String, Object>     getConfigSnapshot() { return configSnapshot; }
    public List<ErrorEntry>        getErrors()         { return errors; }

    public void setSchemaVersion(int v)                       { this.schemaVersion = v; }
    public void setHostIdentifier(String v)                   { this.hostIdentifier = v; }
    public void setHostAddress(String v)                      { this.hostAddress = v; }
    public void setCurrentPhase(String v)                     { this.currentPhase = v; }
    public void setConnection(ConnectionRecord v)             { this.connection = v; }
    public void setConfigSnapshot(Map<String, Object> v)      { this.configSnapshot = v; }
    public void touch()                                       { this.lastUpdated = Instant.now(); }
}
