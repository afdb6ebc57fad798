package io.hostforge.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One run (or resumable attempt) of the setup wizard.
 *
 * Steps run strictly in {@code stepOrder}; a step is complete exactly when its
 * index is below {@code currentStepIndex}. {@code stepResults} holds whatever
 * payload each step produced, for later steps to read.
 *
 * Stored as {@code <projectPath>/.hostforge/wizard/<id>.json}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {

    private String       id;
    private String       projectName;
    private String       projectPath;
    private SetupMode    setupMode = SetupMode.QUICK;
    private boolean      dryRun;
    private List<String> stepOrder = new ArrayList<>();
    private int          currentStepIndex;

    private Map<String, Object> stepResults  = new LinkedHashMap<>();
    private Map<String, String> skippedSteps = new LinkedHashMap<>();
    private List<ErrorEntry>    errors       = new ArrayList<>();

    private boolean completed;
    private Instant createdAt = Instant.now();
    private Instant updatedAt = Instant.now();
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Session() {}   // required by Jackson

    public static Session start(String projectName, String projectPath, SetupMode mode,
                                boolean dryRun, List<String> stepOrder) {
        Session session = new Session();
        session.id          = UUID.randomUUID().toString();
        session.projectName = projectName;
        session.projectPath = projectPath;
        session.setupMode   = mode;
        session.dryRun      = dryRun;
        session.stepOrder   = new ArrayList<>(stepOrder);
        return session;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Completed or skipped: in both cases its index is behind the cursor. */
    public boolean isStepDone(String stepName) {
        int index = stepOrder.indexOf(stepName);
        return index >= 0 && index < currentStepIndex;
    }

    public boolean isStepSkipped(String stepName) {
        return skippedSteps.containsKey(stepName);
    }

    @JsonIgnore
    public int percentComplete() {
        return stepOrder.isEmpty() ? 100 : Math.round(100f * currentStepIndex / stepOrder.size());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> resultOf(String stepName) {
        Object value = stepResults.get(stepName);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String              getId()               { return id; }
    public String              getProjectName()      { return projectName; }
    public String              getProjectPath()      { return projectPath; }
    public SetupMode           getSetupMode()        { return setupMode; }
    public boolean             isDryRun()            { return dryRun; }
    public List<String>        getStepOrder()        { return stepOrder; }
    public int                 getCurrentStepIndex() { return currentStepIndex; }
    public Map<String, Object> getStepResults()      { return stepResults; }
    public Map<String, String> getSkippedSteps()     { return skippedSteps; }
    public List<ErrorEntry>    getErrors()           { return errors; }
    public boolean             isCompleted()         { return completed; }
    public Instant             getCreatedAt()        { return createdAt; }
    public Instant             getUpdatedAt()        { return updatedAt; }
    public Instant             getCompletedAt()      { return completedAt; }

    public void setCurrentStepIndex(int v)  { this.currentStepIndex = v; }
    public void setDryRun(boolean v)        { this.dryRun = v; }
    public void touch()                     { this.updatedAt = Instant.now(); }

    public void markCompleted() {
        this.completed   = true;
        this.completedAt = Instant.now();
    }
}
