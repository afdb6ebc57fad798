package io.hostforge.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Completion record of one hardening step.
 *
 * There is no way to set {@code completed} back to false: a
 * record only ever moves forward. Un-completing a step means replacing the
 * whole document through a confirmed reset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepRecord {

    @JsonProperty private boolean completed;
    @JsonProperty private boolean skipped;
    @JsonProperty private Instant timestamp;
    @JsonProperty private Map<String, Object> data = new LinkedHashMap<>();

    public StepRecord() {}

    public boolean isCompleted()         { return completed; }
    public boolean isSkipped()           { return skipped; }
    public Instant getTimestamp()        { return timestamp; }
    public Map<String, Object> getData() { return data; }

    /** Completed or explicitly skipped: either way the sequencer may move past it. */
    @JsonIgnore
    public boolean isDone() { return completed || skipped; }

    public void complete(Map<String, Object> stepData, Instant at) {
        this.completed = true;
        this.timestamp = at;
        if (stepData != null) this.data.putAll(stepData);
    }

    public void skip(String reason, Instant at) {
        this.skipped   = true;
        this.timestamp = at;
        this.data.put("skipReason", reason);
    }

    public void clearData() {
        this.data.clear();
    }

    // Older documents flattened the step data into the record itself.
    @JsonAnySetter
    void putFlattenedField(String key, Object value) {
        data.put(key, value);
    }
}
