package io.hostforge.provisioner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of running one step once.
 *
 * @param data side-effect data to store with the completion record (never null)
 */
public record StepOutcome(String stepName, Status status, StepFailure failure, Map<String, Object> data) {

    public enum Status { SUCCESS, FAILURE, SKIPPED }

    public StepOutcome {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static StepOutcome success(String stepName, Map<String, Object> data) {
        return new StepOutcome(stepName, Status.SUCCESS, null, data);
    }

    public static StepOutcome failure(String stepName, StepFailure failure) {
        return new StepOutcome(stepName, Status.FAILURE, failure, Map.of());
    }

    public static StepOutcome skipped(String stepName, String reason) {
        return new StepOutcome(stepName, Status.SKIPPED, null, Map.of("skipReason", reason));
    }

    public boolean failed() { return status == Status.FAILURE; }
}
