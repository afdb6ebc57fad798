package io.hostforge.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/** One failure, appended to the state document before anything else happens. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorEntry(Instant timestamp, String step, String message, FailureKind kind) {}
