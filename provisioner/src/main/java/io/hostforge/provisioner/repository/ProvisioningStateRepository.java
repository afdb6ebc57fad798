package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.model.ConnectionRecord;
import io.hostforge.provisioner.model.ErrorEntry;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.model.ProvisioningState;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.model.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Load/save for per-host {@link ProvisioningState} documents.
 *
 * All mutators persist before returning. Documents written by older versions
 * are migrated on load: legacy step names are renamed, missing steps are added
 * as incomplete, missing fields keep their defaults.
 */
@Component
public class ProvisioningStateRepository {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningStateRepository.class);

    static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path              hostsDir;
    private final JsonDocumentStore store;
    private final HardeningTarget   target;

    public ProvisioningStateRepository(
            @Value("${hostforge.state-dir:.hostforge}") Path stateDir,
            JsonDocumentStore store,
            HardeningTarget target) {
        this.hostsDir = stateDir.resolve("hosts");
        this.store    = store;
        this.target   = target;
    }

    // ------------------------------------------------------------------
    // Load / save
    // ------------------------------------------------------------------

    public Optional<ProvisioningState> load(String hostIdentifier) {
        return store.read(pathFor(hostIdentifier), ProvisioningState.class)
                .map(state -> normalize(state, hostIdentifier));
    }

    public ProvisioningState loadOrCreate(String hostIdentifier, String hostAddress) {
        return loadOrCreate(hostIdentifier, hostAddress, target);
    }

    /** Load the host's document, or create and persist a fresh one for {@code hostTarget}. */
    public ProvisioningState loadOrCreate(String hostIdentifier, String hostAddress, HardeningTarget hostTarget) {
        Optional<ProvisioningState> existing = load(hostIdentifier);
        if (existing.isPresent()) {
            ProvisioningState state = existing.get();
            log.info("Loaded hardening state for {} ({} of {} steps completed)",
                    hostIdentifier, state.completedSteps().size(), HardeningStepName.values().length);
            if (hostAddress != null && !hostAddress.equals(state.getHostAddress())) {
                state.setHostAddress(hostAddress);
                save(state);
            }
            return state;
        }
        ProvisioningState fresh = ProvisioningState.fresh(
                hostIdentifier, hostAddress, hostTarget.defaultPort(), hostTarget.originalUsername());
        save(fresh);
        log.info("Created new hardening state for {}", hostIdentifier);
        return fresh;
    }

    public void save(ProvisioningState state) {
        state.touch();
        store.write(pathFor(state.getHostIdentifier()), state);
    }

    /**
     * Replace the document with a fresh, all-incomplete one. This is the only
     * way a completed step ever becomes incomplete again; callers must have
     * the operator's explicit confirmation.
     */
    public ProvisioningState reset(String hostIdentifier) {
        Optional<ProvisioningState> previous = load(hostIdentifier);
        String address  = previous.map(ProvisioningState::getHostAddress).orElse(null);
        String original = previous.map(s -> s.getConnection().getOriginalUsername())
                .orElse(target.originalUsername());
        ProvisioningState fresh = ProvisioningState.fresh(hostIdentifier, address, target.defaultPort(), original);
        save(fresh);
        log.warn("Hardening state for {} reset to a fresh document", hostIdentifier);
        return fresh;
    }

    // ------------------------------------------------------------------
    // Transitions (each one durable before returning)
    // ------------------------------------------------------------------

    public void markStepCompleted(ProvisioningState state, String stepName, Map<String, Object> data) {
        state.step(stepName).complete(data, Instant.now());
        save(state);
        log.info("Step completed: {}", stepName);
    }

    public void markStepSkipped(ProvisioningState state, String stepName, String reason) {
        state.step(stepName).skip(reason, Instant.now());
        save(state);
        log.warn("Step skipped: {} ({})", stepName, reason);
    }

    public void addError(ProvisioningState state, String stepName, StepFailure failure) {
        state.getErrors().add(new ErrorEntry(Instant.now(), stepName, failure.message(), failure.kind()));
        save(state);
    }

    public void resetStepData(ProvisioningState state, String stepName) {
        StepRecord record = state.step(stepName);
        if (record.isCompleted()) {
            throw new IllegalStateException("Step '" + stepName + "' is completed; only a full reset can undo it");
        }
        record.clearData();
        save(state);
    }

    /** Record a login that was just proven to work. */
    public void recordVerifiedAccess(ProvisioningState state, int port, String username) {
        state.getConnection().applyVerified(port, username, target.defaultPort());
        save(state);
        log.info("Verified access recorded for {}: {}@port {} (hardening applied: {})",
                state.getHostIdentifier(), username, port, state.getConnection().isHardeningApplied());
    }

    public void updateConnection(ProvisioningState state, Consumer<ConnectionRecord> change) {
        change.accept(state.getConnection());
        save(state);
    }

    public void updatePhase(ProvisioningState state, String phase) {
        state.setCurrentPhase(phase);
        save(state);
    }

    public void storeConfigSnapshot(ProvisioningState state, Map<String, Object> config) {
        state.setConfigSnapshot(new LinkedHashMap<>(config));
        save(state);
    }

    public Path pathFor(String hostIdentifier) {
        if (hostIdentifier == null || !SAFE_ID.matcher(hostIdentifier).matches()) {
            throw new IllegalArgumentException("Invalid host identifier: '" + hostIdentifier + "'");
        }
        return hostsDir.resolve(hostIdentifier + ".json");
    }

    // ------------------------------------------------------------------
    // Migration
    // ------------------------------------------------------------------

    private ProvisioningState normalize(ProvisioningState state, String hostIdentifier) {
        if (state.getHostIdentifier() == null) {
            state.setHostIdentifier(hostIdentifier);
        }
        Map<String, StepRecord> migrated = new LinkedHashMap<>();
        for (HardeningStepName name : HardeningStepName.values()) {
            StepRecord record = state.getSteps().get(name.key());
            if (record == null) record = state.getSteps().get(name.legacyKey());
            migrated.put(name.key(), record != null ? record : new StepRecord());
        }
        state.getSteps().clear();
        state.getSteps().putAll(migrated);

        if (state.getConnection().getCurrentPort() == null) {
            state.getConnection().setCurrentPort(target.defaultPort());
        }
        if (state.getConnection().getOriginalUsername() == null) {
            state.getConnection().setOriginalUsername(target.originalUsername());
        }
        if (state.getSchemaVersion() < ProvisioningState.SCHEMA_VERSION) {
            log.info("Migrated hardening state for {} from schema v{} to v{}",
                    hostIdentifier, state.getSchemaVersion(), ProvisioningState.SCHEMA_VERSION);
            state.setSchemaVersion(ProvisioningState.SCHEMA_VERSION);
        }
        return state;
    }
}
