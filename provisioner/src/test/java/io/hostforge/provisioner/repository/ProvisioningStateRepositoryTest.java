package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.config.ProvisionerConfig;
import io.hostforge.provisioner.model.FailureKind;
import io.hostforge.provisioner.model.HardeningStepName;
import io.hostforge.provisioner.model.ProvisioningState;
import io.hostforge.provisioner.model.StepFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvisioningStateRepositoryTest {

    static final HardeningTarget TARGET = new HardeningTarget(22, 2847, "ubuntu", "deploy", true);

    @TempDir Path stateDir;

    ProvisioningStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ProvisioningStateRepository(stateDir,
                new JsonDocumentStore(ProvisionerConfig.newObjectMapper()), TARGET);
    }

    // ------------------------------------------------------------------
    // loadOrCreate()
    // ------------------------------------------------------------------

    @Test
    void loadOrCreate_unknownHost_persistsFreshDocument() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");

        assertThat(Files.exists(stateDir.resolve("hosts/web-1.json"))).isTrue();
        assertThat(state.completedSteps()).isEmpty();
        assertThat(state.getSteps()).containsOnlyKeys(HardeningStepName.keys());
        assertThat(state.getConnection().getCurrentPort()).isEqualTo(22);
        assertThat(state.getConnection().getOriginalUsername()).isEqualTo("ubuntu");
        assertThat(state.getCurrentPhase()).isEqualTo(ProvisioningState.PHASE_NOT_STARTED);
    }

    @Test
    void loadOrCreate_existingHost_returnsStoredProgress() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.markStepCompleted(state, "generateKeyPair", Map.of("fingerprint", "SHA256:abc"));

        ProvisioningState reloaded = repository.loadOrCreate("web-1", "198.51.100.7");

        assertThat(reloaded.completedSteps()).containsExactly("generateKeyPair");
        assertThat(reloaded.step("generateKeyPair").getData()).containsEntry("fingerprint", "SHA256:abc");
        assertThat(reloaded.step("generateKeyPair").getTimestamp()).isNotNull();
    }

    @Test
    void saveAndLoad_keepsStepDataExactlyAsRecorded() throws Exception {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.markStepCompleted(state, "generateKeyPair", Map.of("fingerprint", "SHA256:abc"));
        repository.markStepSkipped(state, "enableAutoUpdates", "not wanted");

        ProvisioningState reloaded = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.updatePhase(reloaded, "deployPublicKey");
        ProvisioningState again = repository.loadOrCreate("web-1", "198.51.100.7");

        assertThat(again.step("generateKeyPair").getData()).containsExactly(Map.entry("fingerprint", "SHA256:abc"));
        assertThat(again.step("enableAutoUpdates").getData()).containsExactly(Map.entry("skipReason", "not wanted"));
        assertThat(again.step("deployPublicKey").getData()).isEmpty();
        assertThat(Files.readString(stateDir.resolve("hosts/web-1.json"))).doesNotContain("\"done\"");
    }

    @Test
    void load_derivedDoneFlagFromOlderWrites_isDropped() throws Exception {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        Path file = stateDir.resolve("hosts/web-1.json");
        Files.writeString(file, Files.readString(file)
                .replace("\"completed\" : false", "\"completed\" : false, \"done\" : false"));

        ProvisioningState reloaded = repository.loadOrCreate("web-1", state.getHostAddress());

        assertThat(reloaded.getSteps().values()).allSatisfy(step -> assertThat(step.getData()).isEmpty());
    }

    @Test
    void pathFor_rejectsIdentifiersThatEscapeTheStateDirectory() {
        assertThatThrownBy(() -> repository.pathFor("../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Test
    void save_leavesNoTempFilesBehind() throws Exception {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.updatePhase(state, "deployPublicKey");
        repository.updatePhase(state, "createDeploymentUser");

        try (var files = Files.list(stateDir.resolve("hosts"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("web-1.json");
        }
    }

    @Test
    void addError_isAppendedAndPersisted() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.addError(state, "configureFirewall",
                StepFailure.of(FailureKind.TRANSIENT, "ufw not found", null));

        ProvisioningState reloaded = repository.load("web-1").orElseThrow();
        assertThat(reloaded.getErrors()).hasSize(1);
        assertThat(reloaded.getErrors().get(0).step()).isEqualTo("configureFirewall");
        assertThat(reloaded.getErrors().get(0).kind()).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void recordVerifiedAccess_onTargetPort_marksHardeningApplied() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");

        repository.recordVerifiedAccess(state, 2847, "deploy");

        ProvisioningState reloaded = repository.load("web-1").orElseThrow();
        assertThat(reloaded.getConnection().getCurrentPort()).isEqualTo(2847);
        assertThat(reloaded.getConnection().getCurrentUsername()).isEqualTo("deploy");
        assertThat(reloaded.getConnection().isHardeningApplied()).isTrue();
    }

    // ------------------------------------------------------------------
    // Completion is monotonic
    // ------------------------------------------------------------------

    @Test
    void resetStepData_onCompletedStep_isRefused() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.markStepCompleted(state, "generateKeyPair", Map.of());

        assertThatThrownBy(() -> repository.resetStepData(state, "generateKeyPair"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(repository.load("web-1").orElseThrow().isStepCompleted("generateKeyPair")).isTrue();
    }

    @Test
    void resetStepData_onIncompleteStep_clearsItsData() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        state.step("deployPublicKey").getData().put("partial", true);
        repository.save(state);

        repository.resetStepData(state, "deployPublicKey");

        assertThat(repository.load("web-1").orElseThrow().step("deployPublicKey").getData()).isEmpty();
    }

    @Test
    void reset_replacesDocumentButKeepsAddress() {
        ProvisioningState state = repository.loadOrCreate("web-1", "198.51.100.7");
        repository.markStepCompleted(state, "generateKeyPair", Map.of());
        repository.recordVerifiedAccess(state, 2847, "deploy");

        ProvisioningState fresh = repository.reset("web-1");

        assertThat(fresh.completedSteps()).isEmpty();
        assertThat(fresh.getHostAddress()).isEqualTo("198.51.100.7");
        assertThat(fresh.getConnection().isHardeningApplied()).isFalse();
        assertThat(repository.load("web-1").orElseThrow().completedSteps()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Migration
    // ------------------------------------------------------------------

    @Test
    void load_legacyDocument_isMigrated() throws Exception {
        Files.createDirectories(stateDir.resolve("hosts"));
        Files.writeString(stateDir.resolve("hosts/i-0abc.json"), """
                {
                  "instanceId": "i-0abc",
                  "hostAddress": "198.51.100.7",
                  "steps": {
                    "sshKeyGeneration": { "completed": true, "keyPath": "/home/op/.ssh/hostforge_i-0abc" },
                    "sshKeyDeployment": { "completed": true }
                  },
                  "connection": { "currentPort": 2847, "currentUsername": "deploy", "sshHardeningApplied": true },
                  "somethingNew": 42
                }
                """);

        ProvisioningState state = repository.load("i-0abc").orElseThrow();

        assertThat(state.getHostIdentifier()).isEqualTo("i-0abc");
        assertThat(state.getSchemaVersion()).isEqualTo(ProvisioningState.SCHEMA_VERSION);
        assertThat(state.completedSteps()).containsExactly("generateKeyPair", "deployPublicKey");
        assertThat(state.step("generateKeyPair").getData())
                .containsEntry("keyPath", "/home/op/.ssh/hostforge_i-0abc");
        assertThat(state.getSteps()).containsOnlyKeys(HardeningStepName.keys());
        assertThat(state.getConnection().isHardeningApplied()).isTrue();
        assertThat(state.getConnection().getOriginalUsername()).isEqualTo("ubuntu");
    }
}
