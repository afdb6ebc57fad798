package io.hostforge.provisioner.service;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.config.HardeningTarget;
import io.hostforge.provisioner.config.OperatingSystem;
import io.hostforge.provisioner.model.ConnectionRecord;
import io.hostforge.provisioner.model.ErrorEntry;
import io.hostforge.provisioner.model.ProvisioningState;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.repository.HostStepJournal;
import io.hostforge.provisioner.repository.ProvisioningStateRepository;
import io.hostforge.provisioner.repository.SessionLock;
import io.hostforge.provisioner.step.StepRegistry;
import io.hostforge.provisioner.step.hardening.HardeningContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the security hardening workflow for one host.
 *
 * One run per host at a time (lock file next to the state document).
 */
@Service
public class SecurityHardeningService {

    private static final Logger log = LoggerFactory.getLogger(SecurityHardeningService.class);

    private final ProvisioningStateRepository    repository;
    private final StepRegistry<HardeningContext> registry;
    private final SessionOrchestrator            orchestrator;
    private final HardeningTarget                defaultTarget;

    public SecurityHardeningService(ProvisioningStateRepository repository,
                                    StepRegistry<HardeningContext> hardeningWorkflow,
                                    SessionOrchestrator orchestrator,
                                    HardeningTarget defaultTarget) {
        this.repository    = repository;
        this.registry      = hardeningWorkflow;
        this.orchestrator  = orchestrator;
        this.defaultTarget = defaultTarget;
    }

    /**
     * @param initialKey      key the host accepts before hardening (only used until our own key is deployed)
     * @param operatingSystem overrides the configured OS when deriving the original user; may be null
     */
    public record HardeningRequest(String hostIdentifier, String hostAddress, Path initialKey, String operatingSystem) {}

    public WorkflowResult harden(HardeningRequest request) {
        HardeningTarget target = request.operatingSystem() == null ? defaultTarget
                : defaultTarget.withOriginalUsername(OperatingSystem.parse(request.operatingSystem()).defaultUsername());

        Map<String, String> outerMdc = MDC.getCopyOfContextMap();
        MDC.put("host", request.hostIdentifier());
        try (SessionLock lock = SessionLock.acquire(lockFile(request.hostIdentifier()))) {
            ProvisioningState state = repository.loadOrCreate(request.hostIdentifier(), request.hostAddress(), target);

            if (state.getConnection().getPrivateKeyPath() == null && request.initialKey() != null) {
                String key = request.initialKey().toAbsolutePath().toString();
                repository.updateConnection(state, c -> c.setPrivateKeyPath(key));
            }
            if (state.getConnection().getPrivateKeyPath() == null) {
                throw new ConfigurationException("No SSH key known for host " + request.hostIdentifier(),
                        "Pass --key with the private key the host was created with.");
            }
            if (state.getConfigSnapshot() == null) {
                repository.storeConfigSnapshot(state, snapshot(target));
            }

            HostStepJournal journal = new HostStepJournal(repository, state);
            if (registry.canResume(journal)) {
                StepRegistry.Progress progress = registry.progress(journal);
                log.info("Resuming hardening of {} at {} ({}% done)",
                        request.hostIdentifier(), progress.nextStep(), progress.percentage());
            }
            return orchestrator.run(registry, new HardeningContext(state, target), journal);
        } finally {
            if (outerMdc == null) MDC.clear(); else MDC.setContextMap(outerMdc);
        }
    }

    public Optional<HardeningStatus> status(String hostIdentifier) {
        return repository.load(hostIdentifier).map(state -> {
            HostStepJournal journal = new HostStepJournal(repository, state);
            StepRegistry.Progress progress = registry.progress(journal);
            List<String> skipped = state.getSteps().entrySet().stream()
                    .filter(e -> e.getValue().isSkipped())
                    .map(Map.Entry::getKey)
                    .toList();
            List<ErrorEntry> errors = state.getErrors();
            return new HardeningStatus(
                    state.getHostIdentifier(),
                    state.getHostAddress(),
                    state.getCurrentPhase(),
                    state.completedSteps(),
                    skipped,
                    progress.total(),
                    progress.percentage(),
                    progress.nextStep(),
                    registry.canResume(journal),
                    state.getConnection(),
                    errors.isEmpty() ? null : errors.get(errors.size() - 1),
                    sshCommand(state));
        });
    }

    /** Start over: the host's document is replaced by a fresh one. Requires confirmation upstream. */
    public ProvisioningState reset(String hostIdentifier) {
        try (SessionLock lock = SessionLock.acquire(lockFile(hostIdentifier))) {
            return repository.reset(hostIdentifier);
        }
    }

    /** The steps a run would go through, as "name: description". */
    public List<String> plan() {
        return registry.stepNames().stream()
                .map(registry::get)
                .map(step -> step.name() + ": " + step.description() + (step.isCritical() ? " (critical)" : ""))
                .toList();
    }

    // Next to the state document; pathFor rejects identifiers that would leave the hosts directory.
    private Path lockFile(String hostIdentifier) {
        return repository.pathFor(hostIdentifier).resolveSibling(hostIdentifier + ".lock");
    }

    private static Map<String, Object> snapshot(HardeningTarget target) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("defaultPort", target.defaultPort());
        snapshot.put("targetPort", target.targetPort());
        snapshot.put("originalUsername", target.originalUsername());
        snapshot.put("deploymentUsername", target.deploymentUsername());
        snapshot.put("keyAuthOnly", target.keyAuthOnly());
        return snapshot;
    }

    static String sshCommand(ProvisioningState state) {
        ConnectionRecord c = state.getConnection();
        if (c.getCurrentUsername() == null || c.getPrivateKeyPath() == null || state.getHostAddress() == null) {
            return null;
        }
        return "ssh -i " + c.getPrivateKeyPath() + " -p " + c.getCurrentPort() + " "
                + c.getCurrentUsername() + "@" + state.getHostAddress();
    }
}
