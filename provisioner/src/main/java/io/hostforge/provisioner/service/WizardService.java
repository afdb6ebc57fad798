package io.hostforge.provisioner.service;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.model.Session;
import io.hostforge.provisioner.model.SetupMode;
import io.hostforge.provisioner.model.WorkflowResult;
import io.hostforge.provisioner.repository.SessionLock;
import io.hostforge.provisioner.repository.SessionRepository;
import io.hostforge.provisioner.repository.SessionStepJournal;
import io.hostforge.provisioner.step.StepRegistry;
import io.hostforge.provisioner.step.wizard.WizardContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/** Starts and resumes setup wizard sessions. */
@Service
public class WizardService {

    private static final Logger log = LoggerFactory.getLogger(WizardService.class);

    private final SessionRepository           sessions;
    private final StepRegistry<WizardContext> registry;
    private final SessionOrchestrator         orchestrator;

    public WizardService(SessionRepository sessions,
                         StepRegistry<WizardContext> wizardWorkflow,
                         SessionOrchestrator orchestrator) {
        this.sessions     = sessions;
        this.registry     = wizardWorkflow;
        this.orchestrator = orchestrator;
    }

    public WorkflowResult start(String projectName, Path projectPath, SetupMode mode, boolean dryRun) {
        Session session = Session.start(projectName, projectPath.toAbsolutePath().toString(), mode, dryRun,
                registry.stepNames());
        sessions.save(session);
        log.info("Started wizard session {} for project '{}' in {}", session.getId(), projectName, projectPath);
        return drive(session);
    }

    /**
     * Resume {@code sessionId}, or the most recently updated session of the
     * project when it is null.
     */
    public WorkflowResult resume(Path projectPath, String sessionId) {
        Optional<Session> found = sessionId != null
                ? sessions.findById(projectPath, sessionId)
                : sessions.findMostRecent(projectPath);
        Session session = found.orElseThrow(() -> new ConfigurationException(
                "No wizard session found in " + projectPath.toAbsolutePath()
                        + (sessionId != null ? " with id " + sessionId : ""),
                "Start one with 'hostforge new <project>'."));

        if (session.isCompleted()) {
            return new WorkflowResult(session.getId(), WorkflowResult.Status.COMPLETED, null,
                    "Session already completed at " + session.getCompletedAt(), null);
        }
        if (!session.getStepOrder().equals(registry.stepNames())) {
            throw new ConfigurationException("Session " + session.getId() + " has an unknown step order "
                    + session.getStepOrder(), "Start a new session with 'hostforge new'.");
        }
        log.info("Resuming session {} at step {} ({}% done)", session.getId(),
                session.getCurrentStepIndex() + 1, session.percentComplete());
        return drive(session);
    }

    private WorkflowResult drive(Session session) {
        Path lockFile = sessions.sessionDir(Path.of(session.getProjectPath())).resolve(session.getId() + ".lock");
        try (SessionLock lock = SessionLock.acquire(lockFile)) {
            return orchestrator.run(registry, new WizardContext(session), new SessionStepJournal(sessions, session));
        }
    }
}
