package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.model.ErrorEntry;
import io.hostforge.provisioner.model.Session;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.step.StepJournal;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link StepJournal} over a wizard {@link Session}.
 *
 * Completion is positional: only the step under the cursor can be completed
 * or skipped, and doing so advances the cursor by one.
 */
public class SessionStepJournal implements StepJournal {

    private final SessionRepository repository;
    private final Session           session;

    public SessionStepJournal(SessionRepository repository, Session session) {
        this.repository = repository;
        this.session    = session;
    }

    public Session session() { return session; }

    @Override public String workflowId() { return session.getId(); }

    @Override
    public boolean isStepDone(String stepName) {
        return session.isStepDone(stepName);
    }

    @Override
    public boolean isStepCompleted(String stepName) {
        return session.isStepDone(stepName) && !session.isStepSkipped(stepName);
    }

    @Override
    public void markStepCompleted(String stepName, Map<String, Object> data) {
        requireCurrent(stepName);
        session.getStepResults().put(stepName, data == null ? Map.of() : new LinkedHashMap<>(data));
        advance();
    }

    @Override
    public void markStepSkipped(String stepName, String reason) {
        requireCurrent(stepName);
        session.getSkippedSteps().put(stepName, reason);
        advance();
    }

    @Override
    public void recordError(String stepName, StepFailure failure) {
        session.getErrors().add(new ErrorEntry(Instant.now(), stepName, failure.message(), failure.kind()));
        repository.save(session);
    }

    @Override
    public void resetStepData(String stepName) {
        if (session.isStepDone(stepName)) {
            throw new IllegalStateException("Step '" + stepName + "' is already done and cannot be reset");
        }
        session.getStepResults().remove(stepName);
        repository.save(session);
    }

    // The cursor already says which step is in progress.
    @Override
    public void updatePhase(String stepName) {
        repository.save(session);
    }

    @Override
    public void markWorkflowCompleted() {
        session.markCompleted();
        repository.save(session);
    }

    @Override
    public void save() {
        repository.save(session);
    }

    @Override public Object document() { return session; }

    @Override
    public String resumeHint() {
        return "hostforge resume " + session.getId() + " --path " + Path.of(session.getProjectPath());
    }

    private void requireCurrent(String stepName) {
        int index = session.getCurrentStepIndex();
        if (index >= session.getStepOrder().size() || !session.getStepOrder().get(index).equals(stepName)) {
            throw new IllegalStateException("Step '" + stepName + "' is not the current step of session "
                    + session.getId());
        }
    }

    private void advance() {
        session.setCurrentStepIndex(session.getCurrentStepIndex() + 1);
        repository.save(session);
    }
}
