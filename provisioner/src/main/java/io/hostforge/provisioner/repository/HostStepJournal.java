package io.hostforge.provisioner.repository;

import io.hostforge.provisioner.model.ProvisioningState;
import io.hostforge.provisioner.model.StepFailure;
import io.hostforge.provisioner.step.StepJournal;

import java.util.Map;

/** {@link StepJournal} over a host's {@link ProvisioningState} document. */
public class HostStepJournal implements StepJournal {

    private final ProvisioningStateRepository repository;
    private final ProvisioningState           state;

    public HostStepJournal(ProvisioningStateRepository repository, ProvisioningState state) {
        this.repository = repository;
        this.state      = state;
    }

    public ProvisioningState state() { return state; }

    @Override public String workflowId() { return state.getHostIdentifier(); }

    @Override
    public boolean isStepDone(String stepName) {
        return state.step(stepName).isDone();
    }

    @Override
    public boolean isStepCompleted(String stepName) {
        return state.isStepCompleted(stepName);
    }

    @Override
    public void markStepCompleted(String stepName, Map<String, Object> data) {
        repository.markStepCompleted(state, stepName, data);
    }

    @Override
    public void markStepSkipped(String stepName, String reason) {
        repository.markStepSkipped(state, stepName, reason);
    }

    @Override
    public void recordError(String stepName, StepFailure failure) {
        repository.addError(state, stepName, failure);
    }

    @Override
    public void resetStepData(String stepName) {
        repository.resetStepData(state, stepName);
    }

    @Override
    public void updatePhase(String stepName) {
        repository.updatePhase(state, stepName);
    }

    @Override
    public void markWorkflowCompleted() {
        repository.updatePhase(state, ProvisioningState.PHASE_COMPLETED);
    }

    @Override
    public void save() {
        repository.save(state);
    }

    @Override public Object document() { return state; }

    @Override
    public String resumeHint() {
        String address = state.getHostAddress() != null ? state.getHostAddress() : "<address>";
        return "hostforge security-setup --host " + address + " --host-id " + state.getHostIdentifier();
    }
}
