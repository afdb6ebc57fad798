package io.hostforge.provisioner.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed, ordered list of steps of one workflow.
 *
 * Order is set once at construction and never changes; there is no
 * dependency graph, only "the first step that is not done yet". All queries
 * are pure with respect to the journal, so status displays can call them as
 * often as they like.
 *
 * @param <C> context type shared by every step of the workflow
 */
public class StepRegistry<C> {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final String                 workflow;
    private final Map<String, Step<C>>   steps = new LinkedHashMap<>();

    public StepRegistry(String workflow, List<? extends Step<C>> orderedSteps) {
        this.workflow = workflow;
        for (Step<C> step : orderedSteps) {
            if (steps.putIfAbsent(step.name(), step) != null) {
                throw new IllegalArgumentException(
                        "Duplicate step '" + step.name() + "' in workflow '" + workflow + "'");
            }
        }
        log.debug("Workflow '{}' registered with steps {}", workflow, steps.keySet());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public String workflow() { return workflow; }

    public Step<C> get(String name) {
        Step<C> step = steps.get(name);
        if (step == null) {
            throw new StepNotFoundException(workflow, name);
        }
        return step;
    }

    public List<String> stepNames() {
        return List.copyOf(steps.keySet());
    }

    public int indexOf(String name) {
        return stepNames().indexOf(name);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /** First step that is neither completed nor skipped; empty when the workflow is done. */
    public Optional<Step<C>> nextIncompleteStep(StepJournal journal) {
        return steps.values().stream()
                .filter(step -> !journal.isStepDone(step.name()))
                .findFirst();
    }

    public Progress progress(StepJournal journal) {
        int done = (int) steps.keySet().stream().filter(journal::isStepDone).count();
        String next = nextIncompleteStep(journal).map(Step::name).orElse(null);
        return new Progress(done, steps.size(), next);
    }

    /** Something has been done already, but not everything. */
    public boolean canResume(StepJournal journal) {
        Progress p = progress(journal);
        return p.done() > 0 && p.done() < p.total();
    }

    /**
     * @param nextStep null once every step is done
     */
    public record Progress(int done, int total, String nextStep) {
        public int percentage() {
            return total == 0 ? 100 : Math.round(100f * done / total);
        }
    }
}
