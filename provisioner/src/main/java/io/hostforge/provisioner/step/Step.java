package io.hostforge.provisioner.step;

import java.util.List;
import java.util.Map;

/**
 * One named, idempotent unit of provisioning work.
 *
 * Implementations must converge when re-run after a partial failure
 * ("create the user if absent", never "create the user"), because a crash can
 * always land between the remote side effect and the local completion record.
 *
 * A step never records its own completion: it returns its side-effect data
 * and the sequencer records it. "Did it happen on the host" and "is it
 * durably recorded" stay separately testable.
 *
 * @param <C> the workflow context the step reads from
 */
public interface Step<C> {

    /** Stable name, used as the key in the state document. */
    String name();

    /** One line shown in progress output. */
    String description();

    /** Critical steps can never be skipped from the recovery menu. */
    boolean isCritical();

    /**
     * Steps that must be completed before this one may run at all. The
     * executor enforces this independently of the registry's ordering.
     */
    default List<String> prerequisites() {
        return List.of();
    }

    /**
     * Execute the step once.
     *
     * @return data to store with the completion record
     * @throws StepException for failures the step has already classified;
     *         anything else is classified by the executor
     */
    Map<String, Object> run(C context) throws Exception;
}
