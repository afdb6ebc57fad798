package io.hostforge.provisioner.recovery;

/**
 * Where recovery decisions come from. The console implementation asks the
 * operator; tests script the answers.
 */
public interface DecisionSource {

    /** Must return one of {@code context.offered()}; anything else is asked again. */
    RecoveryAction decide(FailureContext context);

    RecoveryModeAction decideRecoveryMode(FailureContext context);

    /** Show text to the operator (error details, diagnostics results). */
    void show(String text);
}
