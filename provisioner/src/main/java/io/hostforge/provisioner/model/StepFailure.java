package io.hostforge.provisioner.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * The classified form of a step failure. This, never the raw exception, is
 * what the recovery layer sees.
 *
 * @param kind        classification driving the recovery menu
 * @param message     what failed, in operator terms
 * @param remediation what to do about it (may be null)
 * @param detail      stack trace text, shown only on request
 */
public record StepFailure(FailureKind kind, String message, String remediation, String detail) {

    public static StepFailure of(FailureKind kind, Throwable error, String remediation) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StepFailure(kind, message, remediation, stackTrace(error));
    }

    public static StepFailure of(FailureKind kind, String message, String remediation) {
        return new StepFailure(kind, message, remediation, null);
    }

    private static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
