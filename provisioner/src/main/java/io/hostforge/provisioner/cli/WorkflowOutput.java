package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.model.WorkflowResult;

import java.io.PrintWriter;

final class WorkflowOutput {

    private WorkflowOutput() {}

    /** Print the outcome and, when the run can be picked up again, how. */
    static int report(PrintWriter out, WorkflowResult result) {
        out.println(result.message());
        if (result.status() != WorkflowResult.Status.COMPLETED && result.resumeHint() != null) {
            out.println("Resume with: " + result.resumeHint());
        }
        out.flush();
        return result.exitCode();
    }
}
