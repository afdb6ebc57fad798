package io.hostforge.provisioner.step;

public class StepNotFoundException extends RuntimeException {
    public StepNotFoundException(String workflow, String name) {
        super("No step named '" + name + "' in workflow '" + workflow + "'");
    }
}
