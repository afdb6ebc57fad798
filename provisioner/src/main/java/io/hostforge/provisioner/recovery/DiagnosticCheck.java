package io.hostforge.provisioner.recovery;

/** Result of one environment check. */
public record DiagnosticCheck(String name, boolean passed, String detail) {

    @Override
    public String toString() {
        return (passed ? "[ok]   " : "[FAIL] ") + name + ": " + detail;
    }
}
