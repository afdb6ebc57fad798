package io.hostforge.provisioner.remote;

/** Outcome of one remote command. */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** stderr when there is any, else stdout; trimmed, for error messages. */
    public String diagnostic() {
        String text = stderr != null && !stderr.isBlank() ? stderr : stdout;
        return text == null ? "" : text.trim();
    }
}
