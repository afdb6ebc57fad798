package io.hostforge.provisioner.step.wizard;

import io.hostforge.provisioner.model.Session;

import java.nio.file.Path;
import java.util.Map;

/** What every wizard step reads: the session and the results of earlier steps. */
public record WizardContext(Session session) {

    public String projectName() { return session.getProjectName(); }

    public Path projectPath() { return Path.of(session.getProjectPath()); }

    public boolean dryRun() { return session.isDryRun(); }

    /** Result of an earlier step; empty when it was skipped or has not run. */
    public Map<String, Object> result(String stepName) {
        return session.resultOf(stepName);
    }
}
