package io.hostforge.provisioner.integration;

import java.nio.file.Path;
import java.util.Map;

/** Creates the local project directory and its configuration file. */
public interface ProjectScaffolder {

    /** @return the written configuration file (or the one that would be written) */
    Path scaffold(String projectName, Path projectPath, Map<String, Object> config, boolean dryRun);
}
