package io.hostforge.provisioner.integration;

import io.hostforge.provisioner.repository.JsonDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Writes {@code hostforge.json} into the project directory. */
@Component
public class DirectoryProjectScaffolder implements ProjectScaffolder {

    private static final Logger log = LoggerFactory.getLogger(DirectoryProjectScaffolder.class);

    static final String CONFIG_FILE = "hostforge.json";

    private final JsonDocumentStore store;

    public DirectoryProjectScaffolder(JsonDocumentStore store) {
        this.store = store;
    }

    @Override
    public Path scaffold(String projectName, Path projectPath, Map<String, Object> config, boolean dryRun) {
        Path file = projectPath.resolve(CONFIG_FILE);
        if (dryRun) {
            log.info("[dry-run] Would write {}", file);
            return file;
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("project", projectName);
        document.putAll(config);
        store.write(file, document);
        log.info("Wrote project configuration {}", file);
        return file;
    }
}
