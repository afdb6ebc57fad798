package io.hostforge.provisioner.recovery;

import io.hostforge.provisioner.repository.JsonDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes a machine-readable support report for a failed step. */
@Component
public class DiagnosticBundleWriter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticBundleWriter.class);

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path              supportDir;
    private final JsonDocumentStore store;
    private final Clock             clock;

    public DiagnosticBundleWriter(@Value("${hostforge.state-dir:.hostforge}") Path stateDir,
                                  JsonDocumentStore store) {
        this(stateDir, store, Clock.systemUTC());
    }

    DiagnosticBundleWriter(Path stateDir, JsonDocumentStore store, Clock clock) {
        this.supportDir = stateDir.resolve("support");
        this.store      = store;
        this.clock      = clock;
    }

    /** @return the written file, {@code <state-dir>/support/error-report-<timestamp>.json} */
    public Path write(FailureContext context, Object document, List<DiagnosticCheck> checks) {
        Instant now = clock.instant();
        Path file = supportDir.resolve("error-report-" + FILE_STAMP.format(now) + ".json");

        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("kind", context.failure().kind());
        failure.put("message", context.failure().message());
        failure.put("remediation", context.failure().remediation());
        failure.put("detail", context.failure().detail());

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("javaVersion", Runtime.version().toString());
        system.put("os", System.getProperty("os.name") + " " + System.getProperty("os.version"));
        system.put("arch", System.getProperty("os.arch"));

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("generatedAt", now);
        report.put("workflowId", context.workflowId());
        report.put("step", context.stepName());
        report.put("attempt", context.attempt());
        report.put("failure", failure);
        report.put("system", system);
        report.put("diagnostics", checks);
        report.put("state", document);

        store.write(file, report);
        log.info("Support report written to {}", file);
        return file;
    }
}
