package io.hostforge.provisioner.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Checks the operator's machine for what the workflows need. */
@Component
public class EnvironmentDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentDiagnostics.class);

    static final long MIN_FREE_BYTES = 100L * 1024 * 1024;

    private final Path     stateDir;
    private final String   probeHost;
    private final int      probePort;
    private final Duration probeTimeout;

    public EnvironmentDiagnostics(
            @Value("${hostforge.state-dir:.hostforge}") Path stateDir,
            @Value("${hostforge.diagnostics.probe-host:1.1.1.1}") String probeHost,
            @Value("${hostforge.diagnostics.probe-port:443}") int probePort,
            @Value("${hostforge.diagnostics.probe-timeout:5s}") Duration probeTimeout) {
        this.stateDir     = stateDir;
        this.probeHost    = probeHost;
        this.probePort    = probePort;
        this.probeTimeout = probeTimeout;
    }

    public List<DiagnosticCheck> run() {
        List<DiagnosticCheck> checks = new ArrayList<>();
        checks.add(new DiagnosticCheck("java", true, "Java " + Runtime.version()));
        checks.add(onPath("git"));
        checks.add(onPath("ssh"));
        checks.add(diskSpace());
        checks.add(connectivity());
        checks.stream().filter(c -> !c.passed()).forEach(c -> log.warn("Diagnostic failed: {}", c));
        return checks;
    }

    DiagnosticCheck onPath(String command) {
        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                for (String name : List.of(command, command + ".exe")) {
                    Path candidate = Path.of(dir, name);
                    if (Files.isExecutable(candidate)) {
                        return new DiagnosticCheck(command, true, candidate.toString());
                    }
                }
            }
        }
        return new DiagnosticCheck(command, false, "not found on PATH");
    }

    DiagnosticCheck diskSpace() {
        Path dir = stateDir.toAbsolutePath();
        while (dir != null && !Files.exists(dir)) {
            dir = dir.getParent();
        }
        if (dir == null) {
            return new DiagnosticCheck("disk", false, "no existing parent of " + stateDir);
        }
        try {
            long free = Files.getFileStore(dir).getUsableSpace();
            return new DiagnosticCheck("disk", free >= MIN_FREE_BYTES, (free / (1024 * 1024)) + " MB free in " + dir);
        } catch (IOException e) {
            return new DiagnosticCheck("disk", false, e.getMessage());
        }
    }

    DiagnosticCheck connectivity() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(probeHost, probePort), (int) probeTimeout.toMillis());
            return new DiagnosticCheck("network", true, "reached " + probeHost + ":" + probePort);
        } catch (IOException e) {
            return new DiagnosticCheck("network", false, "cannot reach " + probeHost + ":" + probePort
                    + " (" + e.getMessage() + ")");
        }
    }
}
