package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.HostforgeException;
import io.hostforge.provisioner.service.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Runs the picocli command line once the context is up and hands the exit
 * code to Spring.
 *
 * A shutdown hook flushes whatever workflow is running, so Ctrl-C between
 * two state writes loses nothing.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final HostforgeCommand     root;
    private final SpringCommandFactory factory;
    private final SessionOrchestrator  orchestrator;

    private int exitCode;

    public CliRunner(HostforgeCommand root, SpringCommandFactory factory, SessionOrchestrator orchestrator) {
        this.root         = root;
        this.factory      = factory;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) {
        Thread hook = new Thread(orchestrator::saveActive, "hostforge-save-on-exit");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            exitCode = newCommandLine().execute(args);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook runs anyway
                log.debug("Shutdown in progress, save hook left registered");
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(root, factory);
        commandLine.setExecutionExceptionHandler(CliRunner::handleException);
        return commandLine;
    }

    /** Operator-facing failures print message and remediation; anything else is a bug and gets the stack. */
    private static int handleException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        if (e instanceof HostforgeException he) {
            log.debug("Command failed", he);
            err.println("Error: " + he.getMessage());
            if (he.getRemediation() != null) {
                err.println(he.getRemediation());
            }
        } else {
            log.error("Unexpected failure", e);
            err.println("Error: " + e);
        }
        err.flush();
        return 1;
    }
}
