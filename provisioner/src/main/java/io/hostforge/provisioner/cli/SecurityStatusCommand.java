package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.service.HardeningStatus;
import io.hostforge.provisioner.service.SecurityHardeningService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Component
@Command(name = "security-status", mixinStandardHelpOptions = true,
        description = "Show hardening progress and how to log in.")
public class SecurityStatusCommand implements Callable<Integer> {

    private final SecurityHardeningService hardening;

    @Spec
    CommandSpec spec;

    @Option(names = "--host-id", required = true, paramLabel = "ID")
    String hostId;

    public SecurityStatusCommand(SecurityHardeningService hardening) {
        this.hardening = hardening;
    }

    @Override
    public Integer call() {
        HardeningStatus status = hardening.status(hostId).orElseThrow(() -> new ConfigurationException(
                "No hardening state for host " + hostId,
                "Run 'hostforge security-setup --host <address> --host-id " + hostId + "' first."));

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Host:      %s (%s)%n", status.hostIdentifier(), status.hostAddress());
        out.printf("Phase:     %s%n", status.currentPhase());
        out.printf("Progress:  %d%% (%d/%d)%n", status.percentage(), status.completedSteps().size()
                + status.skippedSteps().size(), status.totalSteps());
        out.printf("Completed: %s%n", status.completedSteps());
        if (!status.skippedSteps().isEmpty()) {
            out.printf("Skipped:   %s%n", status.skippedSteps());
        }
        if (status.nextStep() != null) {
            out.printf("Next:      %s%n", status.nextStep());
        }
        if (status.lastError() != null) {
            out.printf("Last error: %s [%s] %s at %s%n", status.lastError().step(), status.lastError().kind(),
                    status.lastError().message(), status.lastError().timestamp());
        }
        out.printf("Hardened:  %s%n", status.connection().isHardeningApplied() ? "yes" : "no");
        if (status.sshCommand() != null) {
            out.printf("Connect:   %s%n", status.sshCommand());
        }
        if (status.resumable()) {
            out.printf("Resume:    hostforge security-setup --host %s --host-id %s%n",
                    status.hostAddress(), status.hostIdentifier());
        }
        out.flush();
        return 0;
    }
}
