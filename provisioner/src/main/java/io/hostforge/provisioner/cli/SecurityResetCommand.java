package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.config.ConfigurationException;
import io.hostforge.provisioner.service.SecurityHardeningService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@Command(name = "security-reset", mixinStandardHelpOptions = true,
        description = "Forget all hardening progress for a host. The host itself is not touched.")
public class SecurityResetCommand implements Callable<Integer> {

    private final SecurityHardeningService hardening;

    @Spec
    CommandSpec spec;

    @Option(names = "--host-id", required = true, paramLabel = "ID")
    String hostId;

    @Option(names = "--yes", description = "Confirm the reset")
    boolean confirmed;

    public SecurityResetCommand(SecurityHardeningService hardening) {
        this.hardening = hardening;
    }

    @Override
    public Integer call() {
        if (!confirmed) {
            throw new ConfigurationException("Reset of " + hostId + " not confirmed",
                    "Re-run with --yes. Progress for this host will be lost.");
        }
        hardening.reset(hostId);
        spec.commandLine().getOut().println("Hardening state of " + hostId + " reset.");
        spec.commandLine().getOut().flush();
        return 0;
    }
}
