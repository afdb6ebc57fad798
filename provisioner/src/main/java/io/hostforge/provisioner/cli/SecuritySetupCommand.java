package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.service.SecurityHardeningService;
import io.hostforge.provisioner.service.SecurityHardeningService.HardeningRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(name = "security-setup", mixinStandardHelpOptions = true,
        description = "Harden an existing host, resuming where a previous run stopped.")
public class SecuritySetupCommand implements Callable<Integer> {

    private final SecurityHardeningService hardening;

    @Spec
    CommandSpec spec;

    @Option(names = "--host", required = true, paramLabel = "ADDR", description = "Host name or IP address")
    String host;

    @Option(names = "--host-id", paramLabel = "ID", description = "State identifier (default: the address)")
    String hostId;

    @Option(names = "--key", paramLabel = "PATH", description = "Private key the host currently accepts")
    Path key;

    @Option(names = "--os", paramLabel = "NAME", description = "Image OS, used to derive the initial login user")
    String operatingSystem;

    @Option(names = "--dry-run", description = "List the steps without connecting")
    boolean dryRun;

    public SecuritySetupCommand(SecurityHardeningService hardening) {
        this.hardening = hardening;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (dryRun) {
            out.println("Steps that would run against " + host + ":");
            hardening.plan().forEach(line -> out.println("  " + line));
            out.flush();
            return 0;
        }
        String id = hostId != null ? hostId : host;
        return WorkflowOutput.report(out, hardening.harden(new HardeningRequest(id, host, key, operatingSystem)));
    }
}
