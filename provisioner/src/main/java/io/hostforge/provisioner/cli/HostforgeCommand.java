package io.hostforge.provisioner.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Prints usage on its own; every action is a subcommand.
 *
 * Exit codes: 0 completed or saved, 1 cancelled or failed, 2 locked out,
 * 130 interrupted.
 */
@Component
@Command(name = "hostforge",
        mixinStandardHelpOptions = true,
        version = "hostforge 0.1.0",
        description = "Provision, harden and deploy a server, resumably.",
        subcommands = {
                NewCommand.class,
                ResumeCommand.class,
                SecuritySetupCommand.class,
                SecurityStatusCommand.class,
                SecurityResetCommand.class
        })
public class HostforgeCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
