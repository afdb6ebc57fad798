package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.service.WizardService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(name = "resume", mixinStandardHelpOptions = true,
        description = "Continue a saved wizard session (the most recent one when no id is given).")
public class ResumeCommand implements Callable<Integer> {

    private final WizardService wizard;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<sessionId>")
    String sessionId;

    @Option(names = "--path", paramLabel = "DIR", description = "Project directory (default: current directory)")
    Path path = Path.of(".");

    public ResumeCommand(WizardService wizard) {
        this.wizard = wizard;
    }

    @Override
    public Integer call() {
        return WorkflowOutput.report(spec.commandLine().getOut(),
                wizard.resume(path.toAbsolutePath().normalize(), sessionId));
    }
}
