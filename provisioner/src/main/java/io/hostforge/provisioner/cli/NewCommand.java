package io.hostforge.provisioner.cli;

import io.hostforge.provisioner.model.SetupMode;
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
@Command(name = "new", mixinStandardHelpOptions = true,
        description = "Start the setup wizard for a new project.")
public class NewCommand implements Callable<Integer> {

    private final WizardService wizard;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<project>", description = "Project name")
    String projectName;

    @Option(names = "--path", paramLabel = "DIR", description = "Parent directory (default: current directory)")
    Path path = Path.of(".");

    @Option(names = "--here", description = "Use the directory itself instead of creating <project> inside it")
    boolean here;

    @Option(names = "--advanced", description = "Customise every step instead of taking the defaults")
    boolean advanced;

    @Option(names = "--dry-run", description = "Walk through every step without creating anything")
    boolean dryRun;

    public NewCommand(WizardService wizard) {
        this.wizard = wizard;
    }

    @Override
    public Integer call() {
        Path projectPath = here ? path : path.resolve(projectName);
        SetupMode mode = advanced ? SetupMode.ADVANCED : SetupMode.QUICK;
        return WorkflowOutput.report(spec.commandLine().getOut(),
                wizard.start(projectName, projectPath.toAbsolutePath().normalize(), mode, dryRun));
    }
}
