package scriptdetectcli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "scriptdetect",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mPure Java writing system (script) detection CLI\033[0m",
        subcommands = {
                DetectCommand.class
        }
)
public class Main implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // No subcommand: point at detect and show the usage
        CommandLine cmd = spec.commandLine();
        cmd.getOut().println("No subcommand given. Try: scriptdetect detect \"Привет всем!\"");
        cmd.usage(cmd.getOut());
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
