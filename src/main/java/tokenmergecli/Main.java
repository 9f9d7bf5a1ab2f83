package tokenmergecli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "tokenmergecli",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mBPE merge and WordPiece tools for TokenMergeJava\033[0m",
        subcommands = {
                MergeCommand.class,
                WordPieceCommand.class,
                ExportCommand.class
        }
)
public class Main implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        // Called when no subcommand is provided
        spec.commandLine().getOut().println("Use --help or a subcommand (merge / wordpiece / export)");
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
