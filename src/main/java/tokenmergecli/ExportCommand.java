package tokenmergecli;

import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;
import tokenmerge.Diagnostics;
import tokenmerge.MergesDocument;
import tokenmerge.MergesFormat;

import java.io.File;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "export", description = "\033[1;34mExport merges to the JSON format\033[0m", mixinStandardHelpOptions = true)
public class ExportCommand implements Callable<Integer> {

    @Option(names = {"-m", "--merges"}, paramLabel = "<file>", description = "Merges file to export", required = true)
    private File merges;

    @Option(names = {"-f", "--format"}, paramLabel = "<format>", description = "Input format: [json, text] (default: from file extension)")
    private String format;

    @Option(names = {"-o", "--output"}, paramLabel = "<filename>", description = "Output filename", defaultValue = "merges.json")
    private String output;

    @Option(names = "--verbose", description = "Enable library logging")
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(ExportCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        Diagnostics.setVerboseLogging(verbose);
        try {
            MergesFormat fmt = format != null
                    ? MergesFormat.fromStr(format)
                    : MergesFormat.fromFileName(merges.getName());
            MergesDocument doc = MergesDocument.load(merges.toPath(), fmt);

            // Tables are built so that malformed or duplicate rules fail before anything is written.
            MergesDocument exported = new MergesDocument();
            if (doc.merges != null) {
                exported.merges = MergesDocument.of(doc.toStringTable()).merges;
            }
            if (doc.idMerges != null) {
                exported.idMerges = MergesDocument.ofIds(doc.toIdTable()).idMerges;
            }

            File outputPath = Paths.get(output).toAbsolutePath().toFile();
            exported.serializeToJson(outputPath.getAbsolutePath());
            spec.commandLine().getErr().println(BLUE + "Merges saved in JSON format at: " + outputPath + RESET);
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Exception during merges export", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
