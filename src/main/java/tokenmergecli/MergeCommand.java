package tokenmergecli;

import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;
import tokenmerge.BpeProcessor;
import tokenmerge.Diagnostics;
import tokenmerge.MergeApplier;
import tokenmerge.MergeTable;
import tokenmerge.MergesDocument;
import tokenmerge.MergesFormat;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand applying merge rules to symbol sequences read line by line.
 */
@Command(name = "merge", description = "\033[1;34mApply BPE merges to input symbols\033[0m", mixinStandardHelpOptions = true)
public class MergeCommand implements Callable<Integer> {
    @Option(names = {"-m", "--merges"}, paramLabel = "<file>", description = "Merges file (json or merges.txt)", required = true)
    private File merges;

    @Option(names = {"-f", "--format"}, paramLabel = "<format>", description = "Merges format: [json, text] (default: from file extension)")
    private String format;

    @Option(names = "--ids", description = "Treat each input line as a sequence of integer ids")
    private boolean ids;

    @Option(names = "--vocab", paramLabel = "<file>", description = "vocab.json; print piece ids instead of pieces")
    private File vocab;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = "--verbose", description = "Enable library logging")
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(MergeCommand.class.getName());

    @Override
    public Integer call() {
        Diagnostics.setVerboseLogging(verbose);
        try {
            MergesFormat fmt = format != null
                    ? MergesFormat.fromStr(format)
                    : MergesFormat.fromFileName(merges.getName());
            MergesDocument doc = MergesDocument.load(merges.toPath(), fmt);

            if (ids && vocab != null) {
                throw new IllegalArgumentException("--vocab cannot be combined with --ids");
            }

            List<String> lines = CliIo.readLines(input);
            List<String> results = new ArrayList<>(lines.size());
            if (vocab != null) {
                BpeProcessor processor = new BpeProcessor(BpeProcessor.readVocab(vocab), doc.toStringTable());
                for (String line : lines) {
                    results.add(encodeWords(processor, line));
                }
            } else if (ids) {
                MergeTable<Integer> table = doc.toIdTable();
                for (String line : lines) {
                    results.add(mergeIds(table, line));
                }
            } else {
                MergeTable<String> table = doc.toStringTable();
                for (String line : lines) {
                    results.add(mergeWords(table, line));
                }
            }

            CliIo.writeLines(output, results, spec.commandLine().getOut());
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error while applying merges", e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Splits every whitespace-separated word into code points, merges it, and joins
     * the resulting pieces with single spaces.
     */
    static String mergeWords(MergeTable<String> table, String line) {
        StringBuilder sb = new StringBuilder();
        for (String word : line.trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            for (String piece : MergeApplier.apply(table, codePoints(word))) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(piece);
            }
        }
        return sb.toString();
    }

    /**
     * Like {@link #mergeWords} but prints the vocabulary id of every piece, {@code -1} if it has none.
     */
    static String encodeWords(BpeProcessor processor, String line) {
        StringBuilder sb = new StringBuilder();
        for (String word : line.trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            for (int id : processor.encodeAsIds(codePoints(word))) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(id);
            }
        }
        return sb.toString();
    }

    private static List<String> codePoints(String word) {
        List<String> symbols = new ArrayList<>();
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    static String mergeIds(MergeTable<Integer> table, String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return "";
        String[] parts = trimmed.split("\\s+");
        int[] seq = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            seq[i] = Integer.parseInt(parts[i]);
        }
        StringBuilder sb = new StringBuilder();
        for (int id : MergeApplier.applyIds(table, seq)) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(id);
        }
        return sb.toString();
    }
}
