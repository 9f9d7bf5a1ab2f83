package tokenmergecli;

import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;
import tokenmerge.Diagnostics;
import tokenmerge.WordPieceEncoding;
import tokenmerge.WordPieceProcessor;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand encoding words into WordPiece ids, or decoding ids back to text.
 */
@Command(name = "wordpiece", description = "\033[1;34mEncode or decode with a WordPiece vocabulary\033[0m", mixinStandardHelpOptions = true)
public class WordPieceCommand implements Callable<Integer> {
    @Option(names = {"-v", "--vocab"}, paramLabel = "<file>", description = "Vocabulary file, one piece per line", required = true)
    private File vocab;

    @Option(names = "--decode", description = "Decode lines of piece ids instead of encoding words")
    private boolean decode;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = "--verbose", description = "Enable library logging")
    private boolean verbose;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(WordPieceCommand.class.getName());

    /**
     * Printed in place of a piece that could not be matched.
     */
    static final String UNKNOWN = "<unk>";

    @Override
    public Integer call() {
        Diagnostics.setVerboseLogging(verbose);
        try {
            WordPieceProcessor processor = WordPieceProcessor.fromFile(vocab.toPath());
            List<String> results = new ArrayList<>();
            for (String line : CliIo.readLines(input)) {
                if (decode) {
                    results.add(decodeLine(processor, line));
                } else {
                    for (String word : line.trim().split("\\s+")) {
                        if (!word.isEmpty()) results.add(encodeWord(processor, word));
                    }
                }
            }
            CliIo.writeLines(output, results, spec.commandLine().getOut());
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during word piece " + (decode ? "decoding" : "encoding"), e);
            spec.commandLine().getErr().println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Formats one word as {@code ids<TAB>pieces}, both space separated.
     */
    static String encodeWord(WordPieceProcessor processor, String word) {
        WordPieceEncoding enc = processor.encode(word);
        StringBuilder ids = new StringBuilder();
        for (int id : enc.getIds()) {
            if (ids.length() > 0) ids.append(' ');
            ids.append(id);
        }
        StringBuilder pieces = new StringBuilder();
        for (String p : enc.getPieces()) {
            if (pieces.length() > 0) pieces.append(' ');
            pieces.append(p == null ? UNKNOWN : p);
        }
        return ids + "\t" + pieces;
    }

    static String decodeLine(WordPieceProcessor processor, String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return "";
        int[] ids = Arrays.stream(trimmed.split("\\s+")).mapToInt(Integer::parseInt).toArray();
        return processor.decode(ids);
    }
}
