package tokenmergecli;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-oriented input and output shared by the subcommands. Always UTF-8.
 */
final class CliIo {
    private CliIo() {
    }

    static List<String> readLines(File input) throws IOException {
        if (input != null) {
            return Files.readAllLines(input.toPath(), StandardCharsets.UTF_8);
        }
        if (System.console() != null) {
            System.err.println("Input text, <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to submit:");
        }
        String text = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\R", -1)));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1); // trailing newline
        }
        return lines;
    }

    static void writeLines(File output, List<String> lines, PrintWriter out) throws IOException {
        if (output != null) {
            Files.write(output.toPath(), lines, StandardCharsets.UTF_8);
        } else {
            for (String line : lines) {
                out.println(line);
            }
            out.flush();
        }
    }
}
