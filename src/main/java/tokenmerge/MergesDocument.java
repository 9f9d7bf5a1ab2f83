package tokenmerge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Serializable container of merge rules, used to load and export {@link MergeTable}s.
 *
 * <p>Two lists are supported, one per symbol domain:</p>
 * <ul>
 *     <li>{@code merges}: string pairs {@code [left, right]}, merged by concatenation;</li>
 *     <li>{@code idMerges}: id triples {@code [left, right, merged]}.</li>
 * </ul>
 *
 * <p>Both lists are in rank order. This class supports loading from:</p>
 * <ul>
 *     <li>JSON (Jackson), e.g. {@code {"merges":[["a","b"],["ab","c"]]}}</li>
 *     <li>{@code merges.txt} files, one space-separated pair per line</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MergesDocument {
    private static final Logger LOGGER = Diagnostics.logger(MergesDocument.class);

    /**
     * String-domain pairs in rank order.
     */
    public List<String[]> merges;

    /**
     * Id-domain triples {@code [left, right, merged]} in rank order.
     */
    public List<int[]> idMerges;

    /**
     * Constructs an empty document.
     * <p>Used by deserialization; lists are assigned directly.</p>
     */
    public MergesDocument() {
        // No-op constructor for deserialization or manual setup
    }

    /**
     * Exports a string-domain table.
     *
     * @param table the table
     * @return a document whose {@code merges} list is the table's pairs in rank order
     */
    public static MergesDocument of(MergeTable<String> table) {
        final MergesDocument doc = new MergesDocument();
        doc.merges = new ArrayList<>(table.size());
        for (SymbolPair<String> p : table.pairs()) {
            doc.merges.add(new String[]{p.getLeft(), p.getRight()});
        }
        return doc;
    }

    /**
     * Exports an id-domain table.
     *
     * @param table the table
     * @return a document whose {@code idMerges} list is the table's rules in rank order
     */
    public static MergesDocument ofIds(MergeTable<Integer> table) {
        final MergesDocument doc = new MergesDocument();
        doc.idMerges = new ArrayList<>(table.size());
        for (MergeRule<Integer> r : table.rules()) {
            doc.idMerges.add(new int[]{r.getLeft(), r.getRight(), r.getOutput()});
        }
        return doc;
    }

    /**
     * Builds the string-domain table described by {@code merges}.
     *
     * @return the table; empty if there are no string merges
     * @throws IllegalArgumentException if an entry is not a pair or a pair is repeated
     */
    public MergeTable<String> toStringTable() {
        final List<SymbolPair<String>> pairs = new ArrayList<>();
        if (merges != null) {
            for (int i = 0; i < merges.size(); i++) {
                final String[] m = merges.get(i);
                if (m == null || m.length != 2 || m[0] == null || m[1] == null) {
                    throw new IllegalArgumentException("Merge " + i + " is not a pair");
                }
                pairs.add(SymbolPair.of(m[0], m[1]));
            }
        }
        return MergeTable.ofStringPairs(pairs);
    }

    /**
     * Builds the id-domain table described by {@code idMerges}.
     *
     * @return the table; empty if there are no id merges
     * @throws IllegalArgumentException if an entry is not a triple or a pair is repeated
     */
    public MergeTable<Integer> toIdTable() {
        final List<MergeRule<Integer>> rules = new ArrayList<>();
        if (idMerges != null) {
            for (int i = 0; i < idMerges.size(); i++) {
                final int[] m = idMerges.get(i);
                if (m == null || m.length != 3) {
                    throw new IllegalArgumentException("Id merge " + i + " is not a [left, right, merged] triple");
                }
                rules.add(MergeRule.of(m[0], m[1], m[2]));
            }
        }
        return MergeTable.build(rules);
    }

    /**
     * Loads a document from a file, choosing the format from its extension.
     *
     * @param path a {@code .json} document or a {@code merges.txt} file
     * @return the document
     * @throws IOException if reading or parsing fails
     */
    public static MergesDocument load(Path path) throws IOException {
        return load(path, MergesFormat.fromFileName(path.toString()));
    }

    /**
     * Loads a document from a file in the given format.
     *
     * @param path   the file
     * @param format its format
     * @return the document
     * @throws IOException if reading or parsing fails
     */
    public static MergesDocument load(Path path, MergesFormat format) throws IOException {
        final MergesDocument doc = format == MergesFormat.JSON ? fromJson(path.toFile()) : fromText(path);
        LOGGER.info("Loaded merges (" + format.asStr() + ") from " + path + ": " + doc);
        return doc;
    }

    /**
     * Loads a {@code MergesDocument} from a JSON file.
     *
     * @param jsonFile the JSON file to read
     * @return the parsed document
     * @throws IOException if reading fails
     */
    public static MergesDocument fromJson(File jsonFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(jsonFile, MergesDocument.class);
    }

    /**
     * Loads a {@code MergesDocument} from a JSON file path.
     *
     * @param path the file path
     * @return the parsed document
     * @throws IOException if reading fails
     */
    public static MergesDocument fromJson(String path) throws IOException {
        return fromJson(new File(path));
    }

    /**
     * Loads a {@code MergesDocument} from a JSON input stream, e.g. a classpath resource.
     *
     * @param in the input stream containing the JSON data
     * @return the parsed document
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static MergesDocument fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(in, MergesDocument.class);
    }

    /**
     * Parses a {@code merges.txt} file into the string-domain list.
     *
     * @param file the file (UTF-8)
     * @return the document
     * @throws IOException if the file cannot be read
     */
    public static MergesDocument fromText(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromText(br);
        }
    }

    /**
     * Parses {@code merges.txt} content.
     *
     * <p>File format rules:</p>
     * <ul>
     *   <li>Each line holds a left and a right symbol separated by a single space.</li>
     *   <li>Blank lines and a {@code #version} header on the first non-blank line are ignored.</li>
     *   <li>A leading BOM ({@code U+FEFF}) is stripped.</li>
     *   <li>Lines that do not split into exactly two symbols are logged and skipped.</li>
     * </ul>
     *
     * @param br a reader supplying the text
     * @return the document
     * @throws IOException if an I/O error occurs while reading
     */
    public static MergesDocument fromText(BufferedReader br) throws IOException {
        final MergesDocument doc = new MergesDocument();
        doc.merges = new ArrayList<>();
        int lineNo = 0;
        boolean seenContent = false;

        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw.trim();
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1).trim(); // strip BOM
            }
            if (line.isEmpty()) continue;
            final boolean first = !seenContent;
            seenContent = true;
            if (first && line.startsWith("#version")) continue;

            final String[] parts = line.split(" ");
            if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                LOGGER.warning("Malformed merge at line " + lineNo + ": " + raw);
                continue;
            }
            doc.merges.add(parts);
        }

        return doc;
    }

    /**
     * Serializes this document to a JSON string.
     *
     * @return the JSON text
     * @throws UncheckedIOException if serialization fails
     */
    public String toJson() {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.writeValueAsString(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize merges", e);
        }
    }

    /**
     * Serializes this document to a JSON file.
     *
     * @param outputPath the output path where the JSON should be written
     * @throws RuntimeException if writing the file fails
     */
    public void serializeToJson(String outputPath) {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(Paths.get(outputPath)), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, this);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write JSON to: " + outputPath, e);
        }
    }

    /**
     * Returns a human-readable summary of the document.
     */
    @Override
    public String toString() {
        return "<MergesDocument with " + (merges == null ? 0 : merges.size()) + " merges, "
                + (idMerges == null ? 0 : idMerges.size()) + " id merges>";
    }
}
