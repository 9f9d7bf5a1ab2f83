package tokenmerge;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * BPE encoder over a piece vocabulary and a string-domain merge table.
 *
 * <p>The caller supplies the initial symbols of a word (for instance its characters, or
 * byte-level symbols produced by a pre-tokenizer). They are reduced with
 * {@link MergeApplier} and the resulting pieces are looked up in the vocabulary.</p>
 *
 * <p>Vocabularies are JSON objects mapping each piece to its id, e.g.
 * {@code {"a":0,"b":1,"ab":2}}. Ids need not be dense but must be unique and non-negative.
 * No byte-level recoding is done in either direction.</p>
 */
public class BpeProcessor {
    private static final Logger LOGGER = Diagnostics.logger(BpeProcessor.class);

    private final Map<String, Integer> vocab;
    private final Map<Integer, String> idToPiece;
    private final MergeTable<String> merges;

    /**
     * Creates a processor.
     *
     * @param vocab  piece to id mapping
     * @param merges string pairs in rank order; the output of each merge is the concatenation
     * @throws IllegalArgumentException if an id is negative or used twice, or a pair is repeated
     */
    public BpeProcessor(Map<String, Integer> vocab, List<SymbolPair<String>> merges) {
        this(vocab, MergeTable.ofStringPairs(merges));
    }

    /**
     * Creates a processor from an already built merge table.
     *
     * @param vocab  piece to id mapping
     * @param merges the merge table
     * @throws IllegalArgumentException if an id is negative or used twice
     */
    public BpeProcessor(Map<String, Integer> vocab, MergeTable<String> merges) {
        final Map<String, Integer> pieces = new LinkedHashMap<>(vocab.size() * 2);
        final Map<Integer, String> reverse = new HashMap<>(vocab.size() * 2);
        for (Map.Entry<String, Integer> e : vocab.entrySet()) {
            final String piece = e.getKey();
            final Integer id = e.getValue();
            if (piece == null || id == null) {
                throw new IllegalArgumentException("Vocabulary entries must have a piece and an id");
            }
            if (id < 0) {
                throw new IllegalArgumentException("Negative id " + id + " for piece '" + piece + "'");
            }
            final String previous = reverse.put(id, piece);
            if (previous != null) {
                throw new IllegalArgumentException(
                        "Id " + id + " used for both '" + previous + "' and '" + piece + "'");
            }
            pieces.put(piece, id);
        }
        this.vocab = Collections.unmodifiableMap(pieces);
        this.idToPiece = reverse;
        this.merges = merges;
    }

    /**
     * Loads a processor from a {@code vocab.json} file and a merges file.
     *
     * @param vocabFile  JSON object of piece to id
     * @param mergesFile {@code merges.txt} or a JSON {@link MergesDocument}
     * @return the processor
     * @throws IOException if either file cannot be read or parsed
     */
    public static BpeProcessor loadFromFiles(Path vocabFile, Path mergesFile) throws IOException {
        final Map<String, Integer> vocab = readVocab(vocabFile.toFile());
        final MergeTable<String> merges = MergesDocument.load(mergesFile).toStringTable();
        LOGGER.info("Loaded BPE vocabulary of " + vocab.size() + " pieces from " + vocabFile);
        return new BpeProcessor(vocab, merges);
    }

    /**
     * Reads a {@code vocab.json} file.
     *
     * @param jsonFile the JSON file to read
     * @return the mapping in file order
     * @throws IOException if reading fails
     */
    public static Map<String, Integer> readVocab(File jsonFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(jsonFile, vocabType(mapper));
    }

    /**
     * Reads vocabulary JSON from a stream, e.g. a classpath resource.
     *
     * @param in the input stream containing the JSON data
     * @return the mapping in document order
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static Map<String, Integer> readVocab(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(in, vocabType(mapper));
    }

    private static JavaType vocabType(ObjectMapper mapper) {
        return mapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Integer.class);
    }

    /**
     * Merges the initial symbols of a word and looks the pieces up in the vocabulary.
     *
     * @param initialSymbols the unmerged symbols; not modified
     * @return the pieces with their ids ({@link BpeEncoding#MISSING_ID} if not in the vocabulary)
     */
    public BpeEncoding encode(List<String> initialSymbols) {
        final List<String> pieces = MergeApplier.apply(merges, initialSymbols);
        final int[] ids = new int[pieces.size()];
        for (int i = 0; i < ids.length; i++) {
            final Integer id = vocab.get(pieces.get(i));
            ids[i] = id == null ? BpeEncoding.MISSING_ID : id;
        }
        return new BpeEncoding(ids, pieces);
    }

    public int[] encodeAsIds(List<String> initialSymbols) {
        return encode(initialSymbols).getIds();
    }

    public List<String> encodeAsPieces(List<String> initialSymbols) {
        return MergeApplier.apply(merges, initialSymbols);
    }

    /**
     * Concatenates the pieces of the given ids.
     *
     * @param ids vocabulary ids
     * @return the joined piece texts
     * @throws IndexOutOfBoundsException if an id is not in the vocabulary
     */
    public String decodeFromIds(int[] ids) {
        final StringBuilder sb = new StringBuilder();
        for (int id : ids) {
            sb.append(pieceForId(id));
        }
        return sb.toString();
    }

    /**
     * Returns the piece with the given id.
     *
     * @param id a vocabulary id
     * @return the piece text
     * @throws IndexOutOfBoundsException if the id is not in the vocabulary
     */
    public String pieceForId(int id) {
        final String piece = idToPiece.get(id);
        if (piece == null) {
            throw new IndexOutOfBoundsException("invalid piece ID '" + id + "'");
        }
        return piece;
    }

    /**
     * Returns the vocabulary.
     *
     * @return an unmodifiable piece to id map, in construction order
     */
    public Map<String, Integer> getVocab() {
        return vocab;
    }

    public MergeTable<String> getMerges() {
        return merges;
    }
}
