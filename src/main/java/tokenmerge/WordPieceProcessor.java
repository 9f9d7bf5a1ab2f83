package tokenmerge;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * WordPiece tokenizer over a {@link PieceStorage}.
 *
 * <p>The vocabulary is an ordered list of strings; the list index is the piece id.
 * Entries starting with {@code ##} are continuation pieces, all others are
 * word-initial pieces. For example the list
 * {@code ["voor", "##tie", "coördina", "##kom", "##en"]} encodes
 * {@code "voorkomen"} as ids {@code [0, 3, 4]}.</p>
 *
 * <p>Encoding is greedy longest-match-first: at every position the longest
 * vocabulary piece that matches is taken, the first one from the initial pieces
 * and the following ones from the continuation pieces.</p>
 */
public class WordPieceProcessor {
    private static final Logger LOGGER = Diagnostics.logger(WordPieceProcessor.class);

    /**
     * Marker prefix of continuation pieces in vocabulary lists.
     */
    public static final String CONTINUATION_PREFIX = "##";

    private final PieceStorage storage = new PieceStorage();

    /**
     * Longest initial / continuation piece, in UTF-16 units; bounds the match scan.
     */
    private int maxInitialLength;
    private int maxContinuationLength;

    /**
     * Creates a processor from an ordered vocabulary list.
     *
     * @param pieces vocabulary strings, continuation pieces prefixed with {@code ##}
     * @throws IllegalArgumentException if an entry occurs twice
     */
    public WordPieceProcessor(List<String> pieces) {
        Objects.requireNonNull(pieces, "pieces");
        for (String raw : pieces) {
            Objects.requireNonNull(raw, "piece");
            final boolean initial = !raw.startsWith(CONTINUATION_PREFIX);
            final String text = initial ? raw : raw.substring(CONTINUATION_PREFIX.length());

            final int expected = storage.size();
            if (storage.addPiece(text, initial) != expected) {
                throw new IllegalArgumentException("Duplicate word piece '" + raw + "' at index " + expected);
            }

            if (initial) {
                maxInitialLength = Math.max(maxInitialLength, text.length());
            } else {
                maxContinuationLength = Math.max(maxContinuationLength, text.length());
            }
        }
    }

    /**
     * Reads a vocabulary file with one piece per line.
     *
     * @param path the vocabulary file (UTF-8)
     * @return the processor
     * @throws IOException if the file cannot be read
     */
    public static WordPieceProcessor fromFile(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final WordPieceProcessor p = new WordPieceProcessor(readPieces(br));
            LOGGER.info("Loaded " + p.size() + " word pieces from " + path);
            return p;
        }
    }

    /**
     * Reads a vocabulary with one piece per line from a stream, e.g. a classpath resource.
     *
     * @param in the UTF-8 input
     * @return the processor
     * @throws IOException if reading fails
     */
    public static WordPieceProcessor fromInputStream(InputStream in) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return new WordPieceProcessor(readPieces(br));
        }
    }

    /**
     * Parses vocabulary lines. Only the line terminator and a leading BOM are removed;
     * other whitespace belongs to the piece. Empty lines are skipped.
     */
    private static List<String> readPieces(BufferedReader br) throws IOException {
        final List<String> pieces = new ArrayList<>();
        int lineNo = 0;
        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw;
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1); // strip BOM
            }
            if (line.isEmpty()) continue;
            pieces.add(line);
        }
        return pieces;
    }

    /**
     * Splits a single token into word pieces.
     *
     * <p>If at some position no piece matches, a missing marker
     * ({@link WordPieceEncoding#MISSING_ID}, {@code null} piece) is appended and
     * the rest of the token is not encoded.</p>
     *
     * @param token a single pre-tokenized word
     * @return the ids and pieces; empty for an empty token
     */
    public WordPieceEncoding encode(String token) {
        Objects.requireNonNull(token, "token");
        final List<Integer> ids = new ArrayList<>();
        final List<String> pieces = new ArrayList<>();

        final int len = token.length();
        int start = 0;
        while (start < len) {
            final boolean initial = start == 0;
            final int maxLen = initial ? maxInitialLength : maxContinuationLength;

            int matchEnd = -1;
            int matchId = WordPieceEncoding.MISSING_ID;
            for (int end = Math.min(len, start + maxLen); end > start; end--) {
                if (end < len && Character.isLowSurrogate(token.charAt(end))
                        && Character.isHighSurrogate(token.charAt(end - 1))) {
                    continue; // never split a surrogate pair
                }
                final OptionalInt id = storage.tryPieceToId(new Piece(token.substring(start, end), initial));
                if (id.isPresent()) {
                    matchEnd = end;
                    matchId = id.getAsInt();
                    break;
                }
            }

            if (matchEnd < 0) {
                ids.add(WordPieceEncoding.MISSING_ID);
                pieces.add(null);
                break;
            }

            ids.add(matchId);
            final String text = token.substring(start, matchEnd);
            pieces.add(initial ? text : CONTINUATION_PREFIX + text);
            start = matchEnd;
        }

        final int[] out = new int[ids.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ids.get(i);
        }
        return new WordPieceEncoding(out, pieces);
    }

    /**
     * Converts piece ids back to text. An initial piece after the first starts a new
     * word and is preceded by a single space.
     *
     * @param ids the piece ids
     * @return the decoded text
     * @throws IndexOutOfBoundsException if an id is not a valid piece id
     */
    public String decode(int[] ids) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ids.length; i++) {
            final Piece piece = storage.idToPiece(ids[i]);
            if (i > 0 && piece.isInitial()) {
                sb.append(' ');
            }
            sb.append(piece.getText());
        }
        return sb.toString();
    }

    /**
     * Returns the id of the word-initial piece with the given text.
     *
     * @param piece the piece text
     * @return its id
     * @throws NoSuchElementException if there is no such initial piece
     */
    public int getInitial(String piece) {
        return storage.pieceToId(Piece.initial(piece));
    }

    /**
     * Checks whether {@code id} is a valid piece id.
     *
     * @param id the id
     * @return {@code true} if the id refers to a piece
     */
    public boolean isValidPieceId(int id) {
        return storage.isValidId(id);
    }

    /**
     * Returns the vocabulary in id order, continuation pieces prefixed with {@code ##}.
     *
     * @return a new list equal to the one the processor was built from
     */
    public List<String> toList() {
        final List<String> out = new ArrayList<>(storage.size());
        for (Piece p : storage.pieces()) {
            out.add(p.isInitial() ? p.getText() : CONTINUATION_PREFIX + p.getText());
        }
        return out;
    }

    public int size() {
        return storage.size();
    }

    /**
     * Returns the piece registered under {@code id}.
     *
     * @param id the piece id
     * @return the piece
     * @throws IndexOutOfBoundsException if the id is not valid
     */
    public Piece idToPiece(int id) {
        return storage.idToPiece(id);
    }

    @Override
    public String toString() {
        return "<WordPieceProcessor with " + storage.size() + " pieces>";
    }
}
