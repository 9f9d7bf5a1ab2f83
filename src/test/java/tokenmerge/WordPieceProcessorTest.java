package tokenmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class WordPieceProcessorTest {

    private static final List<String> TOKEN_PIECES =
            Arrays.asList("voor", "##tie", "coördina", "##kom", "##en");

    private WordPieceProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new WordPieceProcessor(TOKEN_PIECES);
    }

    @Test
    void encodesLongestMatchFirst() {
        assertEquals(new WordPieceEncoding(new int[]{0}, Collections.singletonList("voor")),
                processor.encode("voor"));
        assertEquals(new WordPieceEncoding(new int[]{2, 1}, Arrays.asList("coördina", "##tie")),
                processor.encode("coördinatie"));
        assertEquals(new WordPieceEncoding(new int[]{0, 3, 4}, Arrays.asList("voor", "##kom", "##en")),
                processor.encode("voorkomen"));
    }

    @Test
    void unmatchedRemainderIsMarkedMissing() {
        WordPieceEncoding enc = processor.encode("voorman");
        assertArrayEquals(new int[]{0, -1}, enc.getIds());
        assertEquals(Arrays.asList("voor", null), enc.getPieces());
        assertTrue(enc.hasMissing());

        assertArrayEquals(new int[]{-1}, processor.encode("tie").getIds());
    }

    @Test
    void emptyTokenEncodesToNothing() {
        assertEquals(0, processor.encode("").size());
    }

    @Test
    void decodesIds() {
        assertEquals("voor", processor.decode(new int[]{0}));
        assertEquals("coördinatie", processor.decode(new int[]{2, 1}));
        assertEquals("voorkomen", processor.decode(new int[]{0, 3, 4}));
        assertEquals("voor coördina", processor.decode(new int[]{0, 2}));
        assertEquals("", processor.decode(new int[]{}));
    }

    @Test
    void decodingMissingIdFails() {
        assertThrows(IndexOutOfBoundsException.class, () -> processor.decode(new int[]{0, -1}));
        assertThrows(IndexOutOfBoundsException.class, () -> processor.decode(new int[]{5}));
    }

    @Test
    void getInitialOnlyFindsInitialPieces() {
        assertEquals(0, processor.getInitial("voor"));
        assertThrows(NoSuchElementException.class, () -> processor.getInitial("##tie"));
        assertThrows(NoSuchElementException.class, () -> processor.getInitial("tie"));
    }

    @Test
    void pieceIdValidity() {
        assertFalse(processor.isValidPieceId(-1));
        assertTrue(processor.isValidPieceId(0));
        assertTrue(processor.isValidPieceId(TOKEN_PIECES.size() - 1));
        assertFalse(processor.isValidPieceId(TOKEN_PIECES.size()));
        assertEquals(Piece.continuation("kom"), processor.idToPiece(3));
    }

    @Test
    void toListReproducesVocabulary() {
        assertEquals(TOKEN_PIECES, processor.toList());
        assertEquals(5, processor.size());
    }

    @Test
    void duplicateVocabularyEntryIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new WordPieceProcessor(Arrays.asList("a", "##a", "a")));
    }

    @Test
    void neverSplitsSurrogatePairs() {
        // Only the high surrogate of U+1F600 is in the vocabulary.
        WordPieceProcessor p = new WordPieceProcessor(Arrays.asList("x", "##\uD83D"));
        assertArrayEquals(new int[]{0, -1}, p.encode("x😀").getIds());

        WordPieceProcessor q = new WordPieceProcessor(Arrays.asList("x", "##😀"));
        assertArrayEquals(new int[]{0, 1}, q.encode("x😀").getIds());
    }

    @Test
    void loadsFromResource() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/toy-word-pieces.txt")) {
            assertNotNull(in);
            assertEquals(TOKEN_PIECES, WordPieceProcessor.fromInputStream(in).toList());
        }
    }

    @Test
    void loadsFromFileSkippingBlankLinesAndBom(@TempDir Path dir) throws IOException {
        Path vocab = dir.resolve("vocab.txt");
        Files.write(vocab, Arrays.asList("\uFEFFvoor", "", "##tie", "coördina", "##kom", "##en", ""),
                StandardCharsets.UTF_8);
        assertEquals(TOKEN_PIECES, WordPieceProcessor.fromFile(vocab).toList());
    }

    @Test
    void whitespaceInsideVocabularyLinesIsKept(@TempDir Path dir) throws IOException {
        Path vocab = dir.resolve("vocab.txt");
        Files.write(vocab, Arrays.asList("voor", " ", "##en ", "\t"), StandardCharsets.UTF_8);
        WordPieceProcessor p = WordPieceProcessor.fromFile(vocab);

        assertEquals(Arrays.asList("voor", " ", "##en ", "\t"), p.toList());
        assertEquals(1, p.getInitial(" "));
        assertEquals(new WordPieceEncoding(new int[]{0, 2}, Arrays.asList("voor", "##en ")), p.encode("vooren "));
    }
}
