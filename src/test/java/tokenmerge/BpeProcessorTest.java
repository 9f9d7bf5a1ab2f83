package tokenmerge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BpeProcessorTest {

    private static final List<SymbolPair<String>> MERGES = Arrays.asList(
            SymbolPair.of("a", "b"),
            SymbolPair.of("Ġ", "ab"),
            SymbolPair.of("ab", "c"));

    private BpeProcessor processor;

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(BpeProcessorTest.class.getResource(name).toURI());
    }

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = BpeProcessorTest.class.getResourceAsStream("/toy-bpe-vocab.json")) {
            processor = new BpeProcessor(BpeProcessor.readVocab(in), MERGES);
        }
    }

    @Test
    void encodesByRankThenLooksUpIds() {
        BpeEncoding encoding = processor.encode(Arrays.asList("Ġ", "a", "b", "c"));

        assertEquals(Arrays.asList("Ġab", "c"), encoding.getPieces());
        assertArrayEquals(new int[]{5, 2}, encoding.getIds());
        assertFalse(encoding.hasMissing());

        assertArrayEquals(new int[]{6}, processor.encodeAsIds(Arrays.asList("a", "b", "c")));
        assertEquals(Collections.singletonList("abc"), processor.encodeAsPieces(Arrays.asList("a", "b", "c")));
    }

    @Test
    void pieceOutsideVocabularyGetsMissingId() {
        BpeEncoding encoding = processor.encode(Arrays.asList("c", "a", "b", "d"));

        assertEquals(Arrays.asList("c", "ab", "d"), encoding.getPieces());
        assertArrayEquals(new int[]{2, 4, BpeEncoding.MISSING_ID}, encoding.getIds());
        assertTrue(encoding.hasMissing());
    }

    @Test
    void encodeLeavesInputUntouched() {
        List<String> symbols = Arrays.asList("a", "b");
        processor.encode(symbols);
        assertEquals(Arrays.asList("a", "b"), symbols);
        assertEquals(0, processor.encode(Collections.<String>emptyList()).size());
    }

    @Test
    void decodesIdsByConcatenatingPieces() {
        assertEquals("Ġabc", processor.decodeFromIds(new int[]{5, 2}));
        assertEquals("", processor.decodeFromIds(new int[0]));
        assertEquals("abc", processor.pieceForId(6));
    }

    @Test
    void decodeRejectsUnknownIds() {
        IndexOutOfBoundsException e = assertThrows(IndexOutOfBoundsException.class,
                () -> processor.decodeFromIds(new int[]{0, 7}));
        assertEquals("invalid piece ID '7'", e.getMessage());
        assertThrows(IndexOutOfBoundsException.class,
                () -> processor.decodeFromIds(new int[]{BpeEncoding.MISSING_ID}));
    }

    @Test
    void emptyProcessorNeverMerges() {
        BpeProcessor empty = new BpeProcessor(Collections.<String, Integer>emptyMap(),
                Collections.<SymbolPair<String>>emptyList());
        List<String> symbols = Arrays.asList("t", "h", "e", "y");

        assertEquals(symbols, empty.encodeAsPieces(symbols));
        assertArrayEquals(new int[]{-1, -1, -1, -1}, empty.encodeAsIds(symbols));
        assertTrue(empty.getVocab().isEmpty());
        assertTrue(empty.getMerges().isEmpty());
    }

    @Test
    void loadsVocabularyAndMergesFromFiles() throws Exception {
        BpeProcessor loaded = BpeProcessor.loadFromFiles(
                resource("/toy-bpe-vocab.json"), resource("/toy-bpe-merges.txt"));

        assertEquals(processor.getVocab(), loaded.getVocab());
        assertEquals(processor.getMerges(), loaded.getMerges());
        assertEquals(MERGES, loaded.getMerges().pairs());
        assertArrayEquals(new int[]{5, 2}, loaded.encodeAsIds(Arrays.asList("Ġ", "a", "b", "c")));
    }

    @Test
    void vocabularyKeepsDocumentOrder() {
        assertEquals(Arrays.asList("a", "b", "c", "Ġ", "ab", "Ġab", "abc"),
                Arrays.asList(processor.getVocab().keySet().toArray(new String[0])));
        assertThrows(UnsupportedOperationException.class, () -> processor.getVocab().put("x", 9));
    }

    @Test
    void rejectsInvalidVocabulary() {
        Map<String, Integer> shared = new LinkedHashMap<>();
        shared.put("a", 0);
        shared.put("b", 0);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new BpeProcessor(shared, MERGES));
        assertEquals("Id 0 used for both 'a' and 'b'", e.getMessage());

        Map<String, Integer> negative = Collections.singletonMap("a", -2);
        assertThrows(IllegalArgumentException.class, () -> new BpeProcessor(negative, MERGES));
    }

    @Test
    void rejectsIncorrectMerges() throws IOException {
        MergesDocument triple = MergesDocument.fromJson(new ByteArrayInputStream(
                "{\"merges\":[[\"a\",\"b\",\"c\"]]}".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalArgumentException.class,
                () -> new BpeProcessor(processor.getVocab(), triple.toStringTable()));

        List<SymbolPair<String>> repeated = Arrays.asList(SymbolPair.of("a", "b"), SymbolPair.of("a", "b"));
        assertThrows(IllegalArgumentException.class,
                () -> new BpeProcessor(processor.getVocab(), repeated));
    }
}
