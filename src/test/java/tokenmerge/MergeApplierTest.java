package tokenmerge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeApplierTest {

    private static MergeTable<String> strings(String... pairs) {
        List<SymbolPair<String>> out = new ArrayList<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.add(SymbolPair.of(pairs[i], pairs[i + 1]));
        }
        return MergeTable.ofStringPairs(out);
    }

    @Test
    void emptyAndSingletonAreReturnedUnchanged() {
        MergeTable<String> table = strings("a", "b");
        assertEquals(Collections.emptyList(), MergeApplier.apply(table, Collections.<String>emptyList()));
        assertEquals(Collections.singletonList("a"), MergeApplier.apply(table, Collections.singletonList("a")));
    }

    @Test
    void mergesInRankOrderOverSeveralRounds() {
        MergeTable<String> table = strings("a", "b", "ab", "c");
        assertEquals(Collections.singletonList("abc"), table.apply(Arrays.asList("a", "b", "c")));
    }

    @Test
    void oneRoundMergesEveryOccurrenceOfTheBestPair() {
        MergeTable<String> table = strings("b", "c");
        assertEquals(Arrays.asList("a", "bc", "bc"), table.apply(Arrays.asList("a", "b", "c", "b", "c")));
    }

    @Test
    void irreducibleSequenceIsReturnedAsIs() {
        MergeTable<String> table = strings("a", "b", "b", "c");
        assertEquals(Arrays.asList("x", "y", "z"), table.apply(Arrays.asList("x", "y", "z")));
    }

    @Test
    void lowerRankWinsOverLeftmostPosition() {
        // (b,c) has rank 0, so it is merged before (a,b) even though (a,b) comes first.
        MergeTable<String> table = strings("b", "c", "a", "b");
        assertEquals(Arrays.asList("a", "bc"), table.apply(Arrays.asList("a", "b", "c")));
    }

    @Test
    void overlappingOccurrencesMergeLeftToRight() {
        MergeTable<String> table = strings("a", "a");
        assertEquals(Arrays.asList("aa", "a"), table.apply(Arrays.asList("a", "a", "a")));
        assertEquals(Arrays.asList("aa", "aa"), table.apply(Arrays.asList("a", "a", "a", "a")));
    }

    @Test
    void applyingTwiceIsIdempotent() {
        MergeTable<String> table = strings("h", "e", "l", "l", "he", "ll", "hell", "o");
        List<String> once = table.apply(Arrays.asList("h", "e", "l", "l", "o", "w"));
        assertEquals(Arrays.asList("hello", "w"), once);
        assertEquals(once, table.apply(once));
    }

    @Test
    void callerSequenceIsNotModified() {
        MergeTable<String> table = strings("a", "b");
        List<String> input = new ArrayList<>(Arrays.asList("a", "b", "a"));
        List<String> out = table.apply(input);
        assertEquals(Arrays.asList("ab", "a"), out);
        assertEquals(Arrays.asList("a", "b", "a"), input);
        assertNotSame(input, out);
    }

    @Test
    void acceptsImmutableInput() {
        MergeTable<String> table = strings("a", "b");
        assertEquals(Collections.singletonList("ab"), table.apply(List.of("a", "b")));
    }

    @Test
    void mergesIdsWithPrecomputedOutputs() {
        MergeTable<Integer> table = MergeTable.build(Arrays.asList(
                MergeRule.of(1, 2, 10),
                MergeRule.of(10, 3, 11)));

        assertArrayEquals(new int[]{11, 10}, MergeApplier.applyIds(table, new int[]{1, 2, 3, 1, 2}));
        assertArrayEquals(new int[]{}, MergeApplier.applyIds(table, new int[]{}));
        assertArrayEquals(new int[]{7}, MergeApplier.applyIds(table, new int[]{7}));
        assertArrayEquals(new int[]{2, 1}, MergeApplier.applyIds(table, new int[]{2, 1}));
    }

    @Test
    void emptyTableNeverMerges() {
        MergeTable<Integer> table = MergeTable.build(Collections.<MergeRule<Integer>>emptyList());
        assertEquals(Arrays.asList(1, 2, 3), MergeApplier.apply(table, Arrays.asList(1, 2, 3)));
    }
}
