package tokenmerge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy pair merging driven by a {@link MergeTable}.
 *
 * <p>Each round scans the current sequence for the adjacent pair with the lowest
 * rank (the leftmost one wins ties), then rebuilds the sequence replacing
 * <em>every</em> non-overlapping occurrence of that pair, left to right, by its
 * merged symbol. Rounds repeat until a single symbol remains or no adjacent pair
 * is a merge rule.</p>
 *
 * <p>A round costs O(n) and there are at most n rounds, so the worst case is
 * O(n&sup2;). The caller's sequence is never modified.</p>
 */
public final class MergeApplier {
    private MergeApplier() {
    }

    /**
     * Merges {@code symbols} until they are irreducible under {@code table}.
     *
     * @param table   the merge rules
     * @param symbols the initial symbols; not modified
     * @param <S>     the symbol type
     * @return a new list with the merged symbols
     */
    public static <S> List<S> apply(MergeTable<S> table, List<S> symbols) {
        Objects.requireNonNull(table, "table");
        List<S> current = new ArrayList<>(Objects.requireNonNull(symbols, "symbols"));

        while (current.size() > 1) {
            final int best = findBestPair(table, current);
            if (best < 0) {
                break; // irreducible
            }

            final S left = current.get(best);
            final S right = current.get(best + 1);
            final S merged = table.lookup(SymbolPair.of(left, right)).getOutput();

            final int n = current.size();
            final List<S> next = new ArrayList<>(n - 1);
            int i = 0;
            while (i < n) {
                if (i < n - 1 && current.get(i).equals(left) && current.get(i + 1).equals(right)) {
                    next.add(merged);
                    i += 2;
                } else {
                    next.add(current.get(i));
                    i++;
                }
            }
            current = next;
        }

        return current;
    }

    /**
     * Merges a sequence of integer ids.
     *
     * @param table the id merge rules
     * @param ids   the initial ids; not modified
     * @return a new array with the merged ids
     */
    public static int[] applyIds(MergeTable<Integer> table, int[] ids) {
        Objects.requireNonNull(ids, "ids");
        final List<Integer> boxed = new ArrayList<>(ids.length);
        for (int id : ids) {
            boxed.add(id);
        }
        final List<Integer> merged = apply(table, boxed);
        final int[] out = new int[merged.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = merged.get(i);
        }
        return out;
    }

    /**
     * Returns the index of the left symbol of the lowest-ranked mergeable pair, or
     * {@code -1} when no adjacent pair is in the table. Only a strictly smaller
     * rank replaces the current best, so the leftmost occurrence wins.
     */
    private static <S> int findBestPair(MergeTable<S> table, List<S> symbols) {
        int bestIndex = -1;
        int bestRank = Integer.MAX_VALUE;
        for (int i = 0; i < symbols.size() - 1; i++) {
            final MergeValue<S> v = table.lookup(SymbolPair.of(symbols.get(i), symbols.get(i + 1)));
            if (v != null && v.getRank() < bestRank) {
                bestIndex = i;
                bestRank = v.getRank();
            }
        }
        return bestIndex;
    }
}
