package tokenmerge;

import java.util.*;
import java.util.function.BinaryOperator;

/**
 * Immutable lookup table of merge rules, keyed by the adjacent pair they merge.
 *
 * <p>The table is built once from an ordered list of rules. The position of a
 * rule in that list is its <em>rank</em>: rule {@code 0} has the highest
 * priority. Ranks are therefore a permutation of {@code 0..size()-1} and
 * {@link #rules()} reproduces the original list exactly.</p>
 *
 * <p>Two symbol domains are covered by the same class:</p>
 * <ul>
 *     <li>integer ids, where each rule stores a precomputed merged id
 *         ({@link #build(List)});</li>
 *     <li>string fragments, where the merged symbol is the concatenation of the
 *         pair ({@link #ofStringPairs(List)}).</li>
 * </ul>
 *
 * <p>Instances are never modified after construction and may be shared between
 * threads once published.</p>
 *
 * @param <S> the symbol type; must have structural {@code equals}/{@code hashCode}
 */
public final class MergeTable<S> {
    private final Map<SymbolPair<S>, MergeValue<S>> merges;

    private MergeTable(Map<SymbolPair<S>, MergeValue<S>> merges) {
        this.merges = Collections.unmodifiableMap(merges);
    }

    /**
     * Builds a table from an ordered list of rules. Rule {@code i} receives rank {@code i}.
     *
     * @param rules the merge rules, highest priority first
     * @param <S>   the symbol type
     * @return the table
     * @throws IllegalArgumentException if two rules share the same pair
     * @throws NullPointerException     if the list or one of its rules is {@code null}
     */
    public static <S> MergeTable<S> build(List<MergeRule<S>> rules) {
        Objects.requireNonNull(rules, "rules");
        final Map<SymbolPair<S>, MergeValue<S>> m = new HashMap<>(Math.max(16, rules.size() * 4 / 3 + 1));
        for (int i = 0; i < rules.size(); i++) {
            final MergeRule<S> rule = Objects.requireNonNull(rules.get(i), "rule at rank " + i);
            final MergeValue<S> previous = m.putIfAbsent(rule.getPair(), new MergeValue<>(i, rule.getOutput()));
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate merge pair " + rule.getPair()
                        + " at ranks " + previous.getRank() + " and " + i);
            }
        }
        return new MergeTable<>(m);
    }

    /**
     * Builds a table from an ordered list of pairs, computing each merged symbol with
     * {@code combiner} while the table is constructed.
     *
     * @param pairs    the pairs to merge, highest priority first
     * @param combiner produces the merged symbol of a pair
     * @param <S>      the symbol type
     * @return the table
     * @throws IllegalArgumentException if a pair occurs twice
     */
    public static <S> MergeTable<S> fromPairs(List<SymbolPair<S>> pairs, BinaryOperator<S> combiner) {
        Objects.requireNonNull(pairs, "pairs");
        Objects.requireNonNull(combiner, "combiner");
        final List<MergeRule<S>> rules = new ArrayList<>(pairs.size());
        for (SymbolPair<S> p : pairs) {
            rules.add(MergeRule.of(p, combiner.apply(p.getLeft(), p.getRight())));
        }
        return build(rules);
    }

    /**
     * Builds a string-domain table where each pair merges into the concatenation
     * {@code left + right}.
     *
     * @param pairs the pairs to merge, highest priority first
     * @return the table
     * @throws IllegalArgumentException if a pair occurs twice
     */
    public static MergeTable<String> ofStringPairs(List<SymbolPair<String>> pairs) {
        return fromPairs(pairs, String::concat);
    }

    /**
     * Looks up the rank and merged symbol of the pair {@code (left, right)}.
     *
     * @param left  the left symbol
     * @param right the right symbol
     * @return the entry, or empty if the pair is not a merge rule
     */
    public Optional<MergeValue<S>> rankAndOutput(S left, S right) {
        return rankAndOutput(SymbolPair.of(left, right));
    }

    /**
     * Looks up the rank and merged symbol of {@code pair}.
     *
     * @param pair the pair to look up
     * @return the entry, or empty if the pair is not a merge rule
     */
    public Optional<MergeValue<S>> rankAndOutput(SymbolPair<S> pair) {
        return Optional.ofNullable(merges.get(pair));
    }

    /**
     * Hot-path lookup used by {@link MergeApplier}; {@code null} when absent.
     */
    MergeValue<S> lookup(SymbolPair<S> pair) {
        return merges.get(pair);
    }

    /**
     * Returns all rules in rank order, i.e. in the order the table was built from.
     *
     * @return a new list of rules
     */
    public List<MergeRule<S>> rules() {
        final List<MergeRule<S>> out = new ArrayList<>(Collections.nCopies(merges.size(), (MergeRule<S>) null));
        for (Map.Entry<SymbolPair<S>, MergeValue<S>> e : merges.entrySet()) {
            out.set(e.getValue().getRank(), MergeRule.of(e.getKey(), e.getValue().getOutput()));
        }
        return out;
    }

    /**
     * Returns the merged pairs in rank order, without their outputs.
     *
     * @return a new list of pairs
     */
    public List<SymbolPair<S>> pairs() {
        final List<MergeRule<S>> rules = rules();
        final List<SymbolPair<S>> out = new ArrayList<>(rules.size());
        for (MergeRule<S> r : rules) {
            out.add(r.getPair());
        }
        return out;
    }

    /**
     * Applies the table to {@code symbols}; see {@link MergeApplier#apply(MergeTable, List)}.
     *
     * @param symbols the initial symbols
     * @return the merged symbols
     */
    public List<S> apply(List<S> symbols) {
        return MergeApplier.apply(this, symbols);
    }

    public int size() {
        return merges.size();
    }

    public boolean isEmpty() {
        return merges.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeTable)) return false;
        return merges.equals(((MergeTable<?>) o).merges);
    }

    @Override
    public int hashCode() {
        return merges.hashCode();
    }

    @Override
    public String toString() {
        return "<MergeTable with " + merges.size() + " merges>";
    }
}
