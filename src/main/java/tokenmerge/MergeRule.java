package tokenmerge;

import java.util.Objects;

/**
 * A single merge rule: the adjacent pair {@code (left, right)} is replaced by {@code output}.
 * <p>
 * Rules carry no rank of their own; the rank is the rule's position in the list
 * handed to {@link MergeTable#build(java.util.List)}.
 * </p>
 *
 * @param <S> the symbol type
 */
public final class MergeRule<S> {
    private final SymbolPair<S> pair;
    private final S output;

    private MergeRule(SymbolPair<S> pair, S output) {
        this.pair = Objects.requireNonNull(pair, "pair");
        this.output = Objects.requireNonNull(output, "output");
    }

    /**
     * Creates a rule from its two inputs and its output.
     *
     * @param left   the left input symbol
     * @param right  the right input symbol
     * @param output the merged symbol
     * @param <S>    the symbol type
     * @return a new rule
     */
    public static <S> MergeRule<S> of(S left, S right, S output) {
        return new MergeRule<>(SymbolPair.of(left, right), output);
    }

    /**
     * Creates a rule for an existing pair.
     *
     * @param pair   the input pair
     * @param output the merged symbol
     * @param <S>    the symbol type
     * @return a new rule
     */
    public static <S> MergeRule<S> of(SymbolPair<S> pair, S output) {
        return new MergeRule<>(pair, output);
    }

    public SymbolPair<S> getPair() {
        return pair;
    }

    public S getLeft() {
        return pair.getLeft();
    }

    public S getRight() {
        return pair.getRight();
    }

    public S getOutput() {
        return output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeRule)) return false;
        MergeRule<?> r = (MergeRule<?>) o;
        return pair.equals(r.pair) && output.equals(r.output);
    }

    @Override
    public int hashCode() {
        return HashCombine.combine(pair.hashCode(), output);
    }

    @Override
    public String toString() {
        return pair + " -> " + output;
    }
}
