package tokenmerge;

import java.util.Objects;

/**
 * Ordered pair of adjacent symbols, used as the lookup key of a {@link MergeTable}.
 * <p>
 * Equality is structural on both symbols. The hash is computed once at
 * construction since pairs are looked up repeatedly while merging.
 * </p>
 *
 * @param <S> the symbol type
 */
public final class SymbolPair<S> {
    private final S left;
    private final S right;
    private final int hash;

    private SymbolPair(S left, S right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.hash = HashCombine.combine(HashCombine.combine(0, left), right);
    }

    /**
     * Creates a pair.
     *
     * @param left  the left symbol
     * @param right the right symbol
     * @param <S>   the symbol type
     * @return the pair {@code (left, right)}
     * @throws NullPointerException if either symbol is {@code null}
     */
    public static <S> SymbolPair<S> of(S left, S right) {
        return new SymbolPair<>(left, right);
    }

    public S getLeft() {
        return left;
    }

    public S getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolPair)) return false;
        SymbolPair<?> p = (SymbolPair<?>) o;
        return hash == p.hash && left.equals(p.left) && right.equals(p.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
