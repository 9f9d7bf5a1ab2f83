package tokenmerge;

import java.util.Objects;

/**
 * Value stored for each pair in a {@link MergeTable}: its priority and merged symbol.
 *
 * @param <S> the symbol type
 */
public final class MergeValue<S> {
    /**
     * Priority of the rule; lower is applied first.
     */
    private final int rank;
    private final S output;

    MergeValue(int rank, S output) {
        this.rank = rank;
        this.output = output;
    }

    public int getRank() {
        return rank;
    }

    public S getOutput() {
        return output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeValue)) return false;
        MergeValue<?> v = (MergeValue<?>) o;
        return rank == v.rank && output.equals(v.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, output);
    }

    @Override
    public String toString() {
        return "MergeValue{rank=" + rank + ", output=" + output + "}";
    }
}
