package tokenmerge;

import java.util.Objects;

/**
 * Shared hash mixing for composite keys.
 * <p>
 * Uses the Boost {@code hash_combine} recipe so that keys made of several
 * fields ({@link SymbolPair}, {@link Piece}) hash structurally and spread
 * well in a {@link java.util.HashMap}.
 * </p>
 */
public final class HashCombine {
    /**
     * Golden-ratio constant from the Boost recipe (truncated to 32 bits).
     */
    private static final int GOLDEN = 0x9e3779b9;

    private HashCombine() {
    }

    /**
     * Mixes the hash of {@code value} into {@code seed}.
     *
     * @param seed  the running hash
     * @param value the value to mix in; {@code null} hashes to 0
     * @return the combined hash
     */
    public static int combine(int seed, Object value) {
        return mix(seed, Objects.hashCode(value));
    }

    /**
     * Mixes a boolean into {@code seed}.
     *
     * @param seed  the running hash
     * @param value the flag to mix in
     * @return the combined hash
     */
    public static int combine(int seed, boolean value) {
        return mix(seed, Boolean.hashCode(value));
    }

    private static int mix(int seed, int h) {
        return seed ^ (h + GOLDEN + (seed << 6) + (seed >>> 2));
    }
}
