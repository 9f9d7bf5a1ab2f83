package tokenmerge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link BpeProcessor#encode(List)}: merged pieces and their vocabulary ids.
 * <p>
 * Pieces are always present. A piece that is not in the vocabulary gets id {@link #MISSING_ID}.
 * </p>
 */
public final class BpeEncoding {
    public static final int MISSING_ID = -1;

    private final int[] ids;
    private final List<String> pieces;

    BpeEncoding(int[] ids, List<String> pieces) {
        this.ids = ids;
        this.pieces = Collections.unmodifiableList(new ArrayList<>(pieces));
    }

    public int[] getIds() {
        return ids.clone();
    }

    public List<String> getPieces() {
        return pieces;
    }

    /**
     * Returns {@code true} if a merged piece has no vocabulary id.
     *
     * @return whether {@link #MISSING_ID} occurs in the ids
     */
    public boolean hasMissing() {
        for (int id : ids) {
            if (id == MISSING_ID) return true;
        }
        return false;
    }

    public int size() {
        return ids.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BpeEncoding)) return false;
        BpeEncoding e = (BpeEncoding) o;
        return Arrays.equals(ids, e.ids) && pieces.equals(e.pieces);
    }

    @Override
    public int hashCode() {
        return HashCombine.combine(Arrays.hashCode(ids), pieces);
    }

    @Override
    public String toString() {
        return "(" + Arrays.toString(ids) + ", " + pieces + ")";
    }
}
