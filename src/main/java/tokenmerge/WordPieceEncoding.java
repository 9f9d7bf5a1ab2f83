package tokenmerge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link WordPieceProcessor#encode(String)}: piece ids and their surface strings.
 * <p>
 * A piece that could not be matched is reported with id {@link #MISSING_ID} and a
 * {@code null} piece string. Continuation pieces carry the {@code ##} marker.
 * </p>
 */
public final class WordPieceEncoding {
    /**
     * Id reported for an unmatched remainder.
     */
    public static final int MISSING_ID = -1;

    private final int[] ids;
    private final List<String> pieces;

    WordPieceEncoding(int[] ids, List<String> pieces) {
        this.ids = ids;
        this.pieces = Collections.unmodifiableList(new ArrayList<>(pieces));
    }

    /**
     * Returns the piece ids.
     *
     * @return a copy of the ids
     */
    public int[] getIds() {
        return ids.clone();
    }

    /**
     * Returns the piece strings; {@code null} entries mark missing pieces.
     *
     * @return an unmodifiable list
     */
    public List<String> getPieces() {
        return pieces;
    }

    /**
     * Returns {@code true} if some part of the token could not be matched.
     *
     * @return whether a missing marker is present
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
        if (!(o instanceof WordPieceEncoding)) return false;
        WordPieceEncoding e = (WordPieceEncoding) o;
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
