package tokenmerge;

import java.util.*;

/**
 * Append-only bidirectional registry between {@link Piece}s and dense ids.
 *
 * <p>Ids are assigned in insertion order starting at {@code 0}. Both directions
 * are kept inside this class and {@link #addPiece(String, boolean)} is the only
 * mutator, so every id in {@code [0, size())} maps to exactly one piece and every
 * registered piece maps back to exactly one id.</p>
 *
 * <p>Adding a piece that is already registered is idempotent: the existing id is
 * returned and nothing changes.</p>
 *
 * <p>Not thread-safe while pieces are being added. Once filled, concurrent reads
 * are safe.</p>
 */
public final class PieceStorage {
    private final List<Piece> idToPiece = new ArrayList<>();
    private final Map<Piece, Integer> pieceToId = new HashMap<>();

    /**
     * Registers a piece and returns its id.
     *
     * @param text    the piece text
     * @param initial {@code true} if the piece may start a word
     * @return the id of the piece; the existing id if it was already registered
     */
    public int addPiece(String text, boolean initial) {
        final Piece piece = new Piece(text, initial);
        final Integer existing = pieceToId.get(piece);
        if (existing != null) {
            return existing;
        }
        final int id = idToPiece.size();
        idToPiece.add(piece);
        pieceToId.put(piece, id);
        return id;
    }

    /**
     * Returns the number of registered pieces.
     *
     * @return the piece count
     */
    public int size() {
        return idToPiece.size();
    }

    /**
     * Checks whether {@code id} refers to a registered piece.
     *
     * @param id the id to check
     * @return {@code true} if {@code 0 <= id < size()}
     */
    public boolean isValidId(int id) {
        return id >= 0 && id < idToPiece.size();
    }

    /**
     * Returns the piece registered under {@code id}.
     *
     * @param id the piece id
     * @return the piece
     * @throws IndexOutOfBoundsException if {@code id < 0 || id >= size()}
     */
    public Piece idToPiece(int id) {
        if (!isValidId(id)) {
            throw new IndexOutOfBoundsException("invalid piece ID '" + id + "'");
        }
        return idToPiece.get(id);
    }

    /**
     * Returns the id of {@code piece}.
     *
     * @param piece the piece to look up
     * @return its id
     * @throws NoSuchElementException if the piece was never registered
     */
    public int pieceToId(Piece piece) {
        final Integer id = pieceToId.get(Objects.requireNonNull(piece, "piece"));
        if (id == null) {
            throw new NoSuchElementException("unknown piece '" + piece + "'");
        }
        return id;
    }

    /**
     * Returns the id of {@code piece}, or empty if it was never registered.
     *
     * @param piece the piece to look up
     * @return the id, if any
     */
    public OptionalInt tryPieceToId(Piece piece) {
        final Integer id = pieceToId.get(Objects.requireNonNull(piece, "piece"));
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * Returns the registered pieces in id order.
     *
     * @return an unmodifiable view
     */
    public List<Piece> pieces() {
        return Collections.unmodifiableList(idToPiece);
    }

    @Override
    public String toString() {
        return "<PieceStorage with " + idToPiece.size() + " pieces>";
    }
}
