package tokenmerge;

import java.util.Objects;

/**
 * A vocabulary entry: piece text plus whether it may start a word.
 * <p>
 * The same text is a different entry depending on the flag, e.g. the initial
 * piece {@code "en"} and the continuation piece written {@code "##en"} in
 * WordPiece vocabularies.
 * </p>
 */
public final class Piece {
    private final String text;
    private final boolean initial;

    /**
     * Creates a piece.
     *
     * @param text    the piece text, without any continuation marker
     * @param initial {@code true} if the piece may start a word
     */
    public Piece(String text, boolean initial) {
        this.text = Objects.requireNonNull(text, "text");
        this.initial = initial;
    }

    /**
     * Creates a word-initial piece.
     *
     * @param text the piece text
     * @return the piece
     */
    public static Piece initial(String text) {
        return new Piece(text, true);
    }

    /**
     * Creates a continuation piece.
     *
     * @param text the piece text, without the {@code ##} marker
     * @return the piece
     */
    public static Piece continuation(String text) {
        return new Piece(text, false);
    }

    public String getText() {
        return text;
    }

    public boolean isInitial() {
        return initial;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Piece)) return false;
        Piece p = (Piece) o;
        return initial == p.initial && text.equals(p.text);
    }

    @Override
    public int hashCode() {
        return HashCombine.combine(HashCombine.combine(0, text), initial);
    }

    @Override
    public String toString() {
        return "(" + text + ", " + initial + ")";
    }
}
