package rules.records;

import static rules.constants.BoardConstants.promotionRow;

import java.util.Objects;
import rules.constants.Color;

/**
 * Immutable chess piece: kind, colour, the square it stands on and whether it has moved.
 *
 * <p>Moving a piece yields a new value, so the board slot that holds it is its only owner and
 * an old value doubles as the snapshot needed to undo the move.
 */
public record Piece(Type type, Color color, Position position, boolean hasMoved) {

    /** The six piece kinds. The set is closed; move generation switches over it exhaustively. */
    public enum Type {
        ROOK('r'),
        KNIGHT('n'),
        BISHOP('b'),
        QUEEN('q'),
        KING('k'),
        PAWN('p');

        private final char letter;

        Type(char letter) {
            this.letter = letter;
        }

        /** Lower-case placement letter. */
        public char letter() {
            return letter;
        }

        public static Type ofLetter(char c) {
            char lower = Character.toLowerCase(c);
            for (Type t : values()) {
                if (t.letter == lower) return t;
            }
            throw new IllegalArgumentException("Unknown piece letter: " + c);
        }
    }

    public Piece {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(color, "color must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    /** The piece after a real move to {@code to}: new square, {@code hasMoved} set. */
    public Piece movedTo(Position to) {
        return new Piece(type, color, to, true);
    }

    /** The piece relocated to {@code to} with its flags untouched, for simulations. */
    public Piece at(Position to) {
        return new Piece(type, color, to, hasMoved);
    }

    /** {@code true} iff this is a pawn standing on its promotion row. */
    public boolean isPromotion() {
        return type == Type.PAWN && position.y() == promotionRow(color);
    }

    /** Placement letter, upper case for White. */
    public char letter() {
        return color == Color.WHITE ? Character.toUpperCase(type.letter()) : type.letter();
    }
}
