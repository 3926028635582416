package rules.contracts;

import rules.constants.Color;
import rules.records.Piece;
import rules.records.Position;

/** Builds pieces and boards. */
public interface PieceFactory {

    /** A fresh, unmoved piece. */
    Piece create(Piece.Type type, Color color, Position position);

    /** A board holding the standard starting position, White to move. */
    Board standardBoard();

    /**
     * A board set up from the piece-placement field of a FEN record ({@code /}-separated rows
     * starting at row 0, digits for empty runs, upper case for White).
     *
     * @throws IllegalArgumentException if the diagram is malformed, does not hold exactly one king
     *     per colour, or has the side not to move in check
     */
    Board fromPlacement(String placement, Color toMove);

    /** Inverse of {@link #fromPlacement}: the placement field describing {@code board}. */
    String toPlacement(Board board);
}
