package rules.records;

import java.util.Objects;
import java.util.Optional;
import rules.constants.Color;

/**
 * One committed move, holding what undo needs to put the board back.
 *
 * @param from square the piece left
 * @param to square the piece landed on
 * @param movedPiece the piece as it was before the move, including its old {@code hasMoved}
 * @param capturedPiece the piece that stood on {@code to}, or {@code null}
 * @param promotion whether the moved pawn was replaced by a queen
 * @param previousTurn side to move before the move
 */
public record MoveRecord(
        Position from,
        Position to,
        Piece movedPiece,
        Piece capturedPiece,
        boolean promotion,
        Color previousTurn) {

    public MoveRecord {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(movedPiece, "movedPiece must not be null");
        Objects.requireNonNull(previousTurn, "previousTurn must not be null");
    }

    public Optional<Piece> captured() {
        return Optional.ofNullable(capturedPiece);
    }

    public boolean isCapture() {
        return capturedPiece != null;
    }
}
