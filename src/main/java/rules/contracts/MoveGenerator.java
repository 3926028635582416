package rules.contracts;

import java.util.List;
import rules.records.Piece;
import rules.records.Position;

/**
 * Pseudo-legal move generation: where a piece could go by its movement pattern and the
 * occupancy of the board, without asking whether its own king is left in check and without
 * looking at whose turn it is. Never mutates the board.
 */
public interface MoveGenerator {

    /**
     * @return every on-board square {@code piece} could move to that is empty or holds an
     *     opposing piece
     */
    List<Position> validMoves(Board board, Piece piece);

    /** @return {@code true} if {@code target} is among {@code piece}'s pseudo-legal moves. */
    boolean attacks(Board board, Piece piece, Position target);
}
