package rules.contracts;

import java.util.List;
import java.util.Optional;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.records.MoveRecord;
import rules.records.Piece;
import rules.records.Position;

/**
 * Mutable game state: 64 squares of optional pieces, side to move, game-over flag and the
 * undo stack.
 *
 * <p>All rule checking lives behind {@link #movePiece}; callers read back the result and the
 * accessors below and never re-derive game state themselves. Implementations are
 * single-threaded.
 */
public interface Board {

    /** Clears pieces, history and game state, then lays out the standard starting position. */
    void initialize();

    /**
     * Tries to move the piece on {@code from} to {@code to}.
     *
     * <p>Every rejected attempt (game over, off-board squares, empty source, wrong side, illegal
     * destination, own king left in check) returns {@link MoveResult#INVALID} and leaves the
     * board exactly as it was.
     */
    MoveResult movePiece(Position from, Position to);

    /**
     * Takes back the most recent committed move.
     *
     * @return {@code false} if there is nothing to undo
     */
    boolean undoLastMove();

    /** @return the piece on {@code pos}, empty for an empty or off-board square. */
    Optional<Piece> pieceAt(Position pos);

    /**
     * Allocation-free variant of {@link #pieceAt} used by move generation.
     *
     * @return the piece on {@code (x, y)} or {@code null} if empty or off the board
     */
    Piece occupant(int x, int y);

    /** All pieces, ordered by square index. */
    List<Piece> pieces();

    Color currentTurn();

    boolean isGameOver();

    /** Winner of a finished game; empty while running and after stalemate. */
    Optional<Color> winner();

    /* ────── Check engine ────── */

    /** @return the king's square or {@link Position#NONE}. */
    Position findKing(Color color);

    /** @return {@code true} if any piece of the other colour could move onto {@code color}'s king. */
    boolean isInCheck(Color color);

    /** @return {@code true} if {@code color} has at least one move that keeps its king safe. */
    boolean hasLegalMoves(Color color);

    /** Legal destinations of the piece on {@code from}; empty for an empty or off-board square. */
    List<Position> legalMoves(Position from);

    /* ────── History ────── */

    /** Committed moves, oldest first. Read-only. */
    List<MoveRecord> history();

    Optional<MoveRecord> lastMove();
}
