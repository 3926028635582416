package rules.impl;

import java.util.Objects;
import java.util.Optional;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.contracts.Board;
import rules.records.Piece;
import rules.records.Position;

/**
 * Turns square clicks into move attempts the way a board UI does: the first click picks up one
 * of the mover's pieces, the second tries to play it. Keeps the status line shown under the
 * board.
 */
public final class SelectionController {

    private Board board;
    private Position selected; // null when nothing is picked up
    private String status = "";

    public SelectionController(Board board) {
        this.board = Objects.requireNonNull(board, "board must not be null");
    }

    /**
     * Handles a click on {@code square}.
     *
     * @return the result of the move attempt, {@link MoveResult#INVALID} if the click only changed
     *     the selection or was ignored
     */
    public MoveResult click(Position square) {
        Objects.requireNonNull(square, "square must not be null");
        if (board.isGameOver()) {
            status = gameOverText();
            return MoveResult.INVALID;
        }
        status = "";

        if (selected == null) {
            if (isOwnPiece(square)) selected = square;
            return MoveResult.INVALID;
        }

        MoveResult result = board.movePiece(selected, square);
        if (result.isCommitted()) {
            selected = null;
            status = switch (result) {
                case CHECK -> board.currentTurn().displayName() + " is in check!";
                case CHECKMATE, STALEMATE -> gameOverText();
                default -> "";
            };
            return result;
        }

        if (square.equals(selected)) {
            selected = null;
        } else if (isOwnPiece(square)) {
            selected = square;
        }
        return result;
    }

    /** Takes back the last move and drops the selection. */
    public boolean undo() {
        boolean undone = board.undoLastMove();
        if (undone) {
            selected = null;
            status = "Undo successful!";
        } else {
            status = "No moves to undo!";
        }
        return undone;
    }

    /** Points the controller at another board, e.g. after a new game or setup. */
    public void reset(Board board) {
        this.board = Objects.requireNonNull(board, "board must not be null");
        selected = null;
        status = board.isGameOver() ? gameOverText() : "";
    }

    public Optional<Position> selected() {
        return Optional.ofNullable(selected);
    }

    public String status() {
        return status;
    }

    public Board board() {
        return board;
    }

    private boolean isOwnPiece(Position square) {
        Optional<Piece> p = board.pieceAt(square);
        return p.isPresent() && p.get().color() == board.currentTurn();
    }

    private String gameOverText() {
        Optional<Color> winner = board.winner();
        return winner.map(c -> "Checkmate! " + c.displayName() + " wins!")
                .orElse("Stalemate! Game ended in a draw.");
    }
}
