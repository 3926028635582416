package rules.impl;

import java.util.List;
import rules.contracts.Board;
import rules.records.Piece;
import rules.records.Position;

/**
 * Counts leaf nodes of the legal move tree by playing every move through
 * {@link Board#movePiece} and taking it back with {@link Board#undoLastMove}. Doubles as an
 * end-to-end check of legality filtering and of undo.
 */
public final class Perft {

    private Perft() {}

    public static long count(Board board, int depth) {
        if (depth == 0) return 1;

        long nodes = 0;
        List<Piece> movers = board.pieces();
        for (Piece p : movers) {
            if (p.color() != board.currentTurn()) continue;
            Position from = p.position();
            for (Position to : board.legalMoves(from)) {
                if (!board.movePiece(from, to).isCommitted()) {
                    throw new IllegalStateException("Legal move " + from + " -> " + to + " was rejected");
                }
                nodes += count(board, depth - 1);
                board.undoLastMove();
            }
        }
        return nodes;
    }
}
