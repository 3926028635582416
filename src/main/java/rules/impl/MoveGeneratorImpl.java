package rules.impl;

import static rules.constants.BoardConstants.*;

import java.util.ArrayList;
import java.util.List;
import rules.contracts.Board;
import rules.contracts.MoveGenerator;
import rules.records.Piece;
import rules.records.Position;

/** Square-by-square move generation, one branch per piece kind. */
public final class MoveGeneratorImpl implements MoveGenerator {

    @Override
    public List<Position> validMoves(Board board, Piece piece) {
        List<Position> moves = new ArrayList<>(28);
        switch (piece.type()) {
            case ROOK -> addRays(board, piece, ORTHOGONAL, moves);
            case BISHOP -> addRays(board, piece, DIAGONAL, moves);
            case QUEEN -> addRays(board, piece, ALL_DIRECTIONS, moves);
            case KNIGHT -> addSteps(board, piece, KNIGHT_JUMPS, moves);
            case KING -> addSteps(board, piece, ALL_DIRECTIONS, moves);
            case PAWN -> addPawnMoves(board, piece, moves);
        }
        return moves;
    }

    @Override
    public boolean attacks(Board board, Piece piece, Position target) {
        if (!target.inBounds() || target.equals(piece.position())) return false;
        return validMoves(board, piece).contains(target);
    }

    /* ── sliders ─────────────────────────────────────────────── */
    private static void addRays(Board board, Piece piece, int[][] dirs, List<Position> out) {
        int x0 = piece.position().x(), y0 = piece.position().y();
        for (int[] d : dirs) {
            for (int step = 1; step < BOARD_SIZE; ++step) {
                int nx = x0 + d[0] * step;
                int ny = y0 + d[1] * step;
                if (!Position.inBounds(nx, ny)) break;
                Piece other = board.occupant(nx, ny);
                if (other == null) {
                    out.add(new Position(nx, ny));
                    continue;
                }
                if (other.color() != piece.color()) out.add(new Position(nx, ny));
                break;
            }
        }
    }

    /* ── knight & king ───────────────────────────────────────── */
    private static void addSteps(Board board, Piece piece, int[][] offsets, List<Position> out) {
        int x0 = piece.position().x(), y0 = piece.position().y();
        for (int[] d : offsets) {
            int nx = x0 + d[0];
            int ny = y0 + d[1];
            if (canMoveTo(board, nx, ny, piece)) out.add(new Position(nx, ny));
        }
    }

    /* ── pawns: pushes onto empty squares, diagonal captures only ── */
    private static void addPawnMoves(Board board, Piece pawn, List<Position> out) {
        int dir = pawnDirection(pawn.color());
        int x = pawn.position().x();
        int y = pawn.position().y();

        if (Position.inBounds(x, y + dir) && board.occupant(x, y + dir) == null) {
            out.add(new Position(x, y + dir));
            if (y == pawnRow(pawn.color())
                    && Position.inBounds(x, y + 2 * dir)
                    && board.occupant(x, y + 2 * dir) == null) {
                out.add(new Position(x, y + 2 * dir));
            }
        }

        for (int dx : new int[] {-1, 1}) {
            int nx = x + dx;
            int ny = y + dir;
            if (!Position.inBounds(nx, ny)) continue;
            Piece target = board.occupant(nx, ny);
            if (target != null && target.color() != pawn.color()) out.add(new Position(nx, ny));
        }
    }

    private static boolean canMoveTo(Board board, int x, int y, Piece mover) {
        if (!Position.inBounds(x, y)) return false;
        Piece other = board.occupant(x, y);
        return other == null || other.color() != mover.color();
    }
}
