package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.*;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.contracts.Board;
import rules.contracts.MoveGenerator;
import rules.contracts.PieceFactory;
import rules.records.Piece;
import rules.records.Position;

/**
 * Seeded random games. At every ply <em>every</em> pseudo-legal move of the side to move is tried
 * and taken back, which checks three things at once:
 *
 * <ol>
 *   <li>a committed move never leaves the mover's king in check, and a rejected one changes
 *       nothing;
 *   <li>the turn flips after a committed move and only then;
 *   <li>undo restores pieces, flags, turn and game state exactly.
 * </ol>
 */
class BoardPropertiesTest {

    private static final MoveGenerator GEN = new MoveGeneratorImpl();
    private static final PieceFactory FACTORY = new PieceFactoryImpl(GEN);
    private static final Random RNG = new Random(0xDEADBEEF);

    private static final int GAMES = 12;
    private static final int MAX_PLIES = 80;

    private record Snapshot(List<Piece> pieces, Color turn, boolean over, Optional<Color> winner, int plies) {}

    private static Snapshot snapshot(Board b) {
        return new Snapshot(b.pieces(), b.currentTurn(), b.isGameOver(), b.winner(), b.history().size());
    }

    private record Candidate(Position from, Position to) {}

    @Test
    void randomGamesKeepEveryInvariant() {
        int committedTotal = 0;
        for (int g = 0; g < GAMES; ++g) {
            Board board = FACTORY.standardBoard();
            for (int ply = 0; ply < MAX_PLIES && !board.isGameOver(); ++ply) {
                List<Candidate> legal = tryEveryMove(board);
                assertEquals(!legal.isEmpty(), board.hasLegalMoves(board.currentTurn()),
                        "hasLegalMoves disagrees with movePiece");
                if (legal.isEmpty()) break;

                Candidate pick = legal.get(RNG.nextInt(legal.size()));
                assertTrue(board.movePiece(pick.from(), pick.to()).isCommitted());
                committedTotal++;
            }
            assertOneKingEach(board);
        }
        assertTrue(committedTotal > GAMES, "random walks did not get going");
    }

    /** Plays and takes back every candidate; returns those that were committed. */
    private static List<Candidate> tryEveryMove(Board board) {
        Color mover = board.currentTurn();
        List<Candidate> committed = new ArrayList<>();
        for (Piece p : board.pieces()) {
            if (p.color() != mover) continue;
            for (Position to : GEN.validMoves(board, p)) {
                Snapshot before = snapshot(board);
                MoveResult r = board.movePiece(p.position(), to);

                if (!r.isCommitted()) {
                    assertEquals(before, snapshot(board), "rejected move changed the board");
                    assertFalse(board.legalMoves(p.position()).contains(to));
                    continue;
                }

                assertFalse(board.isInCheck(mover), "committed move left own king in check: " + p + " -> " + to);
                assertEquals(mover.opposite(), board.currentTurn(), "turn must flip");
                assertEquals(r.endsGame(), board.isGameOver());
                assertEquals(r == MoveResult.CHECK || r == MoveResult.CHECKMATE, board.isInCheck(mover.opposite()));
                if (r == MoveResult.CHECKMATE) assertEquals(Optional.of(mover), board.winner());
                if (r == MoveResult.STALEMATE) assertTrue(board.winner().isEmpty());

                assertTrue(board.undoLastMove());
                assertEquals(before, snapshot(board), "undo is not an exact inverse");
                committed.add(new Candidate(p.position(), to));
            }
        }
        return committed;
    }

    private static void assertOneKingEach(Board board) {
        for (Color c : Color.values()) {
            long kings = board.pieces().stream()
                    .filter(p -> p.type() == Piece.Type.KING && p.color() == c)
                    .count();
            assertEquals(1, kings, c + " kings");
        }
    }
}
