package bench;

import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import rules.constants.Color;
import rules.contracts.Board;
import rules.contracts.PieceFactory;
import rules.impl.MoveGeneratorImpl;
import rules.impl.Perft;
import rules.impl.PieceFactoryImpl;
import rules.records.Position;

/**
 * Cost of the from-scratch check scan, the simulate/restore legality test and a full
 * move/undo perft, on a quiet middlegame position.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class LegalityBench {

    /* ── engine wiring ─────────────────────────────────────────── */
    private static final PieceFactory FACT = new PieceFactoryImpl(new MoveGeneratorImpl());

    private static final String MIDDLEGAME = "r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R";

    private Board board;

    @Setup(Level.Trial)
    public void init() {
        board = FACT.fromPlacement(MIDDLEGAME, Color.WHITE);
    }

    @Benchmark
    public boolean isInCheck() {
        return board.isInCheck(Color.WHITE);
    }

    @Benchmark
    public boolean hasLegalMoves() {
        return board.hasLegalMoves(Color.BLACK);
    }

    @Benchmark
    public void moveAndUndo(Blackhole bh) {
        bh.consume(board.movePiece(new Position(5, 5), new Position(4, 3)));
        bh.consume(board.undoLastMove());
    }

    @Benchmark
    public long perft2() {
        return Perft.count(board, 2);
    }
}
