// File: Main.java
package main;

import java.util.List;
import rules.constants.Color;
import rules.contracts.Board;
import rules.contracts.ConsoleHandler;
import rules.contracts.ConsoleOptions;
import rules.contracts.PieceFactory;
import rules.impl.*;

/**
 * Wire the engine together and run the console loop, or {@code bench [depth]} to time perft
 * over a few fixed positions.
 */
public final class Main {

    /** Castling- and en-passant-free positions, White to move. */
    static final List<String> BENCH_PLACEMENTS = List.of(
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8",
            "r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R",
            "4k3/8/8/8/8/8/4P3/4K3"
    );

    private Main() {}

    public static void main(String[] args) {
        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? Integer.parseInt(args[1]) : 3;
            runPerftBench(depth);
            return;
        }

        System.out.println("chess-rules console – type 'quit' to exit");

        PieceFactory factory = new PieceFactoryImpl(new MoveGeneratorImpl());
        ConsoleOptions opts = ConsoleOptionsImpl.load();
        ConsoleHandler console = new ConsoleHandlerImpl(factory, opts, System.in, System.out);
        console.runLoop();
    }

    private static void runPerftBench(int depth) {
        PieceFactory factory = new PieceFactoryImpl();

        long totalNodes = 0, totalTimeMs = 0;
        for (String placement : BENCH_PLACEMENTS) {
            Board board = factory.fromPlacement(placement, Color.WHITE);
            long t0 = System.nanoTime();
            long nodes = Perft.count(board, depth);
            long ms = (System.nanoTime() - t0) / 1_000_000;

            totalNodes += nodes;
            totalTimeMs += ms;
        }

        long totalNps = totalTimeMs > 0 ? (1000L * totalNodes) / totalTimeMs : 0;
        System.out.printf("Nodes searched: %d%n", totalNodes);
        System.out.printf("nps: %d%n", totalNps);
        System.out.println("benchok");
    }
}
