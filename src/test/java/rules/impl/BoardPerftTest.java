package rules.impl;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.*;
import java.util.stream.Stream;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import rules.constants.Color;
import rules.contracts.Board;
import rules.contracts.PieceFactory;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class BoardPerftTest {

    /* ── wiring ───────────────────────────────────────────────────── */
    private static final PieceFactory FACTORY = new PieceFactoryImpl(new MoveGeneratorImpl());

    /* ── per-test-case record ─────────────────────────────────────── */
    private record TestCase(String placement, Color toMove, int depth, long expected) {}

    private List<TestCase> cases;
    private long nodes = 0, timeNs = 0;

    /* ── load the perft vectors once (from /perft/rules.txt) ──────── */
    @BeforeAll
    void loadVectors() throws Exception {
        cases = new ArrayList<>();
        try (InputStream is = getClass().getResourceAsStream("/perft/rules.txt");
             BufferedReader br = new BufferedReader(new InputStreamReader(Objects.requireNonNull(is)))) {

            br.lines()
                    .map(String::trim)
                    .filter(l -> !(l.isEmpty() || l.startsWith("#")))
                    .forEach(l -> {
                        String[] p = l.split(";");
                        if (p.length < 4) return;
                        cases.add(new TestCase(
                                p[0].trim(),
                                p[1].trim().equals("w") ? Color.WHITE : Color.BLACK,
                                Integer.parseInt(p[2].replaceAll("[^0-9]", "")),
                                Long.parseLong(p[3].replaceAll("[^0-9]", ""))));
                    });
        }
        Assertions.assertFalse(cases.isEmpty(), "no perft vectors found");
    }

    Stream<TestCase> caseStream() {
        return cases.stream();
    }

    @ParameterizedTest(name = "perft {index}")
    @MethodSource("caseStream")
    void perft(TestCase tc) {
        Board board = FACTORY.fromPlacement(tc.placement, tc.toMove);
        String before = FACTORY.toPlacement(board);

        long t0 = System.nanoTime();
        long got = Perft.count(board, tc.depth);
        timeNs += System.nanoTime() - t0;
        nodes += got;

        Assertions.assertEquals(tc.expected, got,
                () -> "mismatch depth=" + tc.depth + " placement=" + tc.placement);
        Assertions.assertEquals(before, FACTORY.toPlacement(board), "perft must leave the board as it found it");
        Assertions.assertTrue(board.history().isEmpty());
        Assertions.assertEquals(tc.toMove, board.currentTurn());
    }

    /* ── aggregate speed report ───────────────────────────────────── */
    @AfterAll
    void report() {
        double s = timeNs / 1_000_000_000.0;
        System.out.printf("PERFT : %,d nodes  %.3f s  %,d NPS%n", nodes, s, (long) (nodes / Math.max(1e-9, s)));
    }
}
