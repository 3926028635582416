package rules.impl;

import static rules.constants.BoardConstants.BOARD_SIZE;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Scanner;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.contracts.Board;
import rules.contracts.ConsoleHandler;
import rules.contracts.ConsoleOptions;
import rules.contracts.PieceFactory;
import rules.records.Piece;
import rules.records.Position;

/**
 * Line-oriented front end. Squares are given as raw {@code x y} pairs (column, then row from
 * Black's side), the same coordinates the engine uses.
 *
 * <pre>
 *   click x y              select / move like a mouse click
 *   move x1 y1 x2 y2       play a move directly
 *   undo                   take back the last move
 *   moves x y              list legal destinations
 *   board                  draw the board
 *   new                    start a new game
 *   setup &lt;placement&gt; w|b  set up a position
 *   options                list options
 *   set &lt;name&gt; &lt;value&gt;     change an option
 *   perft &lt;depth&gt;          count move-tree leaves
 *   quit
 * </pre>
 */
public final class ConsoleHandlerImpl implements ConsoleHandler {

    private static final Logger log = LoggerFactory.getLogger(ConsoleHandlerImpl.class);

    private static final String WHITE_GLYPHS = "♖♘♗♕♔♙";
    private static final String BLACK_GLYPHS = "♜♞♝♛♚♟";

    /* ── collaborators ─────────────────────────────────────────── */
    private final PieceFactory factory;
    private final ConsoleOptions opts;
    private final InputStream in;
    private final PrintStream out;

    /* ── game state ────────────────────────────────────────────── */
    private final SelectionController selection;

    public ConsoleHandlerImpl(PieceFactory factory, ConsoleOptions opts, InputStream in, PrintStream out) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.opts = Objects.requireNonNull(opts, "options must not be null");
        this.in = Objects.requireNonNull(in, "input must not be null");
        this.out = Objects.requireNonNull(out, "output must not be null");
        this.selection = new SelectionController(factory.standardBoard());
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override
    public void runLoop() {
        drawBoard();
        try (Scanner scanner = new Scanner(in)) {
            while (scanner.hasNextLine()) {
                String line = scanner.nextLine().trim();
                if (!line.isEmpty() && handle(line)) break; // "quit" → exit
            }
        }
    }

    /** The board commands currently act on. */
    public Board board() {
        return selection.board();
    }

    /* ── router ───────────────────────────────────────────────── */
    boolean handle(String cmd) {
        log.debug("command: {}", cmd);
        String[] t = cmd.split("\\s+");
        try {
            return switch (t[0].toLowerCase()) {
                case "click"   -> { cmdClick(t);   yield false; }
                case "move"    -> { cmdMove(t);    yield false; }
                case "undo"    -> { cmdUndo();     yield false; }
                case "moves"   -> { cmdMoves(t);   yield false; }
                case "board"   -> { drawBoard();   yield false; }
                case "new"     -> { cmdNew();      yield false; }
                case "setup"   -> { cmdSetup(t);   yield false; }
                case "options" -> { opts.printOptions(out); yield false; }
                case "set"     -> { cmdSet(t);     yield false; }
                case "perft"   -> { cmdPerft(t);   yield false; }
                case "quit"    -> true;
                default        -> { out.println("error unknown command: " + t[0]); yield false; }
            };
        } catch (IllegalArgumentException e) {
            log.debug("Command failed: {}", cmd, e);
            out.println("error " + e.getMessage());
            return false;
        }
    }

    /* ── commands ──────────────────────────────────────────────── */
    private void cmdClick(String[] t) {
        MoveResult result = selection.click(square(t, 1));
        if (result.isCommitted()) {
            out.println("result " + result);
            afterMove();
            return;
        }
        out.println(selection.selected()
                .map(p -> "selected " + p)
                .orElse("no selection"));
        printStatus();
    }

    private void cmdMove(String[] t) {
        MoveResult result = board().movePiece(square(t, 1), square(t, 3));
        out.println("result " + result);
        if (result.isCommitted()) {
            selection.reset(board());
            afterMove();
        }
    }

    private void cmdUndo() {
        boolean undone = selection.undo();
        if (undone && opts.autoBoard()) {
            drawBoard();
        } else {
            printStatus();
        }
    }

    private void cmdMoves(String[] t) {
        Position from = square(t, 1);
        List<Position> moves = board().legalMoves(from);
        out.println("moves " + from + ":" + moves.stream()
                .map(p -> " " + p)
                .collect(Collectors.joining()));
    }

    private void cmdNew() {
        board().initialize();
        selection.reset(board());
        drawBoard();
    }

    private void cmdSetup(String[] t) {
        if (t.length < 3) throw new IllegalArgumentException("usage: setup <placement> w|b");
        Color toMove = switch (t[2]) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("Invalid side to move: " + t[2]);
        };
        selection.reset(factory.fromPlacement(t[1], toMove));
        drawBoard();
    }

    private void cmdSet(String[] t) {
        if (t.length < 3) throw new IllegalArgumentException("usage: set <name> <value>");
        if (!opts.setOption(t[1], t[2])) {
            out.println("error cannot set " + t[1] + " to " + t[2]);
        }
    }

    private void cmdPerft(String[] t) {
        if (t.length < 2) throw new IllegalArgumentException("usage: perft <depth>");
        int depth = Integer.parseInt(t[1]);
        if (depth < 0) throw new IllegalArgumentException("depth must not be negative");
        long t0 = System.nanoTime();
        long nodes = Perft.count(board(), depth);
        long ms = (System.nanoTime() - t0) / 1_000_000;
        out.printf("nodes %d time %d ms%n", nodes, ms);
    }

    private void afterMove() {
        if (opts.autoBoard()) {
            drawBoard();
        } else {
            printStatus();
        }
    }

    /* ── drawing ───────────────────────────────────────────────── */
    void drawBoard() {
        Board board = board();
        Optional<Position> picked = selection.selected();
        if (opts.coordinates()) {
            StringBuilder header = new StringBuilder("  ");
            for (int x = 0; x < BOARD_SIZE; ++x) header.append(' ').append(x).append(' ');
            out.println(header);
        }
        for (int y = 0; y < BOARD_SIZE; ++y) {
            StringBuilder row = new StringBuilder();
            if (opts.coordinates()) row.append(y).append(' ');
            for (int x = 0; x < BOARD_SIZE; ++x) {
                char c = glyph(board.occupant(x, y));
                boolean marked = picked.isPresent() && picked.get().equals(new Position(x, y));
                row.append(marked ? '[' : ' ').append(c).append(marked ? ']' : ' ');
            }
            out.println(row);
        }
        out.println("Turn: " + board.currentTurn().displayName());
        printStatus();
    }

    private void printStatus() {
        if (!selection.status().isEmpty()) out.println(selection.status());
    }

    private char glyph(Piece p) {
        if (p == null) return '.';
        if (!opts.unicodeGlyphs()) return p.letter();
        String set = p.color() == Color.WHITE ? WHITE_GLYPHS : BLACK_GLYPHS;
        return set.charAt(p.type().ordinal());
    }

    /* ── parsing ───────────────────────────────────────────────── */
    private static Position square(String[] t, int i) {
        if (t.length < i + 2) throw new IllegalArgumentException("expected x y after " + t[0]);
        return new Position(Integer.parseInt(t[i]), Integer.parseInt(t[i + 1]));
    }
}
