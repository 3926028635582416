package rules.impl;

import static rules.constants.BoardConstants.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import rules.constants.Color;
import rules.contracts.Board;
import rules.contracts.MoveGenerator;
import rules.contracts.PieceFactory;
import rules.records.Piece;
import rules.records.Position;

/**
 * Default {@link PieceFactory}. Boards it builds share its {@link MoveGenerator} and use the
 * factory itself for promotions.
 */
public final class PieceFactoryImpl implements PieceFactory {

    private final MoveGenerator gen;

    public PieceFactoryImpl() {
        this(new MoveGeneratorImpl());
    }

    public PieceFactoryImpl(MoveGenerator gen) {
        this.gen = Objects.requireNonNull(gen, "move generator must not be null");
    }

    @Override
    public Piece create(Piece.Type type, Color color, Position position) {
        return new Piece(type, color, position, false);
    }

    @Override
    public Board standardBoard() {
        BoardImpl board = new BoardImpl(gen, this);
        board.initialize();
        return board;
    }

    /* ────── placement diagrams ────── */

    @Override
    public Board fromPlacement(String placement, Color toMove) {
        Objects.requireNonNull(placement, "placement must not be null");
        Objects.requireNonNull(toMove, "side to move must not be null");

        List<Piece> pieces = parsePlacement(placement.trim());
        checkKings(pieces);

        BoardImpl board = new BoardImpl(gen, this);
        board.reset(pieces, toMove);
        if (board.isInCheck(toMove.opposite())) {
            throw new IllegalArgumentException(
                    toMove.opposite().displayName() + " is in check but it is " + toMove.displayName() + "'s move");
        }
        board.classifyPosition();
        return board;
    }

    @Override
    public String toPlacement(Board board) {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < BOARD_SIZE; ++y) {
            if (y > 0) sb.append('/');
            int empty = 0;
            for (int x = 0; x < BOARD_SIZE; ++x) {
                Piece p = board.occupant(x, y);
                if (p == null) {
                    ++empty;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(p.letter());
            }
            if (empty > 0) sb.append(empty);
        }
        return sb.toString();
    }

    private List<Piece> parsePlacement(String placement) {
        String[] rows = placement.split("/");
        if (rows.length != BOARD_SIZE) {
            throw new IllegalArgumentException("Placement must have 8 rows – got " + rows.length);
        }
        List<Piece> pieces = new ArrayList<>(32);
        for (int y = 0; y < BOARD_SIZE; ++y) {
            int x = 0;
            for (char c : rows[y].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    x += c - '0';
                } else if (x < BOARD_SIZE) {
                    Piece.Type type = Piece.Type.ofLetter(c);
                    Color color = Character.isUpperCase(c) ? Color.WHITE : Color.BLACK;
                    pieces.add(new Piece(type, color, new Position(x, y), !onHomeSquare(type, color, y)));
                    ++x;
                } else {
                    x = BOARD_SIZE + 1;
                }
            }
            if (x != BOARD_SIZE) {
                throw new IllegalArgumentException("Row " + y + " does not cover 8 squares: " + rows[y]);
            }
        }
        return pieces;
    }

    /** Pawns on their start row and other pieces on their back row count as unmoved. */
    private static boolean onHomeSquare(Piece.Type type, Color color, int y) {
        return type == Piece.Type.PAWN ? y == pawnRow(color) : y == backRow(color);
    }

    private static void checkKings(List<Piece> pieces) {
        for (Color color : Color.values()) {
            long kings = pieces.stream()
                    .filter(p -> p.type() == Piece.Type.KING && p.color() == color)
                    .count();
            if (kings != 1) {
                throw new IllegalArgumentException(
                        "Expected one " + color.displayName() + " king – got " + kings);
            }
        }
    }
}
