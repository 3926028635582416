package rules.constants;

/**
 * Board geometry shared by move generation, setup and the console.
 *
 * <p>Row 0 is Black's back rank and row 7 White's, so White pawns move towards row 0.
 */
public final class BoardConstants {

    private BoardConstants() {}

    /* ────────────── Geometry ────────────── */
    public static final int BOARD_SIZE = 8;
    public static final int SQUARES = BOARD_SIZE * BOARD_SIZE;

    /* ────────────── Home rows ────────────── */
    public static final int WHITE_BACK_ROW = 7;
    public static final int WHITE_PAWN_ROW = 6;
    public static final int BLACK_PAWN_ROW = 1;
    public static final int BLACK_BACK_ROW = 0;

    /* ────────────── Direction tables {dx, dy} ────────────── */
    public static final int[][] ORTHOGONAL = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    public static final int[][] DIAGONAL = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    public static final int[][] ALL_DIRECTIONS = {
        {1, 0}, {-1, 0}, {0, 1}, {0, -1},
        {1, 1}, {1, -1}, {-1, 1}, {-1, -1}
    };
    public static final int[][] KNIGHT_JUMPS = {
        {1, 2}, {2, 1}, {-1, 2}, {-2, 1},
        {1, -2}, {2, -1}, {-1, -2}, {-2, -1}
    };

    /* ────────────── Setup ────────────── */
    /** Piece-placement field of the standard starting position. */
    public static final String START_PLACEMENT = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR";

    /** Row a pawn of {@code color} starts on. */
    public static int pawnRow(Color color) {
        return color == Color.WHITE ? WHITE_PAWN_ROW : BLACK_PAWN_ROW;
    }

    /** Row the pieces of {@code color} start on. */
    public static int backRow(Color color) {
        return color == Color.WHITE ? WHITE_BACK_ROW : BLACK_BACK_ROW;
    }

    /** Row a pawn of {@code color} promotes on. */
    public static int promotionRow(Color color) {
        return color == Color.WHITE ? BLACK_BACK_ROW : WHITE_BACK_ROW;
    }

    /** Row delta of a single pawn step. */
    public static int pawnDirection(Color color) {
        return color == Color.WHITE ? -1 : 1;
    }
}
