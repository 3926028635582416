package rules.records;

import static rules.constants.BoardConstants.BOARD_SIZE;

/**
 * A square as a column/row pair. {@code x} is the file (0 = a-file) and {@code y} the row counted
 * from Black's back rank, the same layout a screen draws.
 *
 * <p>Any pair can be constructed because input translation may produce off-board values; the
 * engine answers those with "no piece" or an invalid move instead of failing.
 */
public record Position(int x, int y) {

    /** Sentinel returned when a king cannot be found. */
    public static final Position NONE = new Position(-1, -1);

    public static boolean inBounds(int x, int y) {
        return x >= 0 && x < BOARD_SIZE && y >= 0 && y < BOARD_SIZE;
    }

    public boolean inBounds() {
        return inBounds(x, y);
    }

    /** Index into a 64-slot board, {@code y * 8 + x}. Only meaningful when {@link #inBounds()}. */
    public int index() {
        return y * BOARD_SIZE + x;
    }

    public static Position ofIndex(int index) {
        return new Position(index % BOARD_SIZE, index / BOARD_SIZE);
    }

    /** The square {@code dx, dy} away; may be off the board. */
    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
