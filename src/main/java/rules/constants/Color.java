package rules.constants;

/** The two sides. */
public enum Color {
    WHITE,
    BLACK;

    public Color opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    /** "White" / "Black", as shown to players. */
    public String displayName() {
        return this == WHITE ? "White" : "Black";
    }
}
