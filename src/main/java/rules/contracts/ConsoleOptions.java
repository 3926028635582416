package rules.contracts;

import java.io.PrintStream;

/**
 * Named settings of the console front end, changed at runtime with {@code set <name> <value>}.
 */
public interface ConsoleOptions {

    /**
     * Applies {@code value} to the option called {@code name}.
     *
     * @return {@code false} if the option is unknown or the value is not allowed; the option keeps
     *     its previous value
     */
    boolean setOption(String name, String value);

    /** Writes one {@code option name ... type ... value ...} line per option. */
    void printOptions(PrintStream out);

    /** @return the current value or {@code null} for an unknown option. */
    String getOptionValue(String name);

    /* — typed views — */

    /** Draw pieces with Unicode chess symbols instead of letters. */
    boolean unicodeGlyphs();

    /** Print row and column numbers around the board. */
    boolean coordinates();

    /** Redraw the board after every committed move. */
    boolean autoBoard();
}
