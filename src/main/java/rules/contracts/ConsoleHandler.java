package rules.contracts;

/**
 * Text front end over a {@link Board}: reads commands line by line, plays them against the
 * engine and prints results and the board.
 */
public interface ConsoleHandler {

    /** Processes commands until {@code quit} or the end of input. */
    void runLoop();
}
