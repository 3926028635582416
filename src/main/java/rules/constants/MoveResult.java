package rules.constants;

/**
 * Outcome of {@link rules.contracts.Board#movePiece}. This is the only signal a caller gets
 * about what a move did; every rejection, whatever the reason, is {@link #INVALID}.
 */
public enum MoveResult {
    /** Nothing happened: the board, turn and history are untouched. */
    INVALID,
    /** The move was played; the side to move is not in check. */
    SUCCESS,
    /** The move was played and gives check. */
    CHECK,
    /** The move was played and mates; the mover is the winner. */
    CHECKMATE,
    /** The move was played and leaves the opponent without a legal move while not in check. */
    STALEMATE;

    /** @return {@code true} for every result that changed the board. */
    public boolean isCommitted() {
        return this != INVALID;
    }

    /** @return {@code true} if this result ends the game. */
    public boolean endsGame() {
        return this == CHECKMATE || this == STALEMATE;
    }
}
