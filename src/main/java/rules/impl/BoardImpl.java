package rules.impl;

import static rules.constants.BoardConstants.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.contracts.Board;
import rules.contracts.MoveGenerator;
import rules.contracts.PieceFactory;
import rules.records.MoveRecord;
import rules.records.Piece;
import rules.records.Position;

/**
 * Array-backed {@link Board}. Squares are a flat {@code Piece[64]} indexed {@code y * 8 + x};
 * moving a piece is a set/clear pair on two slots.
 *
 * <p>Check detection is recomputed from scratch on every call: a square is attacked iff an
 * opposing piece's pseudo-legal moves include it. Legality of a candidate move is tested by
 * playing it on the array, asking {@link #isInCheck}, and putting the two slots back in a
 * {@code finally} block, so no path leaves a simulated move behind.
 *
 * <p>Not thread-safe.
 */
public final class BoardImpl implements Board {

    private static final Logger log = LoggerFactory.getLogger(BoardImpl.class);

    private static final Piece.Type[] BACK_ROW = {
        Piece.Type.ROOK, Piece.Type.KNIGHT, Piece.Type.BISHOP, Piece.Type.QUEEN,
        Piece.Type.KING, Piece.Type.BISHOP, Piece.Type.KNIGHT, Piece.Type.ROOK
    };

    /* ────── collaborators ────── */
    private final MoveGenerator gen;
    private final PieceFactory factory;

    /* ────── mutable state ────── */
    private final Piece[] squares = new Piece[SQUARES];
    private final Deque<MoveRecord> history = new ArrayDeque<>();
    private Color currentTurn = Color.WHITE;
    private boolean gameOver;
    private Color winner; // null while running or after stalemate

    public BoardImpl(MoveGenerator gen, PieceFactory factory) {
        this.gen = Objects.requireNonNull(gen, "move generator must not be null");
        this.factory = Objects.requireNonNull(factory, "piece factory must not be null");
    }

    /* ────── setup ────── */

    @Override
    public void initialize() {
        clear();
        for (Color color : Color.values()) {
            int back = backRow(color);
            int pawns = pawnRow(color);
            for (int x = 0; x < BOARD_SIZE; ++x) {
                place(factory.create(BACK_ROW[x], color, new Position(x, back)));
                place(factory.create(Piece.Type.PAWN, color, new Position(x, pawns)));
            }
        }
        log.debug("Board initialised to the starting position");
    }

    /** Replaces the whole position. Used by {@link PieceFactoryImpl#fromPlacement}. */
    void reset(Collection<Piece> pieces, Color toMove) {
        clear();
        for (Piece p : pieces) {
            if (!p.position().inBounds()) {
                throw new IllegalArgumentException("Piece off the board: " + p);
            }
            if (squares[p.position().index()] != null) {
                throw new IllegalArgumentException("Two pieces on " + p.position());
            }
            place(p);
        }
        currentTurn = Objects.requireNonNull(toMove, "side to move must not be null");
    }

    /** Marks the game as over if the side to move already has no legal move. */
    void classifyPosition() {
        if (hasLegalMoves(currentTurn)) return;
        gameOver = true;
        winner = isInCheck(currentTurn) ? currentTurn.opposite() : null;
    }

    private void clear() {
        Arrays.fill(squares, null);
        history.clear();
        currentTurn = Color.WHITE;
        gameOver = false;
        winner = null;
    }

    private void place(Piece p) {
        squares[p.position().index()] = p;
    }

    /* ────── the state transition ────── */

    @Override
    public MoveResult movePiece(Position from, Position to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");

        if (gameOver) return reject(from, to, "game is over");
        if (!from.inBounds() || !to.inBounds()) return reject(from, to, "off the board");

        Piece piece = squares[from.index()];
        if (piece == null) return reject(from, to, "no piece on source");
        if (piece.color() != currentTurn) return reject(from, to, "not the side to move");
        if (!gen.validMoves(this, piece).contains(to)) return reject(from, to, "not a valid destination");

        Piece captured = squares[to.index()];
        Color mover = currentTurn;

        Piece landed = piece.movedTo(to);
        boolean promotion = landed.isPromotion();
        if (promotion) landed = factory.create(Piece.Type.QUEEN, mover, to);

        squares[to.index()] = landed;
        squares[from.index()] = null;

        boolean kept = false;
        try {
            if (isInCheck(mover)) return reject(from, to, "own king left in check");
            kept = true;
        } finally {
            if (!kept) {
                squares[from.index()] = piece;
                squares[to.index()] = captured;
            }
        }

        currentTurn = mover.opposite();
        history.addLast(new MoveRecord(from, to, piece, captured, promotion, mover));
        log.debug("{} {} {} -> {}{}{}", mover.displayName(), piece.type(), from, to,
                captured != null ? " captures " + captured.type() : "",
                promotion ? " and promotes" : "");

        return classify(mover);
    }

    private MoveResult classify(Color mover) {
        Color side = currentTurn;
        boolean inCheck = isInCheck(side);
        if (!hasLegalMoves(side)) {
            gameOver = true;
            if (inCheck) {
                winner = mover;
                log.info("Checkmate, {} wins", mover.displayName());
                return MoveResult.CHECKMATE;
            }
            winner = null;
            log.info("Stalemate, {} has no legal move", side.displayName());
            return MoveResult.STALEMATE;
        }
        return inCheck ? MoveResult.CHECK : MoveResult.SUCCESS;
    }

    private static MoveResult reject(Position from, Position to, String reason) {
        log.debug("Rejected {} -> {}: {}", from, to, reason);
        return MoveResult.INVALID;
    }

    /* ────── undo ────── */

    @Override
    public boolean undoLastMove() {
        MoveRecord last = history.pollLast();
        if (last == null) return false;

        squares[last.from().index()] = last.movedPiece();
        squares[last.to().index()] = last.capturedPiece();
        currentTurn = last.previousTurn();
        gameOver = false;
        winner = null;
        log.debug("Undid {} -> {}", last.from(), last.to());
        return true;
    }

    /* ────── check engine ────── */

    @Override
    public Position findKing(Color color) {
        for (Piece p : squares) {
            if (p != null && p.type() == Piece.Type.KING && p.color() == color) return p.position();
        }
        return Position.NONE;
    }

    @Override
    public boolean isInCheck(Color color) {
        Position king = findKing(color);
        if (king.equals(Position.NONE)) {
            log.warn("No {} king on the board", color.displayName());
            return false;
        }
        for (Piece p : squares) {
            if (p != null && p.color() != color && gen.validMoves(this, p).contains(king)) return true;
        }
        return false;
    }

    @Override
    public boolean hasLegalMoves(Color color) {
        for (int i = 0; i < SQUARES; ++i) {
            Piece p = squares[i];
            if (p == null || p.color() != color) continue;
            for (Position to : gen.validMoves(this, p)) {
                if (leavesKingSafe(p, to)) return true;
            }
        }
        return false;
    }

    @Override
    public List<Position> legalMoves(Position from) {
        Piece p = occupant(from.x(), from.y());
        if (p == null) return List.of();
        List<Position> legal = new ArrayList<>();
        for (Position to : gen.validMoves(this, p)) {
            if (leavesKingSafe(p, to)) legal.add(to);
        }
        return legal;
    }

    /** Plays {@code piece} to {@code to}, tests its king, and always restores both squares. */
    private boolean leavesKingSafe(Piece piece, Position to) {
        int fromIdx = piece.position().index();
        int toIdx = to.index();
        Piece captured = squares[toIdx];
        squares[toIdx] = piece.at(to);
        squares[fromIdx] = null;
        try {
            return !isInCheck(piece.color());
        } finally {
            squares[fromIdx] = piece;
            squares[toIdx] = captured;
        }
    }

    /* ────── accessors ────── */

    @Override
    public Optional<Piece> pieceAt(Position pos) {
        return Optional.ofNullable(occupant(pos.x(), pos.y()));
    }

    @Override
    public Piece occupant(int x, int y) {
        return Position.inBounds(x, y) ? squares[y * BOARD_SIZE + x] : null;
    }

    @Override
    public List<Piece> pieces() {
        List<Piece> out = new ArrayList<>(32);
        for (Piece p : squares) {
            if (p != null) out.add(p);
        }
        return out;
    }

    @Override
    public Color currentTurn() {
        return currentTurn;
    }

    @Override
    public boolean isGameOver() {
        return gameOver;
    }

    @Override
    public Optional<Color> winner() {
        return Optional.ofNullable(winner);
    }

    @Override
    public List<MoveRecord> history() {
        return List.copyOf(history);
    }

    @Override
    public Optional<MoveRecord> lastMove() {
        return Optional.ofNullable(history.peekLast());
    }
}
