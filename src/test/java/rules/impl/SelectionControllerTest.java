package rules.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rules.constants.Color;
import rules.constants.MoveResult;
import rules.contracts.PieceFactory;
import rules.records.Position;

class SelectionControllerTest {

    private static final PieceFactory FACTORY = new PieceFactoryImpl();

    private SelectionController ctl;

    @BeforeEach
    void setUp() {
        ctl = new SelectionController(FACTORY.standardBoard());
    }

    private MoveResult click(int x, int y) {
        return ctl.click(new Position(x, y));
    }

    @Test
    void onlyOwnPiecesCanBePickedUp() {
        assertEquals(MoveResult.INVALID, click(4, 4));
        assertTrue(ctl.selected().isEmpty(), "empty square");

        click(4, 1);
        assertTrue(ctl.selected().isEmpty(), "black piece on white's turn");

        click(8, 3);
        assertTrue(ctl.selected().isEmpty(), "off the board");

        click(4, 6);
        assertEquals(Optional.of(new Position(4, 6)), ctl.selected());
    }

    @Test
    void clickingTheSelectedSquareAgainDeselects() {
        click(4, 6);
        click(4, 6);
        assertTrue(ctl.selected().isEmpty());
    }

    @Test
    void clickingAnotherOwnPieceSwitchesSelection() {
        click(4, 6);
        click(6, 7);
        assertEquals(Optional.of(new Position(6, 7)), ctl.selected());
    }

    @Test
    void illegalTargetKeepsSelection() {
        click(4, 6);
        assertEquals(MoveResult.INVALID, click(4, 2));
        assertEquals(Optional.of(new Position(4, 6)), ctl.selected());
        assertEquals(Color.WHITE, ctl.board().currentTurn());
    }

    @Test
    void legalTargetPlaysTheMoveAndClearsSelection() {
        click(4, 6);
        assertEquals(MoveResult.SUCCESS, click(4, 4));
        assertTrue(ctl.selected().isEmpty());
        assertEquals(Color.BLACK, ctl.board().currentTurn());
        assertEquals("", ctl.status());
    }

    @Test
    void checkIsAnnouncedForTheSideInCheck() {
        click(4, 6); click(4, 4); // e4
        click(5, 1); click(5, 3); // f5
        click(3, 7);
        assertEquals(MoveResult.CHECK, click(7, 3)); // Qh5+
        assertEquals("Black is in check!", ctl.status());
    }

    @Test
    void mateIsAnnouncedAndFreezesTheBoard() {
        click(5, 6); click(5, 5);
        click(4, 1); click(4, 3);
        click(6, 6); click(6, 4);
        click(3, 0);
        assertEquals(MoveResult.CHECKMATE, click(7, 4));
        assertEquals("Checkmate! Black wins!", ctl.status());

        assertEquals(MoveResult.INVALID, click(4, 6));
        assertTrue(ctl.selected().isEmpty());
        assertEquals("Checkmate! Black wins!", ctl.status());
    }

    @Test
    void stalemateIsAnnounced() {
        ctl.reset(FACTORY.fromPlacement("7k/8/6K1/8/8/8/8/5Q2", Color.WHITE));
        click(5, 7);
        assertEquals(MoveResult.STALEMATE, click(5, 1));
        assertEquals("Stalemate! Game ended in a draw.", ctl.status());
    }

    @Test
    void undoReportsWhatHappened() {
        assertFalse(ctl.undo());
        assertEquals("No moves to undo!", ctl.status());

        click(4, 6); click(4, 4);
        click(4, 1); // black picks up a pawn
        assertTrue(ctl.undo());
        assertEquals("Undo successful!", ctl.status());
        assertTrue(ctl.selected().isEmpty());
        assertEquals(Color.WHITE, ctl.board().currentTurn());
    }

    @Test
    void undoWorksAfterMate() {
        click(5, 6); click(5, 5);
        click(4, 1); click(4, 3);
        click(6, 6); click(6, 4);
        click(3, 0); click(7, 4);

        assertTrue(ctl.undo());
        assertFalse(ctl.board().isGameOver());
        click(3, 0);
        assertEquals(Optional.of(new Position(3, 0)), ctl.selected());
    }
}
