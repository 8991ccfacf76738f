package max.games.engine.hex;

import max.games.engine.common.InvalidBoardException;
import max.games.engine.common.Player;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

public class HexBoardTest {

    @Test
    public void emptyListStaysConsistentWithItsInverse() {
        HexBoard board = new HexBoard();
        SplittableRandom rng = new SplittableRandom(11);
        Player p = Player.HUMAN;
        for (int played = 1; played <= 60; played++) {
            board.play(board.emptyAt(rng.nextInt(board.emptyCount())), p);
            p = p.opponent();

            assertEquals(HexGeometry.CELLS - played, board.emptyCount());
            for (int i = 0; i < board.emptyCount(); i++) {
                int cell = board.emptyAt(i);
                assertEquals(Player.NONE, board.cell(cell));
                assertEquals(i, board.emptyPosition(cell));
            }
            for (int cell = 0; cell < HexGeometry.CELLS; cell++) {
                if (board.cell(cell) != Player.NONE) assertEquals(-1, board.emptyPosition(cell));
            }
        }
    }

    @Test
    public void aiWinsTopToBottom() {
        HexBoard board = new HexBoard();
        for (int r = 0; r < HexGeometry.SIZE - 1; r++) board.play(r, 0, Player.AI);
        assertEquals(Player.NONE, board.winner());
        board.play(HexGeometry.SIZE - 1, 0, Player.AI);
        assertTrue(board.hasWon(Player.AI));
        assertFalse(board.hasWon(Player.HUMAN));
        assertEquals(Player.AI, board.winner());
    }

    @Test
    public void humanWinsLeftToRight() {
        HexBoard board = new HexBoard();
        for (int c = 0; c < HexGeometry.SIZE; c++) board.play(5, c, Player.HUMAN);
        assertEquals(Player.HUMAN, board.winner());
        // a full row of human stones does not connect the AI edges
        assertFalse(board.hasWon(Player.AI));
    }

    @Test
    public void fromArrayRoundTripsAndValidates() {
        int[] flat = new int[HexGeometry.CELLS];
        flat[HexGeometry.index(5, 5)] = 2;
        flat[HexGeometry.index(0, 3)] = 1;
        HexBoard board = HexBoard.fromArray(flat);
        assertEquals(HexGeometry.CELLS - 2, board.emptyCount());
        assertArrayEquals(flat, board.toArray());
        assertFalse(board.isLegal(5, 5));
        assertTrue(board.isLegal(5, 6));
        assertFalse(board.isLegal(11, 0));

        assertThrows(InvalidBoardException.class, () -> HexBoard.fromArray(new int[120]));
        int[] odd = new int[HexGeometry.CELLS];
        odd[3] = 7;
        odd[4] = -1;
        odd[5] = 2;
        HexBoard lenient = HexBoard.fromArray(odd);
        assertTrue(lenient.isLegal(0, 3), "unknown value reads as empty");
        assertTrue(lenient.isLegal(0, 4), "negative value reads as empty");
        assertFalse(lenient.isLegal(0, 5));
        assertEquals(HexGeometry.CELLS - 1, lenient.emptyCount());
    }

    @Test
    public void playingATakenCellFails() {
        HexBoard board = new HexBoard();
        board.play(3, 3, Player.HUMAN);
        assertThrows(IllegalStateException.class, () -> board.play(3, 3, Player.AI));
        assertThrows(InvalidBoardException.class, () -> board.play(-1, 3, Player.AI));
    }

    @Test
    public void copyDoesNotShareState() {
        HexBoard board = new HexBoard();
        board.play(0, 0, Player.AI);
        HexBoard copy = board.copy();
        for (int r = 1; r < HexGeometry.SIZE; r++) copy.play(r, 0, Player.AI);
        assertTrue(copy.hasWon(Player.AI));
        assertFalse(board.hasWon(Player.AI));
        assertEquals(HexGeometry.CELLS - 1, board.emptyCount());
    }
}
