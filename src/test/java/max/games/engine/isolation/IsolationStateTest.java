package max.games.engine.isolation;

import max.games.engine.common.InvalidBoardException;
import max.games.engine.common.Player;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class IsolationStateTest {

    @Test
    public void fromArrayReadsPiecesAndDestroyedCells() {
        int[] flat = new int[Bitboards.CELL_COUNT];
        flat[index(2, 3)] = IsolationState.HUMAN_CELL;
        flat[index(4, 4)] = IsolationState.AI_CELL;
        flat[index(0, 0)] = IsolationState.DESTROYED_CELL;
        IsolationState s = IsolationState.fromArray(flat);

        assertEquals(index(2, 3), s.position(Player.HUMAN));
        assertEquals(index(4, 4), s.position(Player.AI));
        assertEquals(1, s.destroyedCount());
        assertEquals(46, s.freeCells());
        assertArrayEquals(flat, s.toArray());
    }

    @Test
    public void missingPiecesGetDefaultCells() {
        IsolationState s = IsolationState.fromArray(new int[Bitboards.CELL_COUNT]);
        assertEquals(IsolationState.DEFAULT_HUMAN_CELL, s.position(Player.HUMAN));
        assertEquals(IsolationState.DEFAULT_AI_CELL, s.position(Player.AI));

        int[] flat = new int[Bitboards.CELL_COUNT];
        flat[IsolationState.DEFAULT_AI_CELL] = IsolationState.HUMAN_CELL;
        IsolationState moved = IsolationState.fromArray(flat);
        assertNotEquals(moved.position(Player.HUMAN), moved.position(Player.AI));
    }

    @Test
    public void wrongLengthIsRejectedButUnknownValuesReadAsEmpty() {
        assertThrows(InvalidBoardException.class, () -> IsolationState.fromArray(new int[48]));
        assertThrows(InvalidBoardException.class, () -> IsolationState.fromArray(null));
        int[] flat = new int[Bitboards.CELL_COUNT];
        flat[index(0, 0)] = 1;
        flat[index(6, 6)] = 2;
        flat[5] = 9;
        flat[6] = -3;
        IsolationState s = IsolationState.fromArray(flat);
        assertEquals(0L, s.destroyedMask());
        assertEquals(0, s.toArray()[5]);
        assertEquals(0, s.toArray()[6]);
        assertEquals(index(0, 0), s.position(Player.HUMAN));
    }

    @Test
    public void movesAreCheckedAgainstSlidesAndEmptyCells() {
        IsolationState s = IsolationState.initial();
        int from = s.position(Player.AI);
        int ok = IsolationMove.of(from, index(3, 3), from);
        assertTrue(s.isLegal(ok, Player.AI), "the vacated cell may be destroyed");
        assertFalse(s.isLegal(IsolationMove.of(from, index(4, 5), 0), Player.AI), "not a queen line");
        assertFalse(s.isLegal(IsolationMove.of(from, index(3, 3), index(3, 3)), Player.AI), "cannot destroy own cell");
        assertFalse(s.isLegal(IsolationMove.of(from, index(3, 3), index(0, 0)), Player.AI), "cannot destroy a piece");
        assertThrows(IllegalStateException.class,
                () -> s.applyChecked(IsolationMove.of(from, index(4, 5), 0), Player.AI));

        IsolationState next = s.applyChecked(ok, Player.AI);
        assertEquals(index(3, 3), next.position(Player.AI));
        assertEquals(1, next.destroyedCount());
    }

    @Test
    public void stuckSideLoses() {
        IsolationState s = IsolationState.of(0, 0, 6, 6, 0, 1, 1, 0, 1, 1);
        assertEquals(0, s.mobility(Player.HUMAN));
        assertEquals(Player.AI, s.winner(Player.HUMAN));
        assertEquals(Player.NONE, s.winner(Player.AI));
    }

    @Test
    public void legalSlidesListTheQueenDestinations() {
        IsolationState s = IsolationState.of(0, 0, 6, 6);
        var slides = s.legalSlides(Player.HUMAN);
        assertEquals(s.mobility(Player.HUMAN), slides.size());
        assertEquals(17, slides.size(), "row, column and a diagonal stopped by the AI piece");
        assertTrue(slides.contains(index(0, 6)));
        assertFalse(slides.contains(index(6, 6)), "occupied cell is not a destination");
        for (int i = 1; i < slides.size(); i++) assertTrue(slides.getInt(i - 1) < slides.getInt(i));
    }
}
