package max.games.engine.isolation.book;

import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class HeuristicOpeningBookTest {

    private final OpeningBook book = new HeuristicOpeningBook();

    @Test
    public void openingMoveHeadsForTheCenter() {
        IsolationState s = IsolationState.initial();
        OptionalInt mv = book.pickMove(s, Player.AI, BookPolicy.defaults());
        assertTrue(mv.isPresent());
        assertTrue(s.isLegal(mv.getAsInt(), Player.AI), IsolationMove.toString(mv.getAsInt()));
        int to = IsolationMove.to(mv.getAsInt());
        assertTrue(Bitboards.CENTER_DISTANCE[to] <= 2, "landed on " + IsolationMove.toString(mv.getAsInt()));
        assertFalse(Bitboards.isCorner(to));
    }

    @Test
    public void bookWorksForBothSides() {
        IsolationState s = IsolationState.initial();
        OptionalInt mv = book.pickMove(s, Player.HUMAN, BookPolicy.defaults());
        assertTrue(mv.isPresent());
        assertTrue(s.isLegal(mv.getAsInt(), Player.HUMAN));
    }

    @Test
    public void policyLimitsTheBook() {
        IsolationState s = IsolationState.initial();
        assertTrue(book.pickMove(s, Player.AI, BookPolicy.disabled()).isEmpty());

        IsolationState late = IsolationState.of(0, 0, 6, 6,
                1, 1, 1, 2, 1, 3, 1, 4, 1, 5, 5, 1, 5, 2, 5, 3);
        assertEquals(8, late.destroyedCount());
        assertTrue(book.pickMove(late, Player.AI, BookPolicy.defaults()).isEmpty());
    }

    @Test
    public void policyCountsDestroyedCells() {
        assertTrue(BookPolicy.defaults().applies(7));
        assertFalse(BookPolicy.defaults().applies(8));
        assertFalse(BookPolicy.disabled().applies(0));
    }

    @Test
    public void vacatedCellCanBeDestroyed() {
        // the AI leaves (1,1), the human's only way out of the corner
        IsolationState s = IsolationState.of(0, 0, 1, 1, 0, 1, 1, 0);
        int destroy = HeuristicOpeningBook.bestDestroy(s, Player.AI, Bitboards.index(4, 4));
        assertEquals(Bitboards.index(1, 1), destroy, "destroyed " + destroy);

        int move = IsolationMove.of(Bitboards.index(1, 1), Bitboards.index(4, 4), destroy);
        assertTrue(s.isLegal(move, Player.AI));
    }
}
