package max.games.engine.isolation.search.transpositiontable;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class ZobristHashKeysTest {

    @Test
    public void hashIsDeterministicAndSideAware() {
        IsolationState s = IsolationState.of(1, 1, 5, 5, 3, 3);
        assertEquals(ZobristHashKeys.hash(s, Player.AI), ZobristHashKeys.hash(IsolationState.of(1, 1, 5, 5, 3, 3), Player.AI));
        assertNotEquals(ZobristHashKeys.hash(s, Player.AI), ZobristHashKeys.hash(s, Player.HUMAN));
        assertNotEquals(ZobristHashKeys.hash(s, Player.AI), ZobristHashKeys.hash(IsolationState.of(1, 1, 5, 5), Player.AI));
        // swapping the pieces is a different position
        assertNotEquals(ZobristHashKeys.hash(s, Player.AI), ZobristHashKeys.hash(IsolationState.of(5, 5, 1, 1, 3, 3), Player.AI));
    }

    @Test
    public void incrementalUpdateMatchesFullHash() {
        IsolationState s = IsolationState.initial();
        long key = ZobristHashKeys.hash(s, Player.AI);
        Player side = Player.AI;
        int[][] line = {{3, 3, 6, 6}, {0, 3, 0, 0}, {3, 5, 4, 4}, {1, 3, 2, 2}};
        for (int[] step : line) {
            int mv = IsolationMove.of(s.position(side), index(step[0], step[1]), index(step[2], step[3]));
            assertTrue(s.isLegal(mv, side), IsolationMove.toString(mv));
            key = ZobristHashKeys.afterMove(key, side, mv);
            s = s.apply(mv, side);
            side = side.opponent();
            assertEquals(ZobristHashKeys.hash(s, side), key);
        }
        assertEquals(ZobristHashKeys.hash(s, side.opponent()), ZobristHashKeys.afterPass(key));
    }
}
