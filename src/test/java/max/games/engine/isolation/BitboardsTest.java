package max.games.engine.isolation;

import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static max.games.engine.isolation.Bitboards.bit;
import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class BitboardsTest {

    @Test
    public void shiftedQueenMovesMatchRayScan() {
        SplittableRandom rng = new SplittableRandom(2024);
        for (int round = 0; round < 2000; round++) {
            long blocked = rng.nextLong() & rng.nextLong() & Bitboards.BOARD_MASK;
            int from = rng.nextInt(Bitboards.CELL_COUNT);
            blocked &= ~bit(from);
            assertEquals(Bitboards.queenMovesRay(from, blocked), Bitboards.queenMoves(from, blocked),
                    "from " + from + "\n" + Bitboards.toString(blocked));
        }
    }

    @Test
    public void slidesDoNotWrapAcrossRows() {
        long moves = Bitboards.queenMoves(index(3, 6), 0L);
        assertEquals(0L, moves & bit(index(4, 0)));
        assertEquals(0L, moves & bit(index(2, 0)));
        assertEquals(24, Long.bitCount(Bitboards.queenMoves(index(3, 3), 0L)));
        assertEquals(18, Long.bitCount(Bitboards.queenMoves(index(0, 6), 0L)));

        long fromLeft = Bitboards.queenMoves(index(2, 0), 0L);
        assertEquals(0L, fromLeft & bit(index(1, 6)), "up-left diagonal from column 0 must stop");
    }

    @Test
    public void floodFillStopsAtWalls() {
        long wall = 0L;
        for (int c = 0; c < Bitboards.SIZE; c++) wall |= bit(index(3, c));
        long reach = Bitboards.floodFill(index(0, 0), wall);
        assertEquals(20, Long.bitCount(reach));
        assertEquals(0L, reach & bit(index(0, 0)), "start cell is not part of its own region");
        assertEquals(0L, reach & bit(index(5, 5)));
    }

    @Test
    public void distances() {
        assertEquals(6, Bitboards.chebyshev(index(0, 0), index(6, 6)));
        assertEquals(12, Bitboards.manhattan(index(0, 0), index(6, 6)));
        assertEquals(0, Bitboards.CENTER_DISTANCE[index(3, 3)]);
        assertEquals(0, Bitboards.CORNER_PROXIMITY[index(6, 0)]);
        assertEquals(Bitboards.CORNER_PROXIMITY[index(1, 2)], Bitboards.CORNER_PROXIMITY[index(5, 4)]);
        assertTrue(Bitboards.isCorner(index(0, 6)));
        assertFalse(Bitboards.isCorner(index(0, 5)));
        assertTrue(Bitboards.isEdge(index(0, 5)));
    }
}
