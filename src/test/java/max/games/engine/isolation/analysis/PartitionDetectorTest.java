package max.games.engine.isolation.analysis;

import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationState;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.bit;
import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class PartitionDetectorTest {

    /** Two adjacent anti-diagonals: a diagonal slide cannot jump a wall two cells thick. */
    static long thickAntiDiagonalWall() {
        long wall = 0L;
        for (int r = 0; r < Bitboards.SIZE; r++) {
            for (int c = 0; c < Bitboards.SIZE; c++) {
                if (r + c == 6 || r + c == 7) wall |= bit(index(r, c));
            }
        }
        return wall;
    }

    @Test
    public void openBoardIsConnected() {
        assertFalse(PartitionDetector.isPartitioned(IsolationState.initial()));
        assertFalse(PartitionDetector.detect(index(0, 0), index(0, 1), 0L).partitioned(), "adjacent pieces");
    }

    @Test
    public void thickWallSplitsTheBoard() {
        long wall = thickAntiDiagonalWall();
        assertEquals(13, Long.bitCount(wall));
        PartitionResult p = PartitionDetector.detect(index(0, 0), index(6, 6), wall);
        assertTrue(p.partitioned());
        assertEquals(20, p.humanRegionSize());
        assertEquals(14, p.aiRegionSize());
        assertEquals(Bitboards.CELL_COUNT - 13 - 2, p.humanRegionSize() + p.aiRegionSize());
        assertEquals(0L, p.humanRegion() & p.aiRegion());
        assertEquals(-6, p.aiAdvantage());
    }

    @Test
    public void singleDiagonalDoesNotSeparateQueens() {
        // a slide along the other diagonal passes between two destroyed cells
        long diagonal = 0L;
        for (int i = 0; i < Bitboards.SIZE; i++) diagonal |= bit(index(i, i));
        assertFalse(PartitionDetector.detect(index(6, 0), index(0, 6), diagonal).partitioned());
    }

    @Test
    public void fullRowSplitsTheBoard() {
        long row = 0L;
        for (int c = 0; c < Bitboards.SIZE; c++) row |= bit(index(3, c));
        PartitionResult p = PartitionDetector.detect(index(0, 0), index(6, 6), row);
        assertTrue(p.partitioned());
        assertEquals(20, p.humanRegionSize());
        assertEquals(20, p.aiRegionSize());
    }

    @Test
    public void lastGapIsDetectedAsPartitioning() {
        long row = 0L;
        for (int c = 1; c < Bitboards.SIZE; c++) row |= bit(index(3, c));
        assertFalse(PartitionDetector.detect(index(0, 0), index(6, 6), row).partitioned());
        assertTrue(PartitionDetector.wouldCausePartition(index(0, 0), index(6, 6), row, index(3, 0)));
    }
}
