package max.games.engine.isolation.analysis;

import max.games.engine.isolation.Bitboards;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.BOARD_MASK;
import static max.games.engine.isolation.Bitboards.bit;
import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class CriticalCellCacheTest {

    @Test
    public void findsTheSingleCorridorCell() {
        // only (0,0), (0,1) and (0,2) are left
        long destroyed = BOARD_MASK & ~(bit(index(0, 0)) | bit(index(0, 1)) | bit(index(0, 2)));
        long critical = CriticalCellCache.findCriticalCells(index(0, 0), index(0, 2), destroyed);
        assertEquals(bit(index(0, 1)), critical);
    }

    @Test
    public void openBoardHasNoCriticalCells() {
        assertEquals(0L, CriticalCellCache.findCriticalCells(index(0, 0), index(6, 6), 0L));
    }

    @Test
    public void alreadySplitBoardReportsNothing() {
        long row = 0L;
        for (int c = 0; c < Bitboards.SIZE; c++) row |= bit(index(3, c));
        assertEquals(0L, CriticalCellCache.findCriticalCells(index(0, 0), index(6, 6), row));
    }

    @Test
    public void cacheHitsAndClearsWhenFull() {
        CriticalCellCache cache = new CriticalCellCache(2);
        cache.criticalCells(index(0, 0), index(6, 6), 0L);
        cache.criticalCells(index(0, 0), index(6, 6), 0L);
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());

        cache.criticalCells(index(0, 1), index(6, 6), 0L);
        assertEquals(2, cache.size());
        cache.criticalCells(index(0, 2), index(6, 6), 0L);
        assertEquals(1, cache.size(), "full cache is emptied before the new entry goes in");
    }

    @Test
    public void keysKeepPiecesApart() {
        assertNotEquals(CriticalCellCache.key(1, 2, 0L), CriticalCellCache.key(2, 1, 0L));
        assertNotEquals(CriticalCellCache.key(1, 2, 0L), CriticalCellCache.key(1, 2, 1L << 48));
    }
}
