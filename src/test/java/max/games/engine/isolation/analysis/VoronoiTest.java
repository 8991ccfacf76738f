package max.games.engine.isolation.analysis;

import max.games.engine.isolation.Bitboards;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.bit;
import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class VoronoiTest {

    @Test
    public void mirroredPiecesSplitTheBoardEvenly() {
        VoronoiResult v = Voronoi.calculate(index(0, 0), index(6, 6), 0L);
        assertEquals(v.humanCount(), v.aiCount());
        assertEquals(Bitboards.CELL_COUNT - 2, v.humanCount() + v.aiCount() + v.contestedCount());
        assertEquals(0L, v.humanCells() & v.aiCells());
        assertEquals(0L, v.contestedCells() & (v.humanCells() | v.aiCells()));
    }

    @Test
    public void centralPieceOwnsMore() {
        VoronoiResult v = Voronoi.calculate(index(0, 0), index(3, 3), 0L);
        assertTrue(v.aiCount() > v.humanCount(), "center " + v.aiCount() + " vs corner " + v.humanCount());
    }

    @Test
    public void wallKeepsEachSideToItsHalf() {
        long row = 0L;
        for (int c = 0; c < Bitboards.SIZE; c++) row |= bit(index(3, c));
        VoronoiResult v = Voronoi.calculate(index(0, 0), index(6, 6), row);
        assertEquals(20, v.humanCount());
        assertEquals(20, v.aiCount());
        assertEquals(0, v.contestedCount());
    }
}
