package max.games.engine.isolation.analysis;

/** Cells claimed first by each side, plus the ones both frontiers reached in the same round. */
public record VoronoiResult(long humanCells, long aiCells, long contestedCells) {
    public int humanCount() { return Long.bitCount(humanCells); }
    public int aiCount() { return Long.bitCount(aiCells); }
    public int contestedCount() { return Long.bitCount(contestedCells); }
}
