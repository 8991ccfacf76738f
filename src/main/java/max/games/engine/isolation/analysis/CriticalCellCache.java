package max.games.engine.isolation.analysis;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import max.games.engine.isolation.Bitboards;

import static max.games.engine.isolation.Bitboards.bit;

/**
 * Cells whose destruction would split the board, searched inside the bounding box between the two pieces
 * (grown by one cell). Owned by a single search call; when it holds {@code capacity} positions it is cleared
 * wholesale.
 */
public final class CriticalCellCache {
    public static final int DEFAULT_CAPACITY = 1000;

    private final Long2LongOpenHashMap cache;
    private final int capacity;
    private long hits, misses;

    public CriticalCellCache() {
        this(DEFAULT_CAPACITY);
    }

    public CriticalCellCache(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.cache = new Long2LongOpenHashMap(this.capacity);
    }

    /** destroyed fills bits 0..48, the two piece indices sit above it */
    static long key(int humanIdx, int aiIdx, long destroyed) {
        return destroyed | ((long) humanIdx << 49) | ((long) aiIdx << 55);
    }

    public long criticalCells(int humanIdx, int aiIdx, long destroyed) {
        final long k = key(humanIdx, aiIdx, destroyed);
        if (cache.containsKey(k)) {
            hits++;
            return cache.get(k);
        }
        misses++;
        long cells = findCriticalCells(humanIdx, aiIdx, destroyed);
        if (cache.size() >= capacity) cache.clear();
        cache.put(k, cells);
        return cells;
    }

    public static long findCriticalCells(int humanIdx, int aiIdx, long destroyed) {
        if (PartitionDetector.detect(humanIdx, aiIdx, destroyed).partitioned()) return 0L;

        int rMin = Math.max(0, Math.min(Bitboards.row(humanIdx), Bitboards.row(aiIdx)) - 1);
        int rMax = Math.min(Bitboards.SIZE - 1, Math.max(Bitboards.row(humanIdx), Bitboards.row(aiIdx)) + 1);
        int cMin = Math.max(0, Math.min(Bitboards.col(humanIdx), Bitboards.col(aiIdx)) - 1);
        int cMax = Math.min(Bitboards.SIZE - 1, Math.max(Bitboards.col(humanIdx), Bitboards.col(aiIdx)) + 1);

        final long occupied = destroyed | bit(humanIdx) | bit(aiIdx);
        long critical = 0L;
        for (int r = rMin; r <= rMax; r++) {
            for (int c = cMin; c <= cMax; c++) {
                int idx = Bitboards.index(r, c);
                if ((occupied & bit(idx)) != 0) continue;
                if (PartitionDetector.wouldCausePartition(humanIdx, aiIdx, destroyed, idx)) critical |= bit(idx);
            }
        }
        return critical;
    }

    public int size() { return cache.size(); }
    public long hits() { return hits; }
    public long misses() { return misses; }

    public void clear() {
        cache.clear();
        hits = misses = 0;
    }
}
