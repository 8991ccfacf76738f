package max.games.engine.isolation.search.transpositiontable;

import java.util.Arrays;

/**
 * Bucketed transposition table. Each bucket holds {@value #WAYS} entries; a new entry replaces the same key
 * when it is at least as deep (or the stored one is from an older search), otherwise the stalest and
 * shallowest slot in the bucket.
 */
public final class TranspositionTable {
    private static final int WAYS = 4;
    public static final int DEFAULT_ENTRIES = 500_000;

    public static final byte TT_EXACT = 0, TT_LOWER = 1, TT_UPPER = 2;

    private final long[] keys;
    private final int[] scores;
    private final int[] moves;
    private final int[] meta;   // [15..14]=flag2, [13..8]=gen6, [7..0]=depth8, bit 16 = occupied

    private static final int OCCUPIED = 1 << 16;

    private final int bucketsMask;
    private final int slots;
    private int generation;     // 0..63

    public static final class Stats {
        public long probes;
        public long hits;
        public long hitsSufficient;
        public long stores;
        public long cutoffsFromTT;
        public long filledSlots;

        public void clear() {
            probes = hits = hitsSufficient = stores = cutoffsFromTT = 0;
        }

        @Override
        public String toString() {
            return String.format("TT: probes=%d hits=%d sufficient=%d stores=%d cutoffs=%d filled=%d",
                    probes, hits, hitsSufficient, stores, cutoffsFromTT, filledSlots);
        }
    }

    private final Stats stats = new Stats();

    public TranspositionTable() {
        this(DEFAULT_ENTRIES);
    }

    public TranspositionTable(int maxEntries) {
        long bucketsWanted = Math.max(1, maxEntries / WAYS);
        int b = 1;
        while ((long) b < bucketsWanted) b <<= 1;
        this.bucketsMask = b - 1;
        this.slots = b * WAYS;
        this.keys = new long[slots];
        this.scores = new int[slots];
        this.moves = new int[slots];
        this.meta = new int[slots];
    }

    public void clear() {
        Arrays.fill(keys, 0L);
        Arrays.fill(scores, 0);
        Arrays.fill(moves, 0);
        Arrays.fill(meta, 0);
        generation = 0;
        stats.clear();
        stats.filledSlots = 0;
    }

    /** Starts a new search: older entries become preferred replacement victims. */
    public void newSearch() {
        generation = (generation + 1) & 63;
        stats.clear();
    }

    public int generation() { return generation; }
    public int capacity() { return slots; }
    public Stats stats() { return stats; }
    public void countCutoff() { stats.cutoffsFromTT++; }

    /** Lightweight probe result, reused by the caller. */
    public static final class Hit {
        public boolean found;
        public int move;
        public int score;
        public int depth;
        public byte flag;

        public void reset() {
            found = false;
            move = score = depth = 0;
            flag = 0;
        }
    }

    /**
     * Fills {@code out} with the entry for {@code key} if present (any depth), so its move can still be used for
     * ordering. Returns true only if the stored depth is at least {@code reqDepth}.
     */
    public boolean probe(long key, int reqDepth, Hit out) {
        stats.probes++;
        final int base = bucket(key);
        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            if ((meta[idx] & OCCUPIED) == 0 || keys[idx] != key) continue;
            stats.hits++;
            int m = meta[idx];
            out.move = moves[idx];
            out.score = scores[idx];
            out.depth = m & 0xFF;
            out.flag = (byte) ((m >>> 14) & 3);
            out.found = out.depth >= reqDepth;
            if (out.found) stats.hitsSufficient++;
            return out.found;
        }
        out.reset();
        return false;
    }

    /** Stored best move for {@code key}, or 0. */
    public int peekMove(long key) {
        final int base = bucket(key);
        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            if ((meta[idx] & OCCUPIED) != 0 && keys[idx] == key) return moves[idx];
        }
        return 0;
    }

    public void store(long key, int move, int depth, int score, byte flag) {
        stats.stores++;
        final int base = bucket(key);
        final int packed = OCCUPIED | ((flag & 3) << 14) | ((generation & 63) << 8) | Math.min(255, Math.max(0, depth));

        int victim = -1;
        int worst = Integer.MIN_VALUE;
        for (int i = 0; i < WAYS; i++) {
            int idx = base + i;
            int m = meta[idx];
            if ((m & OCCUPIED) == 0) {
                victim = idx;
                stats.filledSlots++;
                break;
            }
            if (keys[idx] == key) {
                int oldDepth = m & 0xFF;
                int oldGen = (m >>> 8) & 63;
                if (depth < oldDepth && oldGen == generation) return;
                victim = idx;
                if (move == 0) move = moves[idx];
                break;
            }
            int sc = replacementScore(m);
            if (sc > worst) {
                worst = sc;
                victim = idx;
            }
        }
        keys[victim] = key;
        scores[victim] = score;
        moves[victim] = move;
        meta[victim] = packed;
    }

    /** Higher means a better victim: older generations first, then shallower entries. */
    private int replacementScore(int m) {
        int age = (generation - ((m >>> 8) & 63)) & 63;
        int depth = m & 0xFF;
        return (age << 8) - depth;
    }

    private int bucket(long key) {
        long h = key ^ (key >>> 32);
        return ((int) h & bucketsMask) * WAYS;
    }

    public double loadFactor() {
        return 100.0 * stats.filledSlots / slots;
    }
}
