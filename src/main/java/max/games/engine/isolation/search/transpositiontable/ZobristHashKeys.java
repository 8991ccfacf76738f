package max.games.engine.isolation.search.transpositiontable;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;

import static max.games.engine.isolation.Bitboards.CELL_COUNT;

/**
 * Zobrist keys for isolation positions: one key per cell for each piece and for a destroyed cell, plus a
 * side-to-move key mixed in when the AI is to move. Keys come from a fixed-seed LCG so hashes are stable
 * across runs.
 */
public final class ZobristHashKeys {
    private static final long[] HUMAN_KEYS = new long[CELL_COUNT];
    private static final long[] AI_KEYS = new long[CELL_COUNT];
    private static final long[] DESTROYED_KEYS = new long[CELL_COUNT];
    private static final long AI_TO_MOVE_KEY;

    private static long seed = 0x123456789ABCDEFL;

    static {
        for (int i = 0; i < CELL_COUNT; i++) HUMAN_KEYS[i] = nextKey();
        for (int i = 0; i < CELL_COUNT; i++) AI_KEYS[i] = nextKey();
        for (int i = 0; i < CELL_COUNT; i++) DESTROYED_KEYS[i] = nextKey();
        AI_TO_MOVE_KEY = nextKey();
    }

    private ZobristHashKeys() {
    }

    private static long nextKey() {
        seed = seed * 6364136223846793005L + 1442695040888963407L;
        // LCG low bits are weak, fold the high half in
        long z = seed;
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        return z;
    }

    public static long hash(IsolationState state, Player toMove) {
        long key = HUMAN_KEYS[state.position(Player.HUMAN)] ^ AI_KEYS[state.position(Player.AI)];
        for (long d = state.destroyedMask(); d != 0; d &= d - 1) {
            key ^= DESTROYED_KEYS[Long.numberOfTrailingZeros(d)];
        }
        if (toMove == Player.AI) key ^= AI_TO_MOVE_KEY;
        return key;
    }

    /** Key of the position reached when {@code side} plays {@code move}; the turn flips. */
    public static long afterMove(long key, Player side, int move) {
        long[] pieceKeys = side == Player.AI ? AI_KEYS : HUMAN_KEYS;
        return key
                ^ pieceKeys[IsolationMove.from(move)]
                ^ pieceKeys[IsolationMove.to(move)]
                ^ DESTROYED_KEYS[IsolationMove.destroy(move)]
                ^ AI_TO_MOVE_KEY;
    }

    /** Key after passing the turn (null move). */
    public static long afterPass(long key) {
        return key ^ AI_TO_MOVE_KEY;
    }
}
