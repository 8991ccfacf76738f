package max.games.engine.isolation.endgame;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import max.games.engine.common.Deadline;
import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static max.games.engine.isolation.Bitboards.BOARD_MASK;
import static max.games.engine.isolation.Bitboards.bit;

/**
 * Exact play once the pieces are separated: the mover maximises the number of slides it can still make inside
 * its own region, computed by a memoised longest-path search over (position, visited cells).
 */
public final class EndgameSolver {
    private static final Logger LOGGER = LogManager.getLogger();

    /** Share of the solver's allowance after which it gives up and reports a heuristic answer. */
    public static final double ABORT_SHARE = 0.8;
    /** Returned by {@link #longestPath} when the allowance ran out first. */
    public static final int NOT_SOLVED = -1;

    private static final int TIME_CHECK_MASK = 4095;
    private static final int ABORTED = Integer.MIN_VALUE;

    static final int OUTSIDE_REGION_BONUS = 200;
    static final int DISTANCE_FROM_NEW_POSITION = 5;
    static final int OPPONENT_PROXIMITY = 3;

    private final Long2IntOpenHashMap memo = new Long2IntOpenHashMap();
    private Deadline abortAt;
    private long calls;

    /**
     * @param region  cells the mover can still reach, its own cell excluded
     * @param allowance time the solver may use; it stops at {@link #ABORT_SHARE} of it
     */
    public EndgameResult solve(IsolationState state, Player side, long region, Deadline allowance) {
        memo.clear();
        calls = 0;
        abortAt = allowance.fraction(ABORT_SHARE);

        final int from = state.position(side);
        final long fromBit = bit(from);
        long slides = state.slides(side) & region;

        int bestTo = -1;
        int bestPath = -1;
        boolean solved = true;
        for (long m = slides; m != 0; m &= m - 1) {
            if (abortAt.expired()) {
                solved = false;
                break;
            }
            int to = Long.numberOfTrailingZeros(m);
            int path = longestPathOrAbort(to, fromBit | bit(to), region);
            if (path == ABORTED) {
                solved = false;
                break;
            }
            path += 1;
            if (path > bestPath) {
                bestPath = path;
                bestTo = to;
            }
        }

        if (bestTo < 0) {
            return new EndgameResult(IsolationMove.NONE, 0, solved ? Confidence.EXACT : Confidence.HEURISTIC);
        }
        int destroy = bestDestroy(state, side, bestTo, region);
        Confidence confidence = solved ? Confidence.EXACT : Confidence.HEURISTIC;
        LOGGER.debug("Endgame solver: region={} path={} memo={} confidence={}",
                Long.bitCount(region), bestPath, memo.size(), confidence);
        return new EndgameResult(IsolationMove.of(from, bestTo, destroy), bestPath, confidence);
    }

    private int longestPathOrAbort(int pos, long visited, long region) {
        if ((++calls & TIME_CHECK_MASK) == 0 && abortAt.expired()) return ABORTED;

        final long key = visited | ((long) pos << Bitboards.CELL_COUNT);
        if (memo.containsKey(key)) return memo.get(key);

        long moves = Bitboards.queenMoves(pos, ~region | visited);
        int best = 0;
        for (long m = moves; m != 0; m &= m - 1) {
            int next = Long.numberOfTrailingZeros(m);
            int sub = longestPathOrAbort(next, visited | bit(next), region);
            if (sub == ABORTED) return ABORTED;
            if (sub + 1 > best) best = sub + 1;
        }
        memo.put(key, best);
        return best;
    }

    /**
     * Longest number of slides a piece on {@code pos} can make through {@code region}, under the same
     * {@link #ABORT_SHARE} cut-off as {@link #solve}.
     *
     * @return the path length, or {@link #NOT_SOLVED} if the allowance ran out first
     */
    public int longestPath(int pos, long region, Deadline allowance) {
        memo.clear();
        calls = 0;
        abortAt = allowance.fraction(ABORT_SHARE);
        if (abortAt.expired()) return NOT_SOLVED;

        int path = longestPathOrAbort(pos, bit(pos), region);
        return path == ABORTED ? NOT_SOLVED : path;
    }

    /** Destroy outside our own region, away from where we land and close to the opponent. */
    static int bestDestroy(IsolationState state, Player side, int newPos, long region) {
        final int opponent = state.position(side.opponent());
        final long occupied = state.blocked() & ~bit(state.position(side)) | bit(newPos);
        final long empty = ~occupied & BOARD_MASK;

        int best = -1;
        int bestScore = Integer.MIN_VALUE;
        for (long m = empty; m != 0; m &= m - 1) {
            int idx = Long.numberOfTrailingZeros(m);
            int score = 0;
            if ((region & bit(idx)) == 0) score += OUTSIDE_REGION_BONUS;
            score += Bitboards.manhattan(idx, newPos) * DISTANCE_FROM_NEW_POSITION;
            score += (10 - Bitboards.manhattan(idx, opponent)) * OPPONENT_PROXIMITY;
            if (score > bestScore) {
                bestScore = score;
                best = idx;
            }
        }
        return best;
    }

    public static int estimateLongestPath(int regionCells) {
        return (int) (regionCells * 0.75);
    }
}
