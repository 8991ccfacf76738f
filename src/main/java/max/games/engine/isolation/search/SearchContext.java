package max.games.engine.isolation.search;

import max.games.engine.common.Deadline;
import max.games.engine.common.Player;
import max.games.engine.isolation.analysis.CriticalCellCache;
import max.games.engine.isolation.search.evaluator.PositionEvaluator;
import max.games.engine.isolation.search.transpositiontable.TranspositionTable;

import java.util.Arrays;

/**
 * Mutable search state owned by one {@link SearchFacade}: move buffers, heuristic tables, the transposition
 * table and the critical-cell cache. {@link #newSearch} resets counters, killers, history and the cache before
 * every call; the transposition table survives between calls and only has its generation bumped.
 */
public final class SearchContext {
    public final int[][] moveBuf  = new int[SearchConstants.MAX_PLY][SearchConstants.MAX_MOVES];
    public final int[][] scoreBuf = new int[SearchConstants.MAX_PLY][SearchConstants.MAX_MOVES];
    // destroy candidates of the slide being expanded, reused at every ply
    final int[] destroyCells = new int[SearchConstants.MAX_DESTROY_CANDIDATES];
    final int[] destroyScores = new int[SearchConstants.MAX_DESTROY_CANDIDATES];

    // Heuristics, keyed by slide (from, to)
    public final int[][][] history = new int[2][64][64];
    public final int[][] killer = new int[SearchConstants.MAX_PLY][2];

    public Player rootSide;
    public Deadline deadline;
    public boolean aborted;

    // Counters
    public long nodes;
    public int currentDepth;
    public long nullTried, nullCut, pvsResearched;

    public final TranspositionTable tt; // nullable if disabled
    final TranspositionTable.Hit[] ttHit = new TranspositionTable.Hit[SearchConstants.MAX_PLY];
    public final CriticalCellCache criticalCells;
    public final PositionEvaluator evaluator;

    public final SearchConfig cfg;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.tt = cfg.useTT ? new TranspositionTable(cfg.ttEntries) : null;
        this.criticalCells = new CriticalCellCache(cfg.criticalCacheCapacity);
        this.evaluator = new PositionEvaluator(cfg.weights, criticalCells);
        for (int p = 0; p < ttHit.length; p++) ttHit[p] = new TranspositionTable.Hit();
    }

    public void newSearch(Player side, Deadline deadline) {
        this.rootSide = side;
        this.deadline = deadline;
        this.aborted = false;
        nodes = 0;
        nullTried = nullCut = pvsResearched = 0;
        for (int p = 0; p < SearchConstants.MAX_PLY; p++) { killer[p][0] = killer[p][1] = 0; }
        for (int s = 0; s < 2; s++) for (int f = 0; f < 64; f++) Arrays.fill(history[s][f], 0);
        if (tt != null) tt.newSearch();
        criticalCells.clear();
    }

    static int sideIndex(Player side) {
        return side == Player.AI ? 1 : 0;
    }
}
