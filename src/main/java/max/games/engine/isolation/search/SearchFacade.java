package max.games.engine.isolation.search;

import max.games.engine.common.Clock;
import max.games.engine.common.Deadline;
import max.games.engine.common.Player;
import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.analysis.PartitionDetector;
import max.games.engine.isolation.analysis.PartitionResult;
import max.games.engine.isolation.book.HeuristicOpeningBook;
import max.games.engine.isolation.book.OpeningBook;
import max.games.engine.isolation.endgame.EndgameResult;
import max.games.engine.isolation.endgame.EndgameSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalInt;

import static max.games.engine.isolation.search.SearchConstants.LOSS_SCORE;
import static max.games.engine.isolation.search.SearchConstants.SOLVED_DEPTH;

/**
 * Move selection for the isolation game: opening book first, the exact endgame solver once the pieces are
 * separated into small regions, iterative-deepening alpha-beta otherwise.
 */
public final class SearchFacade {
    private static final Logger LOGGER = LogManager.getLogger();

    private final SearchContext ctx;
    private final Clock clock;
    private final OpeningBook book;
    private final EndgameSolver solver = new EndgameSolver();

    public SearchFacade(SearchConfig cfg, Clock clock) {
        this(cfg, clock, new HeuristicOpeningBook());
    }

    public SearchFacade(SearchConfig cfg, Clock clock, OpeningBook book) {
        this.ctx = new SearchContext(cfg);
        this.clock = clock;
        this.book = book;
    }

    public SearchResult findBestMove(IsolationState state, Player side) {
        return findBestMove(state, side, ctx.cfg.defaultBudgetMs);
    }

    public SearchResult findBestMove(IsolationState state, Player side, long budgetMs) {
        final Deadline deadline = Deadline.startingNow(clock, budgetMs);
        if (state.mobility(side) == 0) {
            LOGGER.warn("{} has no legal slide, no move to return", side);
            return SearchResult.noMove(deadline.elapsedMs());
        }

        OptionalInt bookMove = book.pickMove(state, side, ctx.cfg.bookPolicy);
        if (bookMove.isPresent()) {
            SearchResult r = new SearchResult(bookMove.getAsInt(), 0, 0, 0, deadline.elapsedMs(), 0, Confidence.BOOK);
            LOGGER.info("Isolation book move {}", IsolationMove.toString(r.move()));
            return r;
        }

        if (ctx.cfg.useEndgameSolver) {
            SearchResult solved = trySolve(state, side, deadline);
            if (solved != null) return solved;
        }

        ctx.newSearch(side, deadline);
        SearchResult r = IterativeDeepening.run(state, ctx);
        LOGGER.info("Isolation search: {} score {} depth {} nodes {} in {} ms ({} nps)",
                IsolationMove.toString(r.move()), r.score(), r.depth(), r.nodes(), r.timeMs(), r.nps());
        return r;
    }

    /** Exact answer once split into a small enough own region, otherwise null. */
    private SearchResult trySolve(IsolationState state, Player side, Deadline deadline) {
        PartitionResult p = PartitionDetector.detect(state);
        if (!p.partitioned()) return null;

        final long own = side == Player.AI ? p.aiRegion() : p.humanRegion();
        final long other = side == Player.AI ? p.humanRegion() : p.aiRegion();
        if (Long.bitCount(own) > ctx.cfg.endgameRegionLimit) return null;

        final Deadline share = deadline.fraction(ctx.cfg.endgameTimeShare);
        EndgameResult e = solver.solve(state, side, own, share);
        if (!e.solved()) {
            LOGGER.debug("Endgame solver ran out of time, continuing with search");
            return null;
        }

        // the opponent's path is exact only when its region is small and solved within the same share
        final int n = Long.bitCount(other);
        int theirs = n <= ctx.cfg.endgameRegionLimit
                ? solver.longestPath(state.position(side.opponent()), other, share)
                : EndgameSolver.NOT_SOLVED;
        final boolean exact = theirs != EndgameSolver.NOT_SOLVED;
        if (!exact) theirs = EndgameSolver.estimateLongestPath(n);

        // the mover runs out first unless its path is strictly longer
        int score = e.longestPath() > theirs ? LOSS_SCORE + e.longestPath() : -LOSS_SCORE + e.longestPath();
        long timeMs = deadline.elapsedMs();
        LOGGER.info("Isolation endgame: {} path {} vs {}{} in {} ms", IsolationMove.toString(e.move()),
                e.longestPath(), theirs, exact ? "" : " (estimated)", timeMs);
        return exact
                ? new SearchResult(e.move(), score, SOLVED_DEPTH, 0, timeMs, 0, Confidence.EXACT)
                : new SearchResult(e.move(), score, e.longestPath(), 0, timeMs, 0, Confidence.HEURISTIC);
    }

    public void clear() {
        if (ctx.tt != null) ctx.tt.clear();
    }
}
