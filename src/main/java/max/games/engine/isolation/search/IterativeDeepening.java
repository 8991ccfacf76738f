package max.games.engine.isolation.search;

import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.search.transpositiontable.ZobristHashKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static max.games.engine.isolation.search.SearchConstants.DECISIVE_SCORE;
import static max.games.engine.isolation.search.SearchConstants.INF;

final class IterativeDeepening {
    private static final Logger LOGGER = LogManager.getLogger();

    static SearchResult run(IsolationState state, SearchContext ctx) {
        final long key = ZobristHashKeys.hash(state, ctx.rootSide);
        final int maxDepth = ctx.cfg.maxDepth;

        RootSearch.Outcome last = null;
        int lastDepth = 0;
        int prevScore = 0;

        for (ctx.currentDepth = 1; ctx.currentDepth <= maxDepth; ctx.currentDepth++) {
            if (TimeControl.expired(ctx)) break;
            final int depth = ctx.currentDepth;

            int window = ctx.cfg.aspirationWindow;
            boolean aspirate = depth >= ctx.cfg.aspirationMinDepth && Math.abs(prevScore) < DECISIVE_SCORE;
            int alpha = aspirate ? prevScore - window : -INF;
            int beta  = aspirate ? prevScore + window :  INF;

            RootSearch.Outcome r;
            while (true) {
                r = RootSearch.searchAtDepth(state, key, ctx, depth, alpha, beta);
                if (r == null || !r.complete()) break;
                if (r.score() > alpha && r.score() < beta) break;
                if (alpha == -INF && beta == INF) break;

                window *= 2;
                LOGGER.debug("Aspiration miss at depth {} (score {}), widening to {}", depth, r.score(), window);
                if (window > ctx.cfg.aspirationMaxWindow) {
                    alpha = -INF;
                    beta = INF;
                } else if (r.score() <= alpha) {
                    alpha = prevScore - window;
                } else {
                    beta = prevScore + window;
                }
            }

            if (r == null || !r.complete()) {
                // a partial first iteration still beats the blind fallback
                if (depth == 1 && r != null) {
                    last = r;
                    lastDepth = 1;
                }
                break;
            }
            last = r;
            lastDepth = depth;
            prevScore = r.score();
            LOGGER.debug("Depth {} done: score {} nodes {} null {}/{} pvs-research {}",
                    depth, r.score(), ctx.nodes, ctx.nullCut, ctx.nullTried, ctx.pvsResearched);
            if (Math.abs(r.score()) > DECISIVE_SCORE) break;
        }

        final long timeMs = ctx.deadline.elapsedMs();
        final long nps = ctx.nodes * 1000L / Math.max(1L, timeMs);
        if (last == null) {
            int mv = RootSearch.firstOrderedMove(state, ctx);
            LOGGER.warn("No search depth completed in time, falling back to the first ordered move");
            return new SearchResult(mv, 0, 0, ctx.nodes, timeMs, nps, Confidence.HEURISTIC);
        }
        if (ctx.tt != null && LOGGER.isDebugEnabled()) LOGGER.debug("TT {}", ctx.tt.stats());
        return new SearchResult(last.move(), last.score(), lastDepth, ctx.nodes, timeMs, nps, Confidence.HEURISTIC);
    }
}
