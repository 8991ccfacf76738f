package max.games.engine.isolation.search;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;

final class MoveOrdering {
    static final int TT_MOVE = 100_000;
    static final int KILLER = 9_000;
    static final int IMMEDIATE_WIN = 50_000;
    static final int NO_FOLLOW_UP = -100_000;
    static final int ONE_FOLLOW_UP = -20_000;
    static final int TWO_FOLLOW_UPS = -2_000;

    /**
     * Writes every (slide, destroy-candidate) pair for {@code side} into {@code moves} with an ordering score.
     * The caller picks them best-first with {@link #pickNext}.
     */
    static int generate(SearchContext ctx, IsolationState state, Player side, int ply, int ttMove,
                        int[] moves, int[] scores) {
        final int from = state.position(side);
        final int s = SearchContext.sideIndex(side);
        final int k = ctx.cfg.destroyCandidates(state.destroyedCount());
        final int ttSlide = ttMove == 0 ? -1 : IsolationMove.slideKey(ttMove);

        int count = 0;
        for (long m = state.slides(side); m != 0; m &= m - 1) {
            int to = Long.numberOfTrailingZeros(m);
            IsolationState afterSlide = state.slide(side, to);
            int slideScore = scoreSlide(ctx, afterSlide, side, s, from, to, ply, ttSlide);

            int n = DestroyCandidates.select(afterSlide, side, k, ctx.destroyCells, ctx.destroyScores);
            for (int j = 0; j < n; j++) {
                int mv = IsolationMove.of(from, to, ctx.destroyCells[j]);
                moves[count] = mv;
                scores[count] = slideScore + ctx.destroyScores[j] + (mv == ttMove ? TT_MOVE : 0);
                count++;
            }
        }
        return count;
    }

    static int scoreSlide(SearchContext ctx, IsolationState afterSlide, Player side, int s, int from, int to,
                          int ply, int ttSlide) {
        int score = ctx.history[s][from][to];
        int slide = IsolationMove.slideKey(IsolationMove.of(from, to, 0));
        if (slide == ttSlide) score += TT_MOVE;
        if (Heuristics.isKiller(ctx, ply, slide)) score += KILLER;

        int opponentMobility = afterSlide.mobility(side.opponent());
        if (opponentMobility == 0) return score + IMMEDIATE_WIN;

        // a slide into a dead end loses unless the opponent is just as stuck
        if (opponentMobility > 1) {
            int followUps = afterSlide.mobility(side);
            if (followUps == 0) score += NO_FOLLOW_UP;
            else if (followUps == 1) score += ONE_FOLLOW_UP;
            else if (followUps == 2) score += TWO_FOLLOW_UPS;
        }
        return score;
    }

    /** Selection step: swaps the best remaining move into {@code i}. */
    static void pickNext(int[] moves, int[] scores, int i, int count) {
        int best = i;
        for (int j = i + 1; j < count; j++) {
            if (scores[j] > scores[best]) best = j;
        }
        if (best != i) {
            int m = moves[i]; moves[i] = moves[best]; moves[best] = m;
            int sc = scores[i]; scores[i] = scores[best]; scores[best] = sc;
        }
    }
}
