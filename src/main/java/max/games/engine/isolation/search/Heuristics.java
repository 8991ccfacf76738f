package max.games.engine.isolation.search;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationMove;

final class Heuristics {
    static void onBetaCutoffUpdateHeuristics(SearchContext ctx, Player side, int mv, int depth, int ply) {
        final int s = SearchContext.sideIndex(side);
        final int from = IsolationMove.from(mv);
        final int to = IsolationMove.to(mv);

        ctx.history[s][from][to] = boundedUpdate(ctx.history[s][from][to], depth * depth);

        // Killers, most recent first
        if (ctx.killer[ply][0] != mv) {
            ctx.killer[ply][1] = ctx.killer[ply][0];
            ctx.killer[ply][0] = mv;
        }
    }

    static boolean isKiller(SearchContext ctx, int ply, int mv) {
        final int key = IsolationMove.slideKey(mv);
        return (ctx.killer[ply][0] != 0 && IsolationMove.slideKey(ctx.killer[ply][0]) == key)
                || (ctx.killer[ply][1] != 0 && IsolationMove.slideKey(ctx.killer[ply][1]) == key);
    }

    /** Self-bounded history update: h += b - h*b/scale keeps h below scale. */
    private static int boundedUpdate(int h, int b) {
        final int scale = 8192;
        final int damp = (int) (((long) Math.abs(h) * (long) b) / (long) scale);
        return h + b - damp;
    }
}
