package max.games.engine.isolation.search;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.search.transpositiontable.TranspositionTable;
import max.games.engine.isolation.search.transpositiontable.ZobristHashKeys;

import static max.games.engine.isolation.search.SearchConstants.ABORTED;
import static max.games.engine.isolation.search.SearchConstants.INF;

final class RootSearch {

    /** Best root move at one depth. {@code complete} is false when the deadline cut the move loop short. */
    record Outcome(int move, int score, boolean complete) {}

    /**
     * @return the best move among those fully searched, or null if the deadline hit before the first one finished
     */
    static Outcome searchAtDepth(IsolationState state, long key, SearchContext ctx, int depth,
                                 int rootAlpha, int rootBeta) {
        if (TimeControl.expired(ctx)) return null;

        final Player side = ctx.rootSide;
        final int ply = 0;
        final int[] moves = ctx.moveBuf[ply];
        final int[] scores = ctx.scoreBuf[ply];
        final int ttMove = ctx.tt != null ? ctx.tt.peekMove(key) : 0;
        final int count = MoveOrdering.generate(ctx, state, side, ply, ttMove, moves, scores);
        if (count == 0) return null;

        int bestMove = 0, bestScore = -INF;
        int alpha = rootAlpha, beta = rootBeta;
        boolean complete = true;
        for (int i = 0; i < count; i++) {
            if (TimeControl.expired(ctx)) { complete = false; break; }
            MoveOrdering.pickNext(moves, scores, i, count);
            final int mv = moves[i];
            final IsolationState next = state.apply(mv, side);
            final long nextKey = ZobristHashKeys.afterMove(key, side, mv);

            int child;
            if (i == 0) {
                child = Negamax.search(next, nextKey, side.opponent(), ctx, depth - 1, 1, -beta, -alpha, false);
            } else {
                child = Negamax.search(next, nextKey, side.opponent(), ctx, depth - 1, 1, -(alpha + 1), -alpha, false);
                if (child != ABORTED && -child > alpha && -child < beta) {
                    child = Negamax.search(next, nextKey, side.opponent(), ctx, depth - 1, 1, -beta, -alpha, false);
                }
            }
            if (child == ABORTED) { complete = false; break; }

            int score = -child;
            if (score > bestScore) {
                bestScore = score;
                bestMove = mv;
            }
            if (bestScore > alpha) alpha = bestScore;
            if (alpha >= beta) break;
        }

        if (bestMove == 0) return null;
        if (complete && ctx.tt != null) {
            byte flag = bestScore <= rootAlpha ? TranspositionTable.TT_UPPER
                    : bestScore >= rootBeta ? TranspositionTable.TT_LOWER
                    : TranspositionTable.TT_EXACT;
            ctx.tt.store(key, bestMove, depth, bestScore, flag);
        }
        return new Outcome(bestMove, bestScore, complete);
    }

    /** First move in ordering, used when not even depth one could be searched. */
    static int firstOrderedMove(IsolationState state, SearchContext ctx) {
        final int[] moves = ctx.moveBuf[0];
        final int[] scores = ctx.scoreBuf[0];
        final int count = MoveOrdering.generate(ctx, state, ctx.rootSide, 0, 0, moves, scores);
        if (count == 0) return 0;
        MoveOrdering.pickNext(moves, scores, 0, count);
        return moves[0];
    }
}
