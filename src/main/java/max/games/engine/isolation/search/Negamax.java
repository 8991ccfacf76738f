package max.games.engine.isolation.search;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.search.transpositiontable.TranspositionTable;
import max.games.engine.isolation.search.transpositiontable.ZobristHashKeys;

import static max.games.engine.isolation.search.SearchConstants.ABORTED;
import static max.games.engine.isolation.search.SearchConstants.DEPTH_PENALTY;
import static max.games.engine.isolation.search.SearchConstants.LOSS_SCORE;
import static max.games.engine.isolation.search.SearchConstants.MAX_PLY;

final class Negamax {

    /**
     * Fail-soft negamax. Scores are from the point of view of {@code side}, the player to move.
     *
     * @return the score, or {@link SearchConstants#ABORTED} once the deadline has passed
     */
    static int search(IsolationState state, long key, Player side, SearchContext ctx,
                      int depth, int ply, int alpha, int beta, boolean inNullMove) {
        if (TimeControl.aborted(ctx)) return ABORTED;
        ctx.nodes++;

        final int mobility = state.mobility(side);
        if (mobility == 0) return -(LOSS_SCORE + depth * DEPTH_PENALTY);

        final int alphaOrig = alpha;
        int ttMove = 0;
        if (ctx.tt != null) {
            TranspositionTable.Hit hit = ctx.ttHit[ply];
            if (ctx.tt.probe(key, depth, hit)) {
                if (hit.flag == TranspositionTable.TT_EXACT) {
                    ctx.tt.countCutoff();
                    return hit.score;
                } else if (hit.flag == TranspositionTable.TT_LOWER) {
                    if (hit.score > alpha) alpha = hit.score;
                } else if (hit.score < beta) {
                    beta = hit.score;
                }
                if (alpha >= beta) {
                    ctx.tt.countCutoff();
                    return hit.score;
                }
            }
            // shallower entries still carry a move worth trying first
            ttMove = hit.move;
        }

        if (depth <= 0 || ply >= MAX_PLY - 1) return ctx.evaluator.evaluate(state, side);

        // Null move: only for the root side, never twice in a row, and not when either the mover or the board
        // is short on room (zugzwang is common there)
        if (ctx.cfg.useNullMove
                && !inNullMove
                && side == ctx.rootSide
                && depth >= ctx.cfg.nullMinDepth
                && mobility > ctx.cfg.nullMinMobility
                && state.freeCells() > ctx.cfg.nullMinFreeCells) {
            ctx.nullTried++;
            int r = Math.min(ctx.cfg.nullMaxReduction, depth - 1);
            int child = search(state, ZobristHashKeys.afterPass(key), side.opponent(), ctx,
                    depth - 1 - r, ply + 1, -beta, -beta + 1, true);
            if (child == ABORTED) return ABORTED;
            if (-child >= beta) {
                ctx.nullCut++;
                return beta;
            }
        }

        final int[] moves = ctx.moveBuf[ply];
        final int[] scores = ctx.scoreBuf[ply];
        final int count = MoveOrdering.generate(ctx, state, side, ply, ttMove, moves, scores);
        final boolean pvs = ctx.cfg.usePVS && depth >= ctx.cfg.pvsMinDepth;

        int bestScore = -SearchConstants.INF;
        int bestMove = 0;
        for (int i = 0; i < count; i++) {
            MoveOrdering.pickNext(moves, scores, i, count);
            final int mv = moves[i];
            final IsolationState next = state.apply(mv, side);
            final long nextKey = ZobristHashKeys.afterMove(key, side, mv);

            int child;
            if (i == 0 || !pvs) {
                child = search(next, nextKey, side.opponent(), ctx, depth - 1, ply + 1, -beta, -alpha, false);
            } else {
                child = search(next, nextKey, side.opponent(), ctx, depth - 1, ply + 1, -alpha - 1, -alpha, false);
                if (child != ABORTED && -child > alpha && -child < beta) {
                    ctx.pvsResearched++;
                    child = search(next, nextKey, side.opponent(), ctx, depth - 1, ply + 1, -beta, -alpha, false);
                }
            }
            if (child == ABORTED) return ABORTED;
            final int score = -child;

            if (score > bestScore) {
                bestScore = score;
                bestMove = mv;
            }
            if (score > alpha) alpha = score;
            if (alpha >= beta) {
                Heuristics.onBetaCutoffUpdateHeuristics(ctx, side, mv, depth, ply);
                break;
            }
        }

        if (ctx.tt != null) {
            byte flag = bestScore <= alphaOrig ? TranspositionTable.TT_UPPER
                    : bestScore >= beta ? TranspositionTable.TT_LOWER
                    : TranspositionTable.TT_EXACT;
            ctx.tt.store(key, bestMove, depth, bestScore, flag);
        }
        return bestScore;
    }
}
