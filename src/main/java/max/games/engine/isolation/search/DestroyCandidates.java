package max.games.engine.isolation.search;

import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationState;

import static max.games.engine.isolation.Bitboards.bit;

/**
 * Pre-scores every cell that could be destroyed after a slide and keeps the best few. Partition impact is not
 * measured per candidate; leaf evaluation accounts for it.
 */
final class DestroyCandidates {
    static final int ALREADY_WON = 20_000;
    static final int TAKES_LAST_MOVE = 10_000;
    static final int TAKES_A_MOVE = 50;
    static final int NEXT_TO_OPPONENT = 30;
    static final int NEAR_OPPONENT = 15;
    static final int NEXT_TO_SELF = -50;
    static final int CENTER_FACTOR = 2;

    /**
     * @param afterSlide position with the mover already on its new cell
     * @return number of candidates written, best first
     */
    static int select(IsolationState afterSlide, Player side, int k, int[] cells, int[] scores) {
        final int self = afterSlide.position(side);
        final int opponent = afterSlide.position(side.opponent());
        final long opponentMoves = afterSlide.slides(side.opponent());
        final int opponentMobility = Long.bitCount(opponentMoves);

        int n = 0;
        for (long m = afterSlide.emptyMask(); m != 0; m &= m - 1) {
            int idx = Long.numberOfTrailingZeros(m);
            int score = score(idx, self, opponent, opponentMoves, opponentMobility);
            n = insert(cells, scores, n, k, idx, score);
        }
        return n;
    }

    static int score(int idx, int self, int opponent, long opponentMoves, int opponentMobility) {
        int score = 0;
        if (opponentMobility == 0) score += ALREADY_WON;
        if ((opponentMoves & bit(idx)) != 0) {
            score += opponentMobility == 1 ? TAKES_LAST_MOVE : TAKES_A_MOVE;
        }
        int toOpponent = Bitboards.chebyshev(idx, opponent);
        if (toOpponent == 1) score += NEXT_TO_OPPONENT;
        else if (toOpponent == 2) score += NEAR_OPPONENT;
        if (Bitboards.chebyshev(idx, self) == 1) score += NEXT_TO_SELF;
        score += (6 - Bitboards.CENTER_DISTANCE[idx]) * CENTER_FACTOR;
        return score;
    }

    /** Keeps cells/scores sorted descending and at most {@code k} long. */
    private static int insert(int[] cells, int[] scores, int n, int k, int cell, int score) {
        if (n == k && score <= scores[n - 1]) return n;
        int i = (n < k) ? n++ : n - 1;
        while (i > 0 && scores[i - 1] < score) {
            cells[i] = cells[i - 1];
            scores[i] = scores[i - 1];
            i--;
        }
        cells[i] = cell;
        scores[i] = score;
        return n;
    }
}
