package max.games.engine.hex.mcts;

import max.games.engine.common.Player;
import max.games.engine.hex.HexBoard;
import max.games.engine.hex.HexGeometry;

/**
 * Cheap static scores used to pick expansion candidates and, occasionally, playout moves.
 */
final class HexHeuristics {
    static final int OWN_BRIDGE_BONUS = 40;
    static final int BLOCK_BONUS = 60;
    static final int LOCALITY_BONUS = 20;
    static final int LOCALITY_RADIUS = 3;

    private HexHeuristics() {
    }

    /** Two own neighbors extend a chain, two opposing ones cut through a gap. */
    static int bridgeScore(HexBoard board, int cell, Player mover) {
        int score = 0;
        if (board.neighborsOwnedBy(cell, mover) >= 2) score += OWN_BRIDGE_BONUS;
        if (board.neighborsOwnedBy(cell, mover.opponent()) >= 2) score += BLOCK_BONUS;
        return score;
    }

    static int expansionScore(HexBoard board, int cell, Player mover) {
        int score = -2 * HexGeometry.centerDistance(cell);
        score += bridgeScore(board, cell, mover);
        int last = board.lastMove();
        if (last >= 0 && HexGeometry.manhattan(cell, last) <= LOCALITY_RADIUS) score += LOCALITY_BONUS;
        return score;
    }

    /** Maps an expansion score onto a win-rate prior in [0.05, 0.95]. */
    static double prior(int expansionScore) {
        double p = 0.5 + expansionScore / 200.0;
        return Math.max(0.05, Math.min(0.95, p));
    }
}
