package max.games.engine.isolation.book;

import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalInt;

import static max.games.engine.isolation.Bitboards.BOARD_MASK;
import static max.games.engine.isolation.Bitboards.bit;

/**
 * Static opening play: head for the center, stay off corners and edges, keep mobility, keep a sensible
 * distance from the opponent, then destroy the cell that hurts the opponent most.
 */
public final class HeuristicOpeningBook implements OpeningBook {
    private static final Logger LOGGER = LogManager.getLogger();

    private static final int CENTER_WEIGHT = 10;
    private static final int CENTER_BLOCK_BONUS = 20;
    private static final int MOBILITY_WEIGHT = 5;
    private static final int CORNER_PENALTY = 45;
    private static final int EDGE_PENALTY = 5;
    private static final int EARLY_TURNS = 6;

    @Override
    public OptionalInt pickMove(IsolationState state, Player side, BookPolicy policy) {
        // one cell is destroyed per turn played
        final int turn = state.destroyedCount();
        if (!policy.applies(turn)) return OptionalInt.empty();

        final int from = state.position(side);
        long slides = state.slides(side);
        if (slides == 0) return OptionalInt.empty();

        int bestTo = -1;
        int bestScore = Integer.MIN_VALUE;
        for (long m = slides; m != 0; m &= m - 1) {
            int to = Long.numberOfTrailingZeros(m);
            int score = scoreSlide(state, side, from, to, turn);
            if (score > bestScore) {
                bestScore = score;
                bestTo = to;
            }
        }

        int destroy = bestDestroy(state, side, bestTo);
        int move = IsolationMove.of(from, bestTo, destroy);
        if (state.apply(move, side).mobility(side) == 0) {
            LOGGER.debug("Book move {} would leave no follow-up, deferring to search", IsolationMove.toString(move));
            return OptionalInt.empty();
        }
        LOGGER.debug("Book move {} (score {})", IsolationMove.toString(move), bestScore);
        return OptionalInt.of(move);
    }

    static int scoreSlide(IsolationState state, Player side, int from, int to, int turn) {
        int score = -Bitboards.CENTER_DISTANCE[to] * CENTER_WEIGHT;
        if (isCenterBlock(to)) score += CENTER_BLOCK_BONUS;

        if (Bitboards.isCorner(to)) score -= CORNER_PENALTY;
        else if (Bitboards.isEdge(to)) score -= EDGE_PENALTY;

        score += Long.bitCount(Bitboards.queenMoves(to, state.blocked())) * MOBILITY_WEIGHT;

        int toOpponent = Bitboards.manhattan(to, state.position(side.opponent()));
        if (turn <= EARLY_TURNS) {
            if (toOpponent < 2) score -= 10;
            else if (toOpponent >= 3 && toOpponent <= 5) score += 5;
        } else if (toOpponent <= 4) {
            score += 3;
        }

        int r = Bitboards.row(to), c = Bitboards.col(to);
        if (Bitboards.row(from) != r && Bitboards.col(from) != c) score += 3;
        if (r == c || r + c == Bitboards.SIZE - 1) score += 5;
        return score;
    }

    static int bestDestroy(IsolationState state, Player side, int newPos) {
        final int opponent = state.position(side.opponent());
        final long occupied = state.blocked() & ~bit(state.position(side)) | bit(newPos);
        final long empty = ~occupied & BOARD_MASK;
        final long opponentMoves = Bitboards.queenMoves(opponent, occupied);
        final long ownMoves = Bitboards.queenMoves(newPos, occupied);
        final int opponentToCenter = Bitboards.CENTER_DISTANCE[opponent];

        int best = Long.numberOfTrailingZeros(empty);
        int bestScore = Integer.MIN_VALUE;
        for (long m = empty; m != 0; m &= m - 1) {
            int idx = Long.numberOfTrailingZeros(m);
            int score = 0;

            int toOpponent = Bitboards.manhattan(idx, opponent);
            if (toOpponent == 1) score += 50;
            else if (toOpponent == 2) score += 25;

            // cut the opponent off from the center
            if (Bitboards.CENTER_DISTANCE[idx] < opponentToCenter && toOpponent <= 3) score += 30;

            if ((opponentMoves & bit(idx)) != 0) score += 35;
            if ((ownMoves & bit(idx)) != 0) score -= 20;
            if (isCenterBlock(idx) && Bitboards.manhattan(idx, newPos) <= 2) score -= 15;

            if (Bitboards.isCorner(idx)) score += 5;
            else if (Bitboards.isEdge(idx)) score += 2;

            if (score > bestScore) {
                bestScore = score;
                best = idx;
            }
        }
        return best;
    }

    private static boolean isCenterBlock(int idx) {
        int r = Bitboards.row(idx), c = Bitboards.col(idx);
        return r >= 2 && r <= 4 && c >= 2 && c <= 4;
    }
}
