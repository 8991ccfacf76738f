package max.games.engine.isolation.search.evaluator;

import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.analysis.CriticalCellCache;
import max.games.engine.isolation.analysis.PartitionDetector;
import max.games.engine.isolation.analysis.PartitionResult;
import max.games.engine.isolation.analysis.Voronoi;
import max.games.engine.isolation.analysis.VoronoiResult;

import static max.games.engine.isolation.Bitboards.bit;

/**
 * Static evaluation of an isolation position as a weighted sum of components computed from the AI side,
 * negated when asked from the human side.
 */
public final class PositionEvaluator {
    /** Returned for masks that do not hold a piece. */
    public static final int NEUTRAL_SCORE = 0;

    static final double CONTESTED_SHARE = 0.4;
    static final int PARTITION_REGION_FACTOR = 3;
    static final double THREAT_FACTOR = 0.5;
    static final int MAX_THREAT_CELLS = 3;
    static final double OPENNESS_FACTOR = 0.3;

    private final EvalWeights[] phaseWeights = new EvalWeights[GamePhase.values().length];
    private final CriticalCellCache criticalCells;

    public PositionEvaluator(EvalWeights base, CriticalCellCache criticalCells) {
        for (GamePhase p : GamePhase.values()) phaseWeights[p.ordinal()] = p.scale(base);
        this.criticalCells = criticalCells;
    }

    public EvalWeights weightsFor(GamePhase phase) {
        return phaseWeights[phase.ordinal()];
    }

    public int evaluate(IsolationState state, Player perspective) {
        return evaluate(state.humanMask(), state.aiMask(), state.destroyedMask(), perspective);
    }

    /**
     * @param perspective the side the score is reported for; it is also taken as the side to move
     */
    public int evaluate(long human, long ai, long destroyed, Player perspective) {
        if (Long.bitCount(human) != 1 || Long.bitCount(ai) != 1) return NEUTRAL_SCORE;

        EvalComponents c = components(human, ai, destroyed, perspective);
        EvalWeights w = weightsFor(GamePhase.of(Long.bitCount(destroyed)));
        if (c.desperate()) w = w.desperate();
        int aiScore = (int) w.dot(c);
        return perspective == Player.AI ? aiScore : -aiScore;
    }

    public EvalComponents components(IsolationState state, Player toMove) {
        return components(state.humanMask(), state.aiMask(), state.destroyedMask(), toMove);
    }

    EvalComponents components(long human, long ai, long destroyed, Player toMove) {
        final int humanIdx = Long.numberOfTrailingZeros(human);
        final int aiIdx = Long.numberOfTrailingZeros(ai);
        final long blocked = human | ai | destroyed;
        final GamePhase phase = GamePhase.of(Long.bitCount(destroyed));

        final long humanMoves = Bitboards.queenMoves(humanIdx, blocked);
        final long aiMoves = Bitboards.queenMoves(aiIdx, blocked);
        final int humanMob = Long.bitCount(humanMoves);
        final int aiMob = Long.bitCount(aiMoves);

        PartitionResult partition = PartitionDetector.detect(humanIdx, aiIdx, destroyed);

        double territory;
        double partitionScore = 0.0;
        double parity = 0.0;
        long aiTerritory, humanTerritory;
        if (partition.partitioned()) {
            territory = partition.aiAdvantage();
            partitionScore = partition.aiAdvantage() * PARTITION_REGION_FACTOR;
            parity = parity(partition, toMove);
            aiTerritory = partition.aiRegion();
            humanTerritory = partition.humanRegion();
        } else {
            VoronoiResult v = Voronoi.calculate(humanIdx, aiIdx, destroyed);
            territory = v.aiCount() - v.humanCount() + v.contestedCount() * CONTESTED_SHARE;
            aiTerritory = v.aiCells();
            humanTerritory = v.humanCells();
        }

        double critical = 0.0;
        if (!partition.partitioned()) {
            long cells = criticalCells.criticalCells(humanIdx, aiIdx, destroyed);
            int n = Long.bitCount(cells);
            if (n > 0 && n <= MAX_THREAT_CELLS) partitionScore = partitionThreat(humanIdx, aiIdx, destroyed, cells);
            critical = (Long.bitCount(cells & aiTerritory) - Long.bitCount(cells & humanTerritory)) * 2;
        }

        double mobilityPotential = potential(aiMoves, blocked) - potential(humanMoves, blocked);
        double center = Bitboards.CENTER_DISTANCE[humanIdx] - Bitboards.CENTER_DISTANCE[aiIdx];
        double corner = Bitboards.CORNER_PROXIMITY[aiIdx] - Bitboards.CORNER_PROXIMITY[humanIdx];
        double openness = (openness(aiIdx, blocked) - openness(humanIdx, blocked)) * OPENNESS_FACTOR;
        double trap = (humanMob == 1 ? 1 : 0) - (aiMob == 1 ? 1 : 0);
        double effective = phase.isEndgame()
                ? effectiveMobility(aiIdx, aiMoves, blocked) - effectiveMobility(humanIdx, humanMoves, blocked)
                : 0.0;

        return new EvalComponents(territory, aiMob - humanMob, mobilityPotential, center, corner,
                partitionScore, critical, openness, parity, trap, effective, humanMob, aiMob,
                partition.partitioned());
    }

    /**
     * Once split, the bigger region wins. With equal regions the side to move runs out of cells first.
     */
    static double parity(PartitionResult p, Player toMove) {
        if (p.aiRegionSize() > p.humanRegionSize()) return 1.0;
        if (p.aiRegionSize() < p.humanRegionSize()) return -1.0;
        return toMove == Player.AI ? -1.0 : 1.0;
    }

    private static double partitionThreat(int humanIdx, int aiIdx, long destroyed, long cells) {
        double best = -1000.0;
        for (long m = cells; m != 0; m &= m - 1) {
            int idx = Long.numberOfTrailingZeros(m);
            PartitionResult r = PartitionDetector.detect(humanIdx, aiIdx, destroyed | bit(idx));
            if (r.partitioned()) best = Math.max(best, r.aiAdvantage());
        }
        return best * THREAT_FACTOR;
    }

    /** First-move cells plus half of the cells only reachable with a second slide. */
    static double potential(long firstMoves, long blocked) {
        long secondMoves = 0L;
        // the piece stays counted as blocked, so the way back is not a second-move cell
        for (long m = firstMoves; m != 0; m &= m - 1) {
            secondMoves |= Bitboards.queenMoves(Long.numberOfTrailingZeros(m), blocked);
        }
        secondMoves &= ~firstMoves;
        return Long.bitCount(firstMoves) + Long.bitCount(secondMoves) * 0.5;
    }

    static int openness(int from, long blocked) {
        int open = 0;
        int r0 = Bitboards.row(from), c0 = Bitboards.col(from);
        for (int d = 0; d < 8; d++) {
            int r = r0 + Bitboards.DR[d], c = c0 + Bitboards.DC[d];
            while (Bitboards.isOnBoard(r, c) && (blocked & bit(Bitboards.index(r, c))) == 0) {
                open++;
                r += Bitboards.DR[d];
                c += Bitboards.DC[d];
            }
        }
        return open;
    }

    /** Moves after which the piece still has at least two follow-up slides. */
    static int effectiveMobility(int from, long moves, long blocked) {
        final long vacated = blocked & ~bit(from);
        int count = 0;
        for (long m = moves; m != 0; m &= m - 1) {
            int to = Long.numberOfTrailingZeros(m);
            if (Long.bitCount(Bitboards.queenMoves(to, vacated | bit(to))) >= 2) count++;
        }
        return count;
    }
}
