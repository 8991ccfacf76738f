package max.games.engine.isolation.analysis;

import max.games.engine.isolation.Bitboards;

import static max.games.engine.isolation.Bitboards.BOARD_MASK;
import static max.games.engine.isolation.Bitboards.bit;

/**
 * Simultaneous two-source BFS over queen-move distance.
 */
public final class Voronoi {
    public static final int MAX_ROUNDS = 20;

    private Voronoi() {
    }

    public static VoronoiResult calculate(int humanIdx, int aiIdx, long destroyed) {
        final long humanBit = bit(humanIdx);
        final long aiBit = bit(aiIdx);
        final long empty = ~(destroyed | humanBit | aiBit) & BOARD_MASK;

        long humanFront = humanBit, aiFront = aiBit;
        long claimed = 0L;
        long humanCells = 0L, aiCells = 0L, contested = 0L;

        for (int round = 0; round < MAX_ROUNDS && (humanFront | aiFront) != 0; round++) {
            long newHuman = Bitboards.queenExpand(humanFront, empty) & ~claimed;
            long newAi = Bitboards.queenExpand(aiFront, empty) & ~claimed;

            long both = newHuman & newAi;
            humanCells |= newHuman & ~newAi;
            aiCells |= newAi & ~newHuman;
            contested |= both;
            claimed |= newHuman | newAi;

            humanFront = newHuman;
            aiFront = newAi;
        }
        return new VoronoiResult(humanCells, aiCells, contested);
    }
}
