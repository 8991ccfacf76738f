package max.games.engine.isolation.analysis;

import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationState;

import static max.games.engine.isolation.Bitboards.bit;

/**
 * Decides whether the two pieces can still meet. Reachability runs over queen slides, which visit exactly the
 * empty cells connected by king steps.
 */
public final class PartitionDetector {

    private PartitionDetector() {
    }

    public static PartitionResult detect(IsolationState state) {
        return detect(state.position(Player.HUMAN), state.position(Player.AI), state.destroyedMask());
    }

    public static PartitionResult detect(int humanIdx, int aiIdx, long destroyed) {
        final long humanBit = bit(humanIdx);
        final long aiBit = bit(aiIdx);
        final long blocked = destroyed | humanBit | aiBit;

        long humanReach = Bitboards.floodFill(humanIdx, blocked);
        // the pieces meet when the AI stands next to the human's area (or next to the human itself)
        if ((Bitboards.kingExpand(humanReach | humanBit) & aiBit) != 0) {
            return PartitionResult.CONNECTED;
        }
        long aiReach = Bitboards.floodFill(aiIdx, blocked);
        return new PartitionResult(true, Long.bitCount(humanReach), Long.bitCount(aiReach), humanReach, aiReach);
    }

    public static boolean isPartitioned(IsolationState state) {
        return detect(state).partitioned();
    }

    /** True if destroying {@code cell} would separate two pieces that can still reach each other. */
    public static boolean wouldCausePartition(int humanIdx, int aiIdx, long destroyed, int cell) {
        return detect(humanIdx, aiIdx, destroyed | bit(cell)).partitioned();
    }
}
