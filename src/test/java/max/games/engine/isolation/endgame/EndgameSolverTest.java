package max.games.engine.isolation.endgame;

import max.games.engine.common.Clock;
import max.games.engine.common.Deadline;
import max.games.engine.common.Player;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationMove;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.analysis.PartitionDetector;
import max.games.engine.isolation.analysis.PartitionResult;
import org.junit.jupiter.api.Test;

import static max.games.engine.isolation.Bitboards.bit;
import static max.games.engine.isolation.Bitboards.index;
import static org.junit.jupiter.api.Assertions.*;

public class EndgameSolverTest {

    private static IsolationState thickWall() {
        long wall = 0L;
        for (int r = 0; r < Bitboards.SIZE; r++) {
            for (int c = 0; c < Bitboards.SIZE; c++) {
                if (r + c == 6 || r + c == 7) wall |= bit(index(r, c));
            }
        }
        return new IsolationState(bit(index(0, 0)), bit(index(6, 6)), wall);
    }

    @Test
    public void straightCorridorGivesTwo() {
        int pos = index(0, 0);
        long region = bit(index(0, 1)) | bit(index(0, 2));
        assertEquals(2, new EndgameSolver().longestPath(pos, region, Deadline.startingNow(Clock.SYSTEM, 1_000)));
    }

    @Test
    public void deadEndGivesZero() {
        int pos = index(3, 3);
        assertEquals(0, new EndgameSolver().longestPath(pos, 0L, Deadline.startingNow(Clock.SYSTEM, 1_000)));
    }

    @Test
    public void solvesASmallRegionExactly() {
        IsolationState s = thickWall();
        PartitionResult p = PartitionDetector.detect(s);
        EndgameResult r = new EndgameSolver().solve(s, Player.AI, p.aiRegion(),
                Deadline.startingNow(Clock.SYSTEM, 60_000));

        assertEquals(Confidence.EXACT, r.confidence());
        assertTrue(r.solved());
        assertTrue(s.isLegal(r.move(), Player.AI), IsolationMove.toString(r.move()));
        assertTrue((p.aiRegion() & bit(IsolationMove.to(r.move()))) != 0);
        assertTrue(r.longestPath() >= 10 && r.longestPath() <= p.aiRegionSize(), "path " + r.longestPath());
    }

    @Test
    public void reportsHeuristicWhenOutOfTime() {
        // every clock read jumps one second
        long[] now = {0};
        Clock manual = () -> now[0] += 1_000_000_000L;
        IsolationState s = thickWall();
        PartitionResult p = PartitionDetector.detect(s);

        EndgameResult r = new EndgameSolver().solve(s, Player.AI, p.aiRegion(), Deadline.startingNow(manual, 100));
        assertEquals(Confidence.HEURISTIC, r.confidence());
        assertFalse(r.solved());
    }

    @Test
    public void longestPathGivesUpWhenOutOfTime() {
        long[] now = {0};
        Clock manual = () -> now[0] += 1_000_000_000L;
        int pos = index(0, 0);
        long region = bit(index(0, 1)) | bit(index(0, 2));
        assertEquals(EndgameSolver.NOT_SOLVED, new EndgameSolver().longestPath(pos, region, Deadline.startingNow(manual, 100)));
    }

    @Test
    public void estimateCoversThreeQuartersOfTheRegion() {
        assertEquals(15, EndgameSolver.estimateLongestPath(20));
    }
}
