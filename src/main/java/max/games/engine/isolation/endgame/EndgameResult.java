package max.games.engine.isolation.endgame;

import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationMove;

/**
 * @param move        packed move, {@link IsolationMove#NONE} when the region offered no slide
 * @param longestPath number of turns the mover can still play inside its region along the chosen line
 */
public record EndgameResult(int move, int longestPath, Confidence confidence) {
    public boolean solved() {
        return confidence == Confidence.EXACT && move != IsolationMove.NONE;
    }
}
