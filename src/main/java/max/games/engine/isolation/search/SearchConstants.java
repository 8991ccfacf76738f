package max.games.engine.isolation.search;

public class SearchConstants {
    public static final int INF = 1_000_000;

    // A side with no slide has lost; the remaining depth is added so quicker losses score lower
    public static final int LOSS_SCORE = 100_000;
    public static final int DEPTH_PENALTY = 100;
    // Scores beyond this are forced results, no point searching deeper
    public static final int DECISIVE_SCORE = 90_000;

    // Returned up the tree when the deadline hits mid-search
    public static final int ABORTED = Integer.MIN_VALUE;

    // Depth reported for a result proven by the endgame solver
    public static final int SOLVED_DEPTH = 255;

    public static final int MAX_PLY = 64;

    public static final int MAX_DESTROY_CANDIDATES = 12;
    // a queen on 7x7 has at most 24 slides
    public static final int MAX_MOVES = 24 * MAX_DESTROY_CANDIDATES;
}
