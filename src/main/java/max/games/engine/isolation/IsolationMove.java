package max.games.engine.isolation;

/**
 * A full turn packed into an int: [5..0] from, [11..6] to, [17..12] destroyed cell. {@link #NONE} (0) is
 * never a legal move because a slide cannot end where it started.
 */
public final class IsolationMove {
    public static final int NONE = 0;

    private IsolationMove() {
    }

    public static int of(int from, int to, int destroy) {
        return (from & 63) | ((to & 63) << 6) | ((destroy & 63) << 12);
    }

    public static int from(int move) { return move & 63; }
    public static int to(int move) { return (move >>> 6) & 63; }
    public static int destroy(int move) { return (move >>> 12) & 63; }

    /** Slide part only, used as a key for killer and history tables. */
    public static int slideKey(int move) { return move & 0xFFF; }

    public static String toString(int move) {
        if (move == NONE) return "none";
        return cell(from(move)) + "->" + cell(to(move)) + " x" + cell(destroy(move));
    }

    private static String cell(int idx) {
        return "(" + Bitboards.row(idx) + "," + Bitboards.col(idx) + ")";
    }
}
