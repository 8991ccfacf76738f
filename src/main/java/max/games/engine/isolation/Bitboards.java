package max.games.engine.isolation;

/**
 * 49-bit board masks for the 7x7 isolation board. Bit {@code r * 7 + c} stands for cell (r, c).
 */
public final class Bitboards {
    public static final int SIZE = 7;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final long BOARD_MASK = (1L << CELL_COUNT) - 1;

    public static final long COL_0;
    public static final long COL_6;
    public static final long NOT_COL_0;
    public static final long NOT_COL_6;

    /** Row/column steps of the eight queen directions. */
    public static final int[] DR = {-1, -1, -1, 0, 0, 1, 1, 1};
    public static final int[] DC = {-1, 0, 1, -1, 1, -1, 0, 1};

    /** Manhattan distance to the center cell (3,3). */
    public static final int[] CENTER_DISTANCE = new int[CELL_COUNT];
    /** Manhattan distance to the nearest corner. */
    public static final int[] CORNER_PROXIMITY = new int[CELL_COUNT];

    private static final long[] KING_STEPS = new long[CELL_COUNT];

    static {
        long c0 = 0L, c6 = 0L;
        for (int r = 0; r < SIZE; r++) {
            c0 |= bit(index(r, 0));
            c6 |= bit(index(r, SIZE - 1));
        }
        COL_0 = c0;
        COL_6 = c6;
        NOT_COL_0 = BOARD_MASK & ~c0;
        NOT_COL_6 = BOARD_MASK & ~c6;

        int center = SIZE / 2;
        for (int idx = 0; idx < CELL_COUNT; idx++) {
            int r = row(idx), c = col(idx);
            CENTER_DISTANCE[idx] = Math.abs(r - center) + Math.abs(c - center);
            int toCorner = Math.min(r, SIZE - 1 - r) + Math.min(c, SIZE - 1 - c);
            CORNER_PROXIMITY[idx] = toCorner;

            long steps = 0L;
            for (int d = 0; d < 8; d++) {
                int nr = r + DR[d], nc = c + DC[d];
                if (isOnBoard(nr, nc)) steps |= bit(index(nr, nc));
            }
            KING_STEPS[idx] = steps;
        }
    }

    private Bitboards() {
    }

    public static int index(int row, int col) { return row * SIZE + col; }
    public static int row(int index) { return index / SIZE; }
    public static int col(int index) { return index % SIZE; }
    public static long bit(int index) { return 1L << index; }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** Index of the single set bit, or -1 for an empty mask. */
    public static int indexOf(long singleBit) {
        return singleBit == 0L ? -1 : Long.numberOfTrailingZeros(singleBit);
    }

    public static int chebyshev(int a, int b) {
        return Math.max(Math.abs(row(a) - row(b)), Math.abs(col(a) - col(b)));
    }

    public static int manhattan(int a, int b) {
        return Math.abs(row(a) - row(b)) + Math.abs(col(a) - col(b));
    }

    public static boolean isCorner(int idx) {
        return CORNER_PROXIMITY[idx] == 0;
    }

    public static boolean isEdge(int idx) {
        int r = row(idx), c = col(idx);
        return r == 0 || c == 0 || r == SIZE - 1 || c == SIZE - 1;
    }

    /** Cells one king step away from {@code idx}. */
    public static long kingSteps(int idx) {
        return KING_STEPS[idx];
    }

    /**
     * Queen destinations from {@code from}, scanning each of the eight rays until the first blocked cell.
     */
    public static long queenMovesRay(int from, long blocked) {
        long moves = 0L;
        int r0 = row(from), c0 = col(from);
        for (int d = 0; d < 8; d++) {
            int r = r0 + DR[d], c = c0 + DC[d];
            while (isOnBoard(r, c)) {
                long b = bit(index(r, c));
                if ((blocked & b) != 0) break;
                moves |= b;
                r += DR[d];
                c += DC[d];
            }
        }
        return moves;
    }

    /** Same set as {@link #queenMovesRay(int, long)}, computed with shifts. */
    public static long queenMoves(int from, long blocked) {
        return queenExpand(bit(from), ~blocked & BOARD_MASK);
    }

    /**
     * Bit-parallel queen expansion: every empty cell reachable in one queen slide from any source.
     * Column masks stop horizontal and diagonal shifts from wrapping onto the next row.
     */
    public static long queenExpand(long sources, long empty) {
        empty &= BOARD_MASK;
        long result = 0L;
        long s;

        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s << 7) & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s >>> 7) & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s << 1) & NOT_COL_0 & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s >>> 1) & NOT_COL_6 & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s << 8) & NOT_COL_0 & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s << 6) & NOT_COL_6 & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s >>> 6) & NOT_COL_0 & empty; result |= s; }
        s = sources; for (int i = 0; i < SIZE - 1 && s != 0; i++) { s = (s >>> 8) & NOT_COL_6 & empty; result |= s; }

        return result;
    }

    /** One king step from every source, wrap-safe. */
    public static long kingExpand(long sources) {
        long horizontal = ((sources << 1) & NOT_COL_0) | ((sources >>> 1) & NOT_COL_6) | sources;
        return ((horizontal << 7) | (horizontal >>> 7) | horizontal) & BOARD_MASK & ~sources;
    }

    /**
     * Every cell reachable from {@code from} by any sequence of queen slides over cells not in {@code blocked}.
     * The start cell itself is excluded.
     */
    public static long floodFill(int from, long blocked) {
        final long empty = ~blocked & BOARD_MASK;
        final long start = bit(from);
        long reached = 0L;
        long frontier = start;
        // a slide only passes through empty cells, so growing one king step at a time reaches the same set
        for (int i = 0; i < CELL_COUNT + 1 && frontier != 0; i++) {
            long next = kingExpand(frontier) & empty & ~reached & ~start;
            reached |= next;
            frontier = next;
        }
        return reached;
    }

    public static String toString(long mask) {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) sb.append((mask & bit(index(r, c))) != 0 ? 'x' : '.');
            sb.append('\n');
        }
        return sb.toString();
    }
}
