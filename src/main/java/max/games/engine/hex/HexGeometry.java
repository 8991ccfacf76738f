package max.games.engine.hex;

/**
 * Offset-coordinate geometry of the 11x11 hex board. Neighbor offsets depend on row parity; every cell has
 * six neighbors except along the edges.
 */
public final class HexGeometry {
    public static final int SIZE = 11;
    public static final int CELLS = SIZE * SIZE;
    public static final int CENTER = SIZE / 2;

    private static final int[][] EVEN_ROW_OFFSETS = {{-1, -1}, {-1, 0}, {0, -1}, {0, 1}, {1, -1}, {1, 0}};
    private static final int[][] ODD_ROW_OFFSETS  = {{-1, 0}, {-1, 1}, {0, -1}, {0, 1}, {1, 0}, {1, 1}};

    private static final int[][] NEIGHBORS = new int[CELLS][];
    private static final int[] CENTER_DISTANCE = new int[CELLS];

    static {
        for (int idx = 0; idx < CELLS; idx++) {
            int r = row(idx), c = col(idx);
            int[][] offsets = (r & 1) == 0 ? EVEN_ROW_OFFSETS : ODD_ROW_OFFSETS;
            int[] buf = new int[6];
            int n = 0;
            for (int[] o : offsets) {
                int nr = r + o[0], nc = c + o[1];
                if (isOnBoard(nr, nc)) buf[n++] = index(nr, nc);
            }
            NEIGHBORS[idx] = java.util.Arrays.copyOf(buf, n);
            CENTER_DISTANCE[idx] = Math.abs(r - CENTER) + Math.abs(c - CENTER);
        }
    }

    private HexGeometry() {
    }

    public static int index(int row, int col) {
        return row * SIZE + col;
    }

    public static int row(int index) {
        return index / SIZE;
    }

    public static int col(int index) {
        return index % SIZE;
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** Shared, do not modify. */
    public static int[] neighbors(int index) {
        return NEIGHBORS[index];
    }

    public static int centerDistance(int index) {
        return CENTER_DISTANCE[index];
    }

    public static int manhattan(int a, int b) {
        return Math.abs(row(a) - row(b)) + Math.abs(col(a) - col(b));
    }

    public static boolean isCorner(int index) {
        int r = row(index), c = col(index);
        return (r == 0 || r == SIZE - 1) && (c == 0 || c == SIZE - 1);
    }
}
