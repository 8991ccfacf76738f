package max.games.engine.hex;

import max.games.engine.common.InvalidBoardException;
import max.games.engine.common.Player;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

import static max.games.engine.hex.HexGeometry.CELLS;
import static max.games.engine.hex.HexGeometry.SIZE;

/**
 * Hex board state: cell ownership, the list of empty cells and one Union-Find per player.
 * <p>
 * The human connects the left and right edges, the AI connects top and bottom. Each Union-Find carries two
 * virtual terminals at indices {@code CELLS} and {@code CELLS + 1}. Search code clones the board with
 * {@link #copy()} before every branch and never undoes moves.
 */
public final class HexBoard {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final int EDGE_A = CELLS;
    public static final int EDGE_B = CELLS + 1;

    private final byte[] cells;
    // emptyCells[0..emptyCount) holds the free cells in no particular order; emptyPos is its inverse
    private final int[] emptyCells;
    private final int[] emptyPos;
    private int emptyCount;

    private final UnionFind humanSets;
    private final UnionFind aiSets;
    private int lastMove = -1;

    public HexBoard() {
        cells = new byte[CELLS];
        emptyCells = new int[CELLS];
        emptyPos = new int[CELLS];
        for (int i = 0; i < CELLS; i++) {
            emptyCells[i] = i;
            emptyPos[i] = i;
        }
        emptyCount = CELLS;
        humanSets = new UnionFind(CELLS + 2);
        aiSets = new UnionFind(CELLS + 2);
    }

    private HexBoard(HexBoard other) {
        cells = Arrays.copyOf(other.cells, CELLS);
        emptyCells = Arrays.copyOf(other.emptyCells, CELLS);
        emptyPos = Arrays.copyOf(other.emptyPos, CELLS);
        emptyCount = other.emptyCount;
        humanSets = other.humanSets.copy();
        aiSets = other.aiSets.copy();
        lastMove = other.lastMove;
    }

    /**
     * Builds a board from a flat array of {@code 0=empty, 1=human, 2=AI}. Any other value reads as empty.
     *
     * @throws InvalidBoardException if the array does not hold exactly 121 cells
     */
    public static HexBoard fromArray(int[] flat) {
        InvalidBoardException.requireLength(flat, CELLS, "Hex");
        HexBoard board = new HexBoard();
        for (int i = 0; i < CELLS; i++) {
            if (flat[i] == Player.HUMAN.code()) {
                board.play(i, Player.HUMAN);
            } else if (flat[i] == Player.AI.code()) {
                board.play(i, Player.AI);
            } else if (flat[i] != Player.NONE.code()) {
                LOGGER.warn("Unknown hex cell value {} at index {}, treated as empty", flat[i], i);
            }
        }
        board.lastMove = -1;
        return board;
    }

    public HexBoard copy() {
        return new HexBoard(this);
    }

    public void play(int row, int col, Player player) {
        if (!HexGeometry.isOnBoard(row, col)) {
            throw new InvalidBoardException("Cell (" + row + "," + col + ") is outside the " + SIZE + "x" + SIZE + " board");
        }
        play(HexGeometry.index(row, col), player);
    }

    public void play(int idx, Player player) {
        if (player == Player.NONE) throw new IllegalArgumentException("A move needs a player");
        if (cells[idx] != 0) {
            throw new IllegalStateException("Cell " + idx + " is already taken by " + Player.fromCode(cells[idx]));
        }
        cells[idx] = (byte) player.code();
        removeEmpty(idx);
        lastMove = idx;

        UnionFind sets = setsOf(player);
        for (int n : HexGeometry.neighbors(idx)) {
            if (cells[n] == cells[idx]) sets.union(idx, n);
        }
        int r = HexGeometry.row(idx), c = HexGeometry.col(idx);
        if (player == Player.HUMAN) {
            if (c == 0) sets.union(idx, EDGE_A);
            if (c == SIZE - 1) sets.union(idx, EDGE_B);
        } else {
            if (r == 0) sets.union(idx, EDGE_A);
            if (r == SIZE - 1) sets.union(idx, EDGE_B);
        }
    }

    private void removeEmpty(int idx) {
        int p = emptyPos[idx];
        int last = emptyCells[--emptyCount];
        emptyCells[p] = last;
        emptyPos[last] = p;
        emptyPos[idx] = -1;
    }

    public boolean hasWon(Player player) {
        return setsOf(player).connected(EDGE_A, EDGE_B);
    }

    public Player winner() {
        if (hasWon(Player.HUMAN)) return Player.HUMAN;
        if (hasWon(Player.AI)) return Player.AI;
        return Player.NONE;
    }

    public boolean isLegal(int row, int col) {
        return HexGeometry.isOnBoard(row, col) && cells[HexGeometry.index(row, col)] == 0;
    }

    public Player cell(int idx) {
        return Player.fromCode(cells[idx]);
    }

    /** Number of neighbors of {@code idx} owned by {@code player}. */
    public int neighborsOwnedBy(int idx, Player player) {
        int count = 0;
        for (int n : HexGeometry.neighbors(idx)) {
            if (cells[n] == player.code()) count++;
        }
        return count;
    }

    public int emptyCount() {
        return emptyCount;
    }

    public int emptyAt(int position) {
        return emptyCells[position];
    }

    /** Position of {@code idx} inside the empty list, or -1 when occupied. */
    public int emptyPosition(int idx) {
        return emptyPos[idx];
    }

    public int lastMove() {
        return lastMove;
    }

    public int[] toArray() {
        int[] out = new int[CELLS];
        for (int i = 0; i < CELLS; i++) out[i] = cells[i];
        return out;
    }

    private UnionFind setsOf(Player player) {
        return player == Player.HUMAN ? humanSets : aiSets;
    }
}
