package max.games.engine.isolation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.games.engine.common.InvalidBoardException;
import max.games.engine.common.Player;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static max.games.engine.isolation.Bitboards.BOARD_MASK;
import static max.games.engine.isolation.Bitboards.CELL_COUNT;
import static max.games.engine.isolation.Bitboards.bit;

/**
 * Immutable isolation position: one single-bit mask per piece plus the mask of destroyed cells. The three masks
 * are pairwise disjoint. Every move produces a new instance, so sibling branches never share mutable state.
 */
public final class IsolationState {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final int EMPTY = 0;
    public static final int HUMAN_CELL = 1;
    public static final int AI_CELL = 2;
    public static final int DESTROYED_CELL = 3;

    public static final int DEFAULT_HUMAN_CELL = Bitboards.index(0, 0);
    public static final int DEFAULT_AI_CELL = Bitboards.index(6, 6);

    private final long human;
    private final long ai;
    private final long destroyed;

    public IsolationState(long human, long ai, long destroyed) {
        if (Long.bitCount(human) != 1 || Long.bitCount(ai) != 1) {
            throw new IllegalStateException("Each piece mask needs exactly one bit");
        }
        if ((human & ai) != 0 || ((human | ai) & destroyed) != 0 || ((human | ai | destroyed) & ~BOARD_MASK) != 0) {
            throw new IllegalStateException("Piece and destroyed masks must be disjoint and on the board");
        }
        this.human = human;
        this.ai = ai;
        this.destroyed = destroyed;
    }

    public static IsolationState initial() {
        return new IsolationState(bit(DEFAULT_HUMAN_CELL), bit(DEFAULT_AI_CELL), 0L);
    }

    /**
     * @param destroyedCells flattened (row, col) pairs
     */
    public static IsolationState of(int humanRow, int humanCol, int aiRow, int aiCol, int... destroyedCells) {
        if (destroyedCells.length % 2 != 0) {
            throw new InvalidBoardException("Destroyed cells must be given as (row, col) pairs");
        }
        long d = 0L;
        for (int i = 0; i < destroyedCells.length; i += 2) {
            d |= bit(checkedIndex(destroyedCells[i], destroyedCells[i + 1]));
        }
        return new IsolationState(bit(checkedIndex(humanRow, humanCol)), bit(checkedIndex(aiRow, aiCol)), d);
    }

    /**
     * Reads a flat 49-cell array ({@code 0=empty, 1=human, 2=AI, 3=destroyed}). A missing piece is put back on
     * its default cell (or the first free cell) rather than rejected; duplicates keep the first occurrence.
     *
     * Unknown cell values read as empty.
     *
     * @throws InvalidBoardException on a wrong length
     */
    public static IsolationState fromArray(int[] flat) {
        InvalidBoardException.requireLength(flat, CELL_COUNT, "Isolation");
        long h = 0L, a = 0L, d = 0L;
        for (int i = 0; i < CELL_COUNT; i++) {
            switch (flat[i]) {
                case EMPTY -> { }
                case HUMAN_CELL -> {
                    if (h == 0L) h = bit(i);
                    else LOGGER.warn("Extra human piece at cell {} ignored", i);
                }
                case AI_CELL -> {
                    if (a == 0L) a = bit(i);
                    else LOGGER.warn("Extra AI piece at cell {} ignored", i);
                }
                case DESTROYED_CELL -> d |= bit(i);
                default -> LOGGER.warn("Unknown isolation cell value {} at index {}, treated as empty", flat[i], i);
            }
        }
        if (h == 0L) {
            h = bit(defaultCell(DEFAULT_HUMAN_CELL, a | d));
            LOGGER.warn("No human piece on the board, assuming cell {}", Bitboards.indexOf(h));
        }
        if (a == 0L) {
            a = bit(defaultCell(DEFAULT_AI_CELL, h | d));
            LOGGER.warn("No AI piece on the board, assuming cell {}", Bitboards.indexOf(a));
        }
        return new IsolationState(h, a, d);
    }

    private static int defaultCell(int preferred, long taken) {
        if ((taken & bit(preferred)) == 0) return preferred;
        long free = ~taken & BOARD_MASK;
        if (free == 0L) throw new InvalidBoardException("No free cell left to place a missing piece");
        return Long.numberOfTrailingZeros(free);
    }

    private static int checkedIndex(int row, int col) {
        if (!Bitboards.isOnBoard(row, col)) {
            throw new InvalidBoardException("Cell (" + row + "," + col + ") is outside the 7x7 board");
        }
        return Bitboards.index(row, col);
    }

    public long humanMask() { return human; }
    public long aiMask() { return ai; }
    public long destroyedMask() { return destroyed; }

    public long pieceMask(Player side) {
        return side == Player.AI ? ai : human;
    }

    public int position(Player side) {
        return Long.numberOfTrailingZeros(pieceMask(side));
    }

    public long blocked() {
        return human | ai | destroyed;
    }

    public long emptyMask() {
        return ~blocked() & BOARD_MASK;
    }

    public int destroyedCount() {
        return Long.bitCount(destroyed);
    }

    public int freeCells() {
        return CELL_COUNT - Long.bitCount(blocked());
    }

    /** Queen destinations of {@code side}'s piece. */
    public long slides(Player side) {
        return Bitboards.queenMoves(position(side), blocked());
    }

    /** Slide destinations as cell indices, lowest index first. */
    public IntArrayList legalSlides(Player side) {
        long mask = slides(side);
        IntArrayList cells = new IntArrayList(Long.bitCount(mask));
        for (long m = mask; m != 0; m &= m - 1) cells.add(Long.numberOfTrailingZeros(m));
        return cells;
    }

    public int mobility(Player side) {
        return Long.bitCount(slides(side));
    }

    /** Position after {@code side} slides to {@code to}, before anything is destroyed. */
    public IsolationState slide(Player side, int to) {
        long target = bit(to);
        return side == Player.AI
                ? new IsolationState(human, target, destroyed)
                : new IsolationState(target, ai, destroyed);
    }

    public IsolationState destroy(int cell) {
        return new IsolationState(human, ai, destroyed | bit(cell));
    }

    /** Applies a packed move without legality checks. */
    public IsolationState apply(int move, Player side) {
        long target = bit(IsolationMove.to(move));
        long d = destroyed | bit(IsolationMove.destroy(move));
        return side == Player.AI
                ? new IsolationState(human, target, d)
                : new IsolationState(target, ai, d);
    }

    /**
     * @throws IllegalStateException if the move is not legal for {@code side}
     */
    public IsolationState applyChecked(int move, Player side) {
        if (!isLegal(move, side)) {
            throw new IllegalStateException("Illegal move " + IsolationMove.toString(move) + " for " + side);
        }
        return apply(move, side);
    }

    public boolean isLegal(int move, Player side) {
        if (move == IsolationMove.NONE || IsolationMove.from(move) != position(side)) return false;
        int to = IsolationMove.to(move);
        int destroy = IsolationMove.destroy(move);
        if (to >= CELL_COUNT || destroy >= CELL_COUNT) return false;
        if ((slides(side) & bit(to)) == 0) return false;
        return (slide(side, to).emptyMask() & bit(destroy)) != 0;
    }

    /** The opponent of {@code sideToMove} when the side to move is stuck, otherwise {@link Player#NONE}. */
    public Player winner(Player sideToMove) {
        return mobility(sideToMove) == 0 ? sideToMove.opponent() : Player.NONE;
    }

    public int[] toArray() {
        int[] out = new int[CELL_COUNT];
        for (int i = 0; i < CELL_COUNT; i++) {
            long b = bit(i);
            if ((human & b) != 0) out[i] = HUMAN_CELL;
            else if ((ai & b) != 0) out[i] = AI_CELL;
            else if ((destroyed & b) != 0) out[i] = DESTROYED_CELL;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IsolationState)) return false;
        IsolationState s = (IsolationState) o;
        return human == s.human && ai == s.ai && destroyed == s.destroyed;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(human * 31 + ai * 17 + destroyed);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < Bitboards.SIZE; r++) {
            for (int c = 0; c < Bitboards.SIZE; c++) {
                long b = bit(Bitboards.index(r, c));
                sb.append((human & b) != 0 ? 'H' : (ai & b) != 0 ? 'A' : (destroyed & b) != 0 ? '#' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
