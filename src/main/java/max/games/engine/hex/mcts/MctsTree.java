package max.games.engine.hex.mcts;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.games.engine.common.Player;

import java.util.Arrays;

/**
 * Arena holding every node of one search. Nodes are addressed by index into parallel arrays; index 0 is the
 * root. Untried-move and child lists are allocated on first use so leaves stay cheap.
 */
final class MctsTree {
    static final int ROOT = 0;
    static final int NO_PARENT = -1;

    private int size;
    private int[] move;
    private int[] parent;
    private byte[] mover;
    private boolean[] terminal;
    private int[] visits;
    private int[] wins;
    private double[] raveVisits;
    private double[] raveWins;
    private IntArrayList[] children;
    private IntArrayList[] untried;

    MctsTree(int initialCapacity) {
        int cap = Math.max(16, initialCapacity);
        move = new int[cap];
        parent = new int[cap];
        mover = new byte[cap];
        terminal = new boolean[cap];
        visits = new int[cap];
        wins = new int[cap];
        raveVisits = new double[cap];
        raveWins = new double[cap];
        children = new IntArrayList[cap];
        untried = new IntArrayList[cap];
    }

    /** Creates the root. {@code mover} is the side that produced the root position, i.e. the opponent of the side to move. */
    int addRoot(Player mover) {
        if (size != 0) throw new IllegalStateException("Root already allocated");
        return addNode(-1, NO_PARENT, mover, false);
    }

    int addChild(int parentIdx, int cell, Player mover, boolean isTerminal) {
        int idx = addNode(cell, parentIdx, mover, isTerminal);
        if (children[parentIdx] == null) children[parentIdx] = new IntArrayList(8);
        children[parentIdx].add(idx);
        return idx;
    }

    private int addNode(int cell, int parentIdx, Player who, boolean isTerminal) {
        if (size == move.length) grow();
        int idx = size++;
        move[idx] = cell;
        parent[idx] = parentIdx;
        mover[idx] = (byte) who.code();
        terminal[idx] = isTerminal;
        return idx;
    }

    private void grow() {
        int cap = move.length << 1;
        move = Arrays.copyOf(move, cap);
        parent = Arrays.copyOf(parent, cap);
        mover = Arrays.copyOf(mover, cap);
        terminal = Arrays.copyOf(terminal, cap);
        visits = Arrays.copyOf(visits, cap);
        wins = Arrays.copyOf(wins, cap);
        raveVisits = Arrays.copyOf(raveVisits, cap);
        raveWins = Arrays.copyOf(raveWins, cap);
        children = Arrays.copyOf(children, cap);
        untried = Arrays.copyOf(untried, cap);
    }

    int size() { return size; }
    int move(int n) { return move[n]; }
    int parent(int n) { return parent[n]; }
    Player mover(int n) { return Player.fromCode(mover[n]); }
    boolean isTerminal(int n) { return terminal[n]; }
    int visits(int n) { return visits[n]; }
    int wins(int n) { return wins[n]; }
    double raveVisits(int n) { return raveVisits[n]; }
    double raveWins(int n) { return raveWins[n]; }

    boolean hasChildren(int n) {
        return children[n] != null && !children[n].isEmpty();
    }

    IntArrayList children(int n) {
        return children[n] == null ? EMPTY : children[n];
    }

    /** Null until the node is first reached for expansion. */
    IntArrayList untried(int n) { return untried[n]; }

    void setUntried(int n, IntArrayList moves) { untried[n] = moves; }

    boolean fullyExpanded(int n) {
        return untried[n] != null && untried[n].isEmpty();
    }

    void recordVisit(int n, boolean won) {
        visits[n]++;
        if (won) wins[n]++;
    }

    void recordRave(int n, boolean won) {
        raveVisits[n] += 1.0;
        if (won) raveWins[n] += 1.0;
    }

    void seedRave(int n, double samples, double winRate) {
        raveVisits[n] = samples;
        raveWins[n] = samples * winRate;
    }

    private static final IntArrayList EMPTY = new IntArrayList(0);
}
