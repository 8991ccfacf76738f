package max.games.engine.hex.mcts;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.games.engine.common.Clock;
import max.games.engine.common.Deadline;
import max.games.engine.common.Player;
import max.games.engine.hex.HexBoard;
import max.games.engine.hex.HexGeometry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Monte-Carlo tree search with RAVE for the hex connection game.
 * <p>
 * Every iteration walks down the tree by blended UCT/RAVE score, expands one heuristically chosen untried
 * move, finishes the game with a (mostly) random playout and backs the result up to the root. The tree is
 * rebuilt on every call.
 */
public final class MctsEngine {
    private static final Logger LOGGER = LogManager.getLogger();

    static final double UNVISITED_EXPLOIT = 0.5;
    static final double UNVISITED_EXPLORE = 1e9;
    // below this temperature final selection is treated as greedy
    static final double MIN_TEMPERATURE = 1e-3;

    private final MctsConfig cfg;
    private final Clock clock;
    private final SplittableRandom rng;

    // cells claimed during the current iteration, indexed by Player.code()
    private final boolean[][] claimed = new boolean[3][HexGeometry.CELLS];

    public MctsEngine(MctsConfig cfg, Clock clock, SplittableRandom rng) {
        this.cfg = cfg;
        this.clock = clock;
        this.rng = rng;
    }

    public MctsResult search(HexBoard rootBoard, Player toMove, long budgetMs) {
        final Deadline deadline = Deadline.startingNow(clock, budgetMs);
        if (rootBoard.winner() != Player.NONE || rootBoard.emptyCount() == 0) {
            LOGGER.warn("Hex search requested on a finished board, no move to return");
            return MctsResult.noMove(deadline.elapsedMs());
        }

        MctsTree tree = newTree(toMove);
        int simulations = 0;
        while (simulations < cfg.maxSimulations && !deadline.expired()) {
            iterate(tree, rootBoard);
            simulations++;
        }
        long elapsedMs = deadline.elapsedMs();
        MctsResult result = buildResult(tree, simulations, elapsedMs);
        LOGGER.info("Hex MCTS: {} with {} simulations in {} ms ({} nps)",
                result.best(), simulations, elapsedMs, result.nps());
        if (LOGGER.isDebugEnabled()) {
            for (MoveStats s : result.alternatives()) LOGGER.debug("  candidate {}", s);
        }
        return result;
    }

    MctsTree newTree(Player toMove) {
        MctsTree tree = new MctsTree(1 << 12);
        tree.addRoot(toMove.opponent());
        return tree;
    }

    /**
     * Runs one selection, expansion, playout and backpropagation cycle.
     *
     * @return index of the node the playout started from (the new child, or the terminal node reached)
     */
    int iterate(MctsTree tree, HexBoard rootBoard) {
        for (boolean[] c : claimed) Arrays.fill(c, false);
        HexBoard state = rootBoard.copy();

        // Selection
        int node = MctsTree.ROOT;
        while (!tree.isTerminal(node) && tree.fullyExpanded(node) && tree.hasChildren(node)) {
            node = selectChild(tree, node);
            play(state, tree.move(node), tree.mover(node));
        }

        Player winner;
        if (tree.isTerminal(node)) {
            winner = tree.mover(node);
        } else {
            // Expansion
            IntArrayList untried = tree.untried(node);
            if (untried == null) {
                untried = new IntArrayList(state.emptyCount());
                for (int i = 0; i < state.emptyCount(); i++) untried.add(state.emptyAt(i));
                tree.setUntried(node, untried);
            }
            if (!untried.isEmpty()) {
                node = expand(tree, node, state);
            }
            // Simulation
            winner = tree.isTerminal(node) ? tree.mover(node) : playout(state, tree.mover(node).opponent());
        }

        backpropagate(tree, node, winner);
        return node;
    }

    private int selectChild(MctsTree tree, int parent) {
        final double logParent = Math.log(Math.max(1, tree.visits(parent)));
        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        IntArrayList kids = tree.children(parent);
        for (int i = 0; i < kids.size(); i++) {
            int c = kids.getInt(i);
            double score = selectionScore(tree, c, logParent);
            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return best;
    }

    double selectionScore(MctsTree tree, int child, double logParentVisits) {
        int n = tree.visits(child);
        double exploit = n > 0 ? (double) tree.wins(child) / n : UNVISITED_EXPLOIT;
        double explore = n > 0 ? cfg.explorationConstant * Math.sqrt(logParentVisits / n) : UNVISITED_EXPLORE;
        double rv = tree.raveVisits(child);
        double rave = rv > 0 ? tree.raveWins(child) / rv : UNVISITED_EXPLOIT;
        double beta = rv > 0 ? cfg.raveConstant / (cfg.raveConstant + n) : 0.0;
        return (1.0 - beta) * exploit + beta * rave + explore;
    }

    private int expand(MctsTree tree, int node, HexBoard state) {
        final Player mover = tree.mover(node).opponent();
        final IntArrayList untried = tree.untried(node);

        int bestPos = -1;
        int bestScore = Integer.MIN_VALUE;
        int samples = Math.min(cfg.expansionSampleSize, untried.size());
        for (int s = 0; s < samples; s++) {
            int pos = rng.nextInt(untried.size());
            int score = HexHeuristics.expansionScore(state, untried.getInt(pos), mover);
            if (score > bestScore) {
                bestScore = score;
                bestPos = pos;
            }
        }

        int cell = untried.getInt(bestPos);
        int last = untried.size() - 1;
        untried.set(bestPos, untried.getInt(last));
        untried.removeInt(last);

        play(state, cell, mover);
        boolean won = state.hasWon(mover);
        int child = tree.addChild(node, cell, mover, won);
        if (won) tree.setUntried(child, new IntArrayList(0));
        if (cfg.priorSamples > 0) tree.seedRave(child, cfg.priorSamples, HexHeuristics.prior(bestScore));
        return child;
    }

    private Player playout(HexBoard state, Player toMove) {
        while (state.emptyCount() > 0) {
            int cell = pickPlayoutMove(state, toMove);
            play(state, cell, toMove);
            if (state.hasWon(toMove)) return toMove;
            toMove = toMove.opponent();
        }
        return state.winner();
    }

    private int pickPlayoutMove(HexBoard state, Player toMove) {
        final int empty = state.emptyCount();
        if (empty < cfg.heuristicPlayoutMaxEmpty && rng.nextDouble() < cfg.playoutHeuristicChance) {
            int bestCell = state.emptyAt(rng.nextInt(empty));
            int bestScore = HexHeuristics.bridgeScore(state, bestCell, toMove);
            for (int s = 1; s < cfg.heuristicPlayoutSamples; s++) {
                int cell = state.emptyAt(rng.nextInt(empty));
                int score = HexHeuristics.bridgeScore(state, cell, toMove);
                if (score > bestScore) {
                    bestScore = score;
                    bestCell = cell;
                }
            }
            return bestCell;
        }
        return state.emptyAt(rng.nextInt(empty));
    }

    private void play(HexBoard state, int cell, Player who) {
        state.play(cell, who);
        claimed[who.code()][cell] = true;
    }

    /**
     * Visits and wins go to every node on the path. RAVE statistics go to the children of each path node whose
     * move was claimed by their mover somewhere later in this iteration.
     */
    private void backpropagate(MctsTree tree, int node, Player winner) {
        for (int n = node; n != MctsTree.NO_PARENT; n = tree.parent(n)) {
            tree.recordVisit(n, tree.mover(n) == winner);

            IntArrayList kids = tree.children(n);
            for (int i = 0; i < kids.size(); i++) {
                int c = kids.getInt(i);
                Player who = tree.mover(c);
                if (claimed[who.code()][tree.move(c)]) tree.recordRave(c, who == winner);
            }
        }
    }

    private MctsResult buildResult(MctsTree tree, int simulations, long elapsedMs) {
        IntArrayList kids = tree.children(MctsTree.ROOT);
        if (kids.isEmpty()) return MctsResult.noMove(elapsedMs);

        int[] sorted = kids.toIntArray();
        sortByVisitsDescending(tree, sorted);

        int chosen = chooseFinal(tree, sorted);
        int limit = Math.min(cfg.candidatesReported, sorted.length);
        List<MoveStats> alternatives = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) alternatives.add(stats(tree, sorted[i]));

        long nps = simulations * 1000L / Math.max(1L, elapsedMs);
        return new MctsResult(stats(tree, chosen), alternatives, simulations, elapsedMs, nps);
    }

    private static void sortByVisitsDescending(MctsTree tree, int[] nodes) {
        // insertion sort, at most 121 root children
        for (int i = 1; i < nodes.length; i++) {
            int v = nodes[i];
            int j = i - 1;
            while (j >= 0 && tree.visits(nodes[j]) < tree.visits(v)) {
                nodes[j + 1] = nodes[j];
                j--;
            }
            nodes[j + 1] = v;
        }
    }

    /**
     * Greedy when the temperature is (close to) zero, otherwise samples the top five by {@code visits^(1/T)}.
     * Weights are computed relative to the most visited child in log space so small temperatures cannot overflow.
     */
    int chooseFinal(MctsTree tree, int[] sortedByVisits) {
        final double t = cfg.selectionTemperature;
        if (t < MIN_TEMPERATURE || sortedByVisits.length == 1) return sortedByVisits[0];

        int limit = Math.min(5, sortedByVisits.length);
        double[] weights = new double[limit];
        double logTop = Math.log(Math.max(1, tree.visits(sortedByVisits[0])));
        double sum = 0.0;
        for (int i = 0; i < limit; i++) {
            double logV = Math.log(Math.max(1, tree.visits(sortedByVisits[i])));
            weights[i] = Math.exp((logV - logTop) / t);
            sum += weights[i];
        }
        if (!(sum > 0.0) || Double.isInfinite(sum)) return sortedByVisits[0];

        double r = rng.nextDouble() * sum;
        for (int i = 0; i < limit; i++) {
            r -= weights[i];
            if (r <= 0.0) return sortedByVisits[i];
        }
        return sortedByVisits[0];
    }

    private static MoveStats stats(MctsTree tree, int node) {
        int cell = tree.move(node);
        int v = tree.visits(node);
        int w = tree.wins(node);
        return new MoveStats(HexGeometry.row(cell), HexGeometry.col(cell), v, w, v == 0 ? 0.0 : (double) w / v);
    }
}
