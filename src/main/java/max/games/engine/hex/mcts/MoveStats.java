package max.games.engine.hex.mcts;

/** Root-child statistics reported with a search result. */
public record MoveStats(int row, int col, int visits, int wins, double winRate) {
    @Override
    public String toString() {
        return String.format("(%d,%d) visits=%d wins=%d rate=%.3f", row, col, visits, wins, winRate);
    }
}
