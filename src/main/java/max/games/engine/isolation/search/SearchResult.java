package max.games.engine.isolation.search;

import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.Confidence;
import max.games.engine.isolation.IsolationMove;

public record SearchResult(int move, int score, int depth, long nodes, long timeMs, long nps, Confidence confidence) {

    public static SearchResult noMove(long timeMs) {
        return new SearchResult(IsolationMove.NONE, 0, 0, 0, timeMs, 0, Confidence.HEURISTIC);
    }

    public boolean hasMove() { return move != IsolationMove.NONE; }

    public int fromRow() { return Bitboards.row(IsolationMove.from(move)); }
    public int fromCol() { return Bitboards.col(IsolationMove.from(move)); }
    public int toRow() { return Bitboards.row(IsolationMove.to(move)); }
    public int toCol() { return Bitboards.col(IsolationMove.to(move)); }
    public int destroyRow() { return Bitboards.row(IsolationMove.destroy(move)); }
    public int destroyCol() { return Bitboards.col(IsolationMove.destroy(move)); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchResult\n")
            .append("best move: ").append(hasMove() ? IsolationMove.toString(move) : "none").append("\n")
            .append("score: ").append(score).append("\n")
            .append("depth: ").append(depth).append("\n")
            .append("confidence: ").append(confidence).append("\n")
            .append("search time (ms): ").append(timeMs).append("\n")
            .append("nodes/sec: ").append(nps);
        return sb.toString();
    }
}
