package max.games.engine.hex.mcts;

import java.util.List;

/**
 * Outcome of one MCTS call. {@code best} is null only when the root position had no move to make
 * (board full or already won).
 */
public record MctsResult(MoveStats best, List<MoveStats> alternatives, int totalSimulations,
                         long elapsedMs, long nps) {

    static MctsResult noMove(long elapsedMs) {
        return new MctsResult(null, List.of(), 0, elapsedMs, 0);
    }

    public boolean hasMove() {
        return best != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("MctsResult\n")
            .append("best move: ").append(best).append("\n")
            .append("simulations: ").append(totalSimulations).append("\n")
            .append("search time (ms): ").append(elapsedMs).append("\n")
            .append("nodes/sec: ").append(nps).append("\n")
            .append("candidates:");
        for (MoveStats s : alternatives) {
            sb.append("\n  ").append(s);
        }
        return sb.toString();
    }
}
