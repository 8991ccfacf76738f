package max.games.engine;

import max.games.engine.common.Clock;
import max.games.engine.common.Difficulty;
import max.games.engine.common.EngineProperties;
import max.games.engine.common.Player;
import max.games.engine.hex.HexBoard;
import max.games.engine.hex.mcts.MctsConfig;
import max.games.engine.hex.mcts.MctsEngine;
import max.games.engine.hex.mcts.MctsResult;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.search.SearchConfig;
import max.games.engine.isolation.search.SearchFacade;
import max.games.engine.isolation.search.SearchResult;

/**
 * Entry points taking the flat board arrays used by callers. Boards are validated before any search starts;
 * every call builds a fresh engine, nothing is kept between moves.
 */
public final class GameEngines {

    private GameEngines() {}

    /**
     * @param board      121 cells, row-major, {@code 0=empty, 1=human, 2=AI}
     * @param difficulty 3, 5 or 7; anything else plays at full strength
     */
    public static MctsResult hexBestMove(int[] board, boolean aiToMove, long budgetMs, int difficulty) {
        HexBoard hex = HexBoard.fromArray(board);
        MctsConfig cfg = MctsConfig.forDifficulty(Difficulty.fromCode(difficulty));
        return new MctsEngine(cfg, Clock.SYSTEM, EngineProperties.newRandom())
                .search(hex, Player.toMove(aiToMove), budgetMs);
    }

    /**
     * @param board    49 cells, row-major, {@code 0=empty, 1=human, 2=AI, 3=destroyed}
     * @param budgetMs time allowance; negative selects the difficulty's default budget
     */
    public static SearchResult isolationBestMove(int[] board, boolean aiToMove, long budgetMs, int difficulty) {
        IsolationState state = IsolationState.fromArray(board);
        SearchConfig cfg = SearchConfig.forDifficulty(Difficulty.fromCode(difficulty));
        SearchFacade facade = new SearchFacade(cfg, Clock.SYSTEM);
        Player side = Player.toMove(aiToMove);
        return budgetMs < 0 ? facade.findBestMove(state, side) : facade.findBestMove(state, side, budgetMs);
    }
}
