package max.games.engine;

import max.games.engine.common.InvalidBoardException;
import max.games.engine.common.Player;
import max.games.engine.hex.HexGeometry;
import max.games.engine.hex.mcts.MctsResult;
import max.games.engine.isolation.Bitboards;
import max.games.engine.isolation.IsolationState;
import max.games.engine.isolation.search.SearchResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GameEnginesTest {

    @Test
    public void wrongBoardLengthIsRejectedUpFront() {
        assertThrows(InvalidBoardException.class, () -> GameEngines.hexBestMove(new int[49], true, 100, 7));
        assertThrows(InvalidBoardException.class, () -> GameEngines.isolationBestMove(new int[121], true, 100, 7));
    }

    @Test
    public void hexMoveOnAnEmptyBoard() {
        int[] board = new int[HexGeometry.CELLS];
        board[HexGeometry.index(5, 5)] = 1;
        MctsResult r = GameEngines.hexBestMove(board, true, 300, 3);
        assertTrue(r.hasMove());
        assertTrue(r.totalSimulations() > 0);
        assertNotEquals(HexGeometry.index(5, 5), HexGeometry.index(r.best().row(), r.best().col()));
    }

    @Test
    public void isolationMoveFromTheStart() {
        int[] board = IsolationState.initial().toArray();
        SearchResult r = GameEngines.isolationBestMove(board, true, 500, 5);
        assertTrue(r.hasMove());
        assertTrue(IsolationState.initial().isLegal(r.move(), Player.AI));
    }

    @Test
    public void isolationCoordinatesAreReported() {
        int[] board = new int[Bitboards.CELL_COUNT];
        board[Bitboards.index(3, 3)] = IsolationState.HUMAN_CELL;
        board[Bitboards.index(0, 0)] = IsolationState.AI_CELL;
        SearchResult r = GameEngines.isolationBestMove(board, true, 500, 3);
        assertEquals(0, r.fromRow());
        assertEquals(0, r.fromCol());
        assertTrue(r.toRow() >= 0 && r.toRow() < Bitboards.SIZE);
        assertTrue(r.destroyCol() >= 0 && r.destroyCol() < Bitboards.SIZE);
    }
}
