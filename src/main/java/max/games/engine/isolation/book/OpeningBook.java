package max.games.engine.isolation.book;

import max.games.engine.common.Player;
import max.games.engine.isolation.IsolationState;

import java.util.OptionalInt;

public interface OpeningBook {
    /** Returns a packed legal move for {@code side}, or empty if the position is out of policy. */
    OptionalInt pickMove(IsolationState state, Player side, BookPolicy policy);
}
