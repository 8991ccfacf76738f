package max.games.engine.common;

/**
 * Raised when a caller hands over a board that cannot be interpreted (wrong length, unknown cell value,
 * coordinates outside the grid).
 */
public class InvalidBoardException extends IllegalArgumentException {
    public InvalidBoardException(String message) {
        super(message);
    }

    public static void requireLength(int[] board, int expected, String game) {
        if (board == null) {
            throw new InvalidBoardException(game + " board must not be null");
        }
        if (board.length != expected) {
            throw new InvalidBoardException(game + " board must have " + expected
                    + " cells but had " + board.length);
        }
    }
}
