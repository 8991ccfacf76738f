package max.games.engine.common;

/**
 * The two sides of both games. The numeric code is the value used in flat board arrays.
 */
public enum Player {
    NONE(0),
    HUMAN(1),
    AI(2);

    private final int code;

    Player(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public Player opponent() {
        switch (this) {
            case HUMAN: return AI;
            case AI: return HUMAN;
            default: return NONE;
        }
    }

    /** Decodes a stored cell or mover code; flat input arrays are read leniently by the boards instead. */
    public static Player fromCode(int code) {
        switch (code) {
            case 0: return NONE;
            case 1: return HUMAN;
            case 2: return AI;
            default: throw new IllegalArgumentException("Unknown player code " + code + ", expected 0, 1 or 2");
        }
    }

    public static Player toMove(boolean aiToMove) {
        return aiToMove ? AI : HUMAN;
    }
}
