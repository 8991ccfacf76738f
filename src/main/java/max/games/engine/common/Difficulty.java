package max.games.engine.common;

/**
 * Difficulty codes accepted by both engines. Unknown codes fall back to the strongest tier.
 */
public enum Difficulty {
    NEXUS_3(3),
    NEXUS_5(5),
    NEXUS_7(7);

    private final int code;

    Difficulty(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Difficulty fromCode(int code) {
        for (Difficulty d : values()) {
            if (d.code == code) return d;
        }
        return NEXUS_7;
    }
}
