package max.games.engine.common;

import java.util.SplittableRandom;

/**
 * System-property overrides read when presets are built.
 */
public final class EngineProperties {
    public static final String TT_ENTRIES = "engine.tt.entries";
    public static final String MCTS_RAVE = "engine.mcts.rave";
    public static final String MCTS_EXPLORATION = "engine.mcts.exploration";
    public static final String BOOK_ENABLED = "engine.book.enabled";
    public static final String SEED = "engine.seed";

    private EngineProperties() {
    }

    public static int intProperty(String name, int defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " must be an integer but was '" + raw + "'", e);
        }
    }

    public static double doubleProperty(String name, double defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " must be a number but was '" + raw + "'", e);
        }
    }

    public static boolean booleanProperty(String name, boolean defaultValue) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    /** Seeded from {@code engine.seed} when present, otherwise from system entropy. */
    public static SplittableRandom newRandom() {
        String raw = System.getProperty(SEED);
        if (raw == null || raw.isBlank()) return new SplittableRandom();
        try {
            return new SplittableRandom(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + SEED + " must be a long but was '" + raw + "'", e);
        }
    }
}
