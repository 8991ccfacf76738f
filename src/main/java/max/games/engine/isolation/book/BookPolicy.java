package max.games.engine.isolation.book;

public record BookPolicy(
        boolean enabled,
        int maxDestroyed    // book is consulted while fewer cells than this are destroyed
) {
    public static BookPolicy defaults() { return new BookPolicy(true, 8); }

    public static BookPolicy disabled() { return new BookPolicy(false, 0); }

    public boolean applies(int destroyedCount) {
        return enabled && destroyedCount < maxDestroyed;
    }
}
