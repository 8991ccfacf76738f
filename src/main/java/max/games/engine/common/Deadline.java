package max.games.engine.common;

/**
 * Wall-clock budget measured against an injected {@link Clock}.
 */
public final class Deadline {
    private final Clock clock;
    private final long startNs;
    private final long budgetNs;

    private Deadline(Clock clock, long startNs, long budgetNs) {
        this.clock = clock;
        this.startNs = startNs;
        this.budgetNs = budgetNs;
    }

    public static Deadline startingNow(Clock clock, long budgetMs) {
        return new Deadline(clock, clock.nanoTime(), Math.max(0L, budgetMs) * 1_000_000L);
    }

    /** Same start, budget scaled down (e.g. 0.5 for half the remaining allowance). */
    public Deadline fraction(double share) {
        return new Deadline(clock, startNs, (long) (budgetNs * share));
    }

    public boolean expired() {
        return clock.nanoTime() - startNs >= budgetNs;
    }

    public long elapsedNs() {
        return clock.nanoTime() - startNs;
    }

    public long elapsedMs() {
        return elapsedNs() / 1_000_000L;
    }

    public long budgetNs() {
        return budgetNs;
    }
}
