package max.games.engine.isolation.search;

final class TimeControl {
    /** Polls the clock once every {@code timeCheckMask + 1} nodes; once aborted, stays aborted. */
    static boolean aborted(SearchContext ctx) {
        if (ctx.aborted) return true;
        if ((ctx.nodes & ctx.cfg.timeCheckMask) == 0 && ctx.deadline.expired()) ctx.aborted = true;
        return ctx.aborted;
    }

    /** Unconditional check, used once per root move and per iteration. */
    static boolean expired(SearchContext ctx) {
        if (!ctx.aborted && ctx.deadline.expired()) ctx.aborted = true;
        return ctx.aborted;
    }
}
