package max.games.engine.isolation;

/** How far a returned move can be trusted. */
public enum Confidence {
    /** Proven by exhaustive search. */
    EXACT,
    /** Best found before the deadline or by heuristic search. */
    HEURISTIC,
    /** Taken from the opening book without searching. */
    BOOK
}
