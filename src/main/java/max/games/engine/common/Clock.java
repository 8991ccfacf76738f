package max.games.engine.common;

/**
 * Monotonic time source used by every deadline check. Tests substitute a manual clock so timeouts can be
 * simulated without real elapsed time.
 */
@FunctionalInterface
public interface Clock {
    Clock SYSTEM = System::nanoTime;

    long nanoTime();
}
