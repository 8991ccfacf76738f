package max.games.engine.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DeadlineTest {

    @Test
    public void expiresAfterTheBudget() {
        long[] now = {0};
        Clock manual = () -> now[0];
        Deadline d = Deadline.startingNow(manual, 10);
        assertFalse(d.expired());
        now[0] = 9_999_999L;
        assertFalse(d.expired());
        now[0] = 10_000_000L;
        assertTrue(d.expired());
        assertEquals(10, d.elapsedMs());
    }

    @Test
    public void fractionKeepsTheStart() {
        long[] now = {5_000_000L};
        Clock manual = () -> now[0];
        Deadline d = Deadline.startingNow(manual, 100);
        Deadline half = d.fraction(0.5);
        now[0] += 50_000_000L;
        assertTrue(half.expired());
        assertFalse(d.expired());
    }

    @Test
    public void negativeBudgetIsAlreadyOver() {
        assertTrue(Deadline.startingNow(Clock.SYSTEM, -5).expired());
    }
}
