package ember.utils;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall-clock source for absolute expiry timestamps (EXAT/PXAT, snapshots).
 * Deadlines inside the keyspace are monotonic and do not go through here.
 */
public final class Time {

    /** Unix time in milliseconds. */
    @FunctionalInterface
    public interface Clock {
        long epochMillis();
    }

    public static final Clock SYSTEM = System::currentTimeMillis;

    private static final AtomicReference<Clock> clock = new AtomicReference<>(SYSTEM);

    private Time() {
    }

    public static long now() {
        return clock.get().epochMillis();
    }

    public static long nowSeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(now());
    }

    /** A clock stopped at {@code epochMillis}. */
    public static Clock fixed(long epochMillis) {
        return () -> epochMillis;
    }

    /** @return the clock that was in use before */
    public static Clock setClock(Clock newClock) {
        return clock.getAndSet(newClock);
    }

    public static void useSystemClock() {
        clock.set(SYSTEM);
    }
}
