package minikv.utils;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall-clock source for expiry checks, in epoch milliseconds.
 * Not monotonic: a system clock step moves every deadline with it.
 */
public class Time {
    public interface Clock {
        long currentTimeMillis();
    }

    private static final Clock SYSTEM_CLOCK = System::currentTimeMillis;
    private static final AtomicReference<Clock> clock = new AtomicReference<>(SYSTEM_CLOCK);

    public static long now() {
        return clock.get().currentTimeMillis();
    }

    /** Absolute deadline {@code ttlMillis} from now, saturating at {@link Long#MAX_VALUE}. */
    public static long deadlineAfter(long ttlMillis) {
        long now = now();
        if (ttlMillis > Long.MAX_VALUE - now) return Long.MAX_VALUE;
        return now + ttlMillis;
    }

    public static void setClock(Clock newClock) {
        clock.set(newClock);
    }

    public static void useSystemClock() {
        clock.set(SYSTEM_CLOCK);
    }
}
