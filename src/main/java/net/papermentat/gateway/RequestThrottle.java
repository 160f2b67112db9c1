package net.papermentat.gateway;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Single minimum-interval gate shared by every provider behind one gateway.
 *
 * <p>Callers are serialized on the instance monitor, so the "last call" timestamp has one
 * consistent view even if providers are ever queried from several threads.</p>
 */
public class RequestThrottle {

    private static final double MIN_RATE_PER_SECOND = 0.1;

    @FunctionalInterface
    interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastCallNanos;
    private boolean hasCalled;

    public RequestThrottle(double ratePerSecond) {
        this(ratePerSecond, System::nanoTime, RequestThrottle::sleepNanos);
    }

    RequestThrottle(double ratePerSecond, LongSupplier nanoClock, Sleeper sleeper) {
        double effective = Math.max(ratePerSecond, MIN_RATE_PER_SECOND);
        this.minIntervalNanos = (long) (1_000_000_000L / effective);
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least the minimum interval has passed since the previous call, then
     * records the current time as the new "last call". The timestamp is recorded before the
     * request goes out, so failed requests still count against the interval.
     *
     * @throws IllegalStateException when interrupted while waiting; the interrupt flag is restored
     */
    public synchronized void acquire() {
        if (hasCalled) {
            long waitNanos = minIntervalNanos - (nanoClock.getAsLong() - lastCallNanos);
            if (waitNanos > 0) {
                try {
                    sleeper.sleep(waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while throttling outbound request", e);
                }
            }
        }
        lastCallNanos = nanoClock.getAsLong();
        hasCalled = true;
    }

    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }

    private static void sleepNanos(long nanos) throws InterruptedException {
        Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
    }
}
