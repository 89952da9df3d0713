package com.valan.harvester.crawl.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Minimum spacing between outbound registry calls for one sequential worker.
 * Not meant to be shared between threads; give every worker its own instance.
 */
public class RateLimiter {
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private long lastReturnNanos;
    private boolean primed;

    public RateLimiter() {
        this(System::nanoTime, nanos -> TimeUnit.NANOSECONDS.sleep(nanos));
    }

    RateLimiter(LongSupplier nanoClock, Sleeper sleeper) {
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until {@code minInterval} has passed since the previous call returned.
     * An interrupt ends the wait early with the thread's interrupt flag set.
     */
    public synchronized void await(Duration minInterval) {
        long intervalNanos = minInterval == null ? 0 : Math.max(0, minInterval.toNanos());
        if (primed && intervalNanos > 0) {
            long elapsed = nanoClock.getAsLong() - lastReturnNanos;
            long remaining = intervalNanos - elapsed;
            if (remaining > 0) {
                try {
                    sleeper.sleep(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        lastReturnNanos = nanoClock.getAsLong();
        primed = true;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }
}
