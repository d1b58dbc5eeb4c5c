package com.chainoracle.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Token-bucket rate limiter with one permit per fixed interval. Guards the CoinGecko free tier (30 req/min by default).
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos;

    /**
     * @param permitsPerMinute e.g. 30 for 30 requests per minute
     */
    public RateLimiter(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        this.minIntervalNanos = 60_000_000_000L / permitsPerMinute;
        // nanoTime has an arbitrary origin and may be negative
        this.nextFreeAtNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if would block.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now - next >= 0 && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }

    /**
     * Waits at most {@code maxWait} for a permit. Returns false when the permit would only be free after that,
     * without reserving it.
     */
    public boolean tryAcquire(Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            if (now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return true;
                }
                continue;
            }
            if (next - deadline > 0) {
                return false;
            }
            long sleepNanos = next - now;
            try {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
