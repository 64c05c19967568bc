package com.companyintel.research.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final double permitsPerSecond;
    private final double capacity;
    private final long maxWaitNanos;
    private double available;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double permitsPerSecond, int burst, Duration maxWait) {
        this.permitsPerSecond = permitsPerSecond <= 0 ? 1.0 : permitsPerSecond;
        this.capacity = Math.max(1, burst);
        this.maxWaitNanos = maxWait == null || maxWait.isNegative() ? 0 : maxWait.toNanos();
        this.available = this.capacity;
        this.lastRefillNanos = System.nanoTime();
    }

    public synchronized void acquire() {
        long deadline = System.nanoTime() + maxWaitNanos;
        boolean waited = false;
        while (true) {
            refill();
            if (available >= 1.0) {
                available -= 1.0;
                if (waited) {
                    log.debug("rate limiter permit granted after wait available={}", available);
                }
                return;
            }
            long needNanos = (long) Math.ceil((1.0 - available) / permitsPerSecond * 1_000_000_000L);
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || needNanos > remaining) {
                throw new ProviderException(
                    "rate_limiter",
                    ProviderFailureKind.THROTTLED,
                    "No provider permit within " + Duration.ofNanos(maxWaitNanos).toMillis() + "ms"
                );
            }
            waited = true;
            try {
                long waitMs = Math.max(1, needNanos / 1_000_000L);
                wait(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("rate_limiter", ProviderFailureKind.THROTTLED, "Interrupted waiting for permit", e);
            }
        }
    }

    synchronized double availablePermits() {
        refill();
        return available;
    }

    private void refill() {
        long now = System.nanoTime();
        double elapsedSeconds = (now - lastRefillNanos) / 1_000_000_000.0;
        if (elapsedSeconds > 0) {
            available = Math.min(capacity, available + elapsedSeconds * permitsPerSecond);
            lastRefillNanos = now;
        }
    }
}
