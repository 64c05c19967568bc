package com.companyintel.research;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal for one research run. Cancelled explicitly by the caller or implicitly when
 * the optional deadline passes.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private volatile Instant deadline;

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel(String cancelReason) {
        reason.compareAndSet(null, cancelReason == null || cancelReason.isBlank() ? "cancelled" : cancelReason);
    }

    public void expireAfter(Duration timeout) {
        if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
            deadline = Instant.now().plus(timeout);
        }
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        Instant currentDeadline = deadline;
        if (currentDeadline != null && Instant.now().isAfter(currentDeadline)) {
            reason.compareAndSet(null, "global_timeout");
            return true;
        }
        return false;
    }

    public String reason() {
        isCancelled();
        return reason.get();
    }
}
