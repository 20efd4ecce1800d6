package com.umitunal.taskq.model;

import java.time.Duration;

/**
 * Delay inserted before a failed job is retried. Implementations must never return a shorter
 * delay for a larger attempt count.
 */
@FunctionalInterface
public interface RetryBackoff {

    /**
     * @param attempts attempts made so far, including the one that just failed (at least 1)
     * @return delay before the next attempt
     */
    Duration delayFor(int attempts);

    static RetryBackoff fixed(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        return attempts -> delay;
    }

    /**
     * {@code base * 2^attempts}, capped at {@code max}.
     */
    static RetryBackoff exponential(Duration base, Duration max) {
        if (base == null || base.isNegative() || max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("invalid exponential backoff: base=" + base + ", max=" + max);
        }
        long baseMillis = base.toMillis();
        long maxMillis = max.toMillis();
        return attempts -> {
            int shift = Math.max(0, attempts);
            if (shift >= 62 || baseMillis > (maxMillis >> Math.min(shift, 62))) {
                return max;
            }
            return Duration.ofMillis(Math.min(baseMillis << shift, maxMillis));
        };
    }
}
