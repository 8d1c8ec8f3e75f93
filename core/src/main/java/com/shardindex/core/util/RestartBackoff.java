package com.shardindex.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential restart backoff with proportional jitter.
 * <p>
 * <b>Formula:</b> {@code t = min(max, initial * 2^attempt) + uniform(0, t / jitterDivisor)}
 * </p>
 * <p>
 * Not thread-safe: one instance belongs to one supervisor loop.
 * </p>
 */
public final class RestartBackoff {
    private static final int MAX_EXPONENT = 20;

    private final Duration initial;
    private final Duration max;
    private final int jitterDivisor;
    private int attempt;

    public RestartBackoff(Duration initial, Duration max, int jitterDivisor) {
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("invalid backoff bounds: initial=" + initial + ", max=" + max);
        }
        this.initial = initial;
        this.max = max;
        this.jitterDivisor = jitterDivisor;
    }

    /**
     * Returns the next un-jittered delay and advances the attempt counter.
     *
     * @return Delay for this attempt (initial * 2^attempt, capped at max)
     */
    public Duration nextDelay() {
        long expMs = initial.toMillis() * (1L << Math.min(attempt, MAX_EXPONENT));
        if (attempt < MAX_EXPONENT) {
            attempt++;
        }
        return Duration.ofMillis(Math.min(expMs, max.toMillis()));
    }

    /**
     * Starts over from the initial delay (after a session that stayed up long enough).
     */
    public void reset() {
        attempt = 0;
    }

    /**
     * Adds up to {@code delay / jitterDivisor} of random extra wait.
     *
     * @param delay Base delay
     * @return Jittered delay, never shorter than {@code delay}
     */
    public Duration withJitter(Duration delay) {
        if (jitterDivisor <= 0) {
            return delay;
        }
        long maxExtraMs = delay.toMillis() / jitterDivisor;
        if (maxExtraMs <= 0) {
            return delay;
        }
        long extraMs = ThreadLocalRandom.current().nextLong(maxExtraMs + 1);
        return delay.plusMillis(extraMs);
    }
}
