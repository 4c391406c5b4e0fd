package com.mythosmud.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for broker publish retries.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * <ul>
 *   <li>{@code base}: Initial delay</li>
 *   <li>{@code max}: Maximum delay (cap)</li>
 *   <li>{@code jitterMax}: Maximum jitter to add, zero disables jitter</li>
 * </ul>
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add
     * @return Computed delay (base * 2^attempt + jitter, capped at max before jitter)
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterBound = Math.max(jitterMax.toMillis(), 0);
        long jitterMs = jitterBound == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterBound + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }
}
