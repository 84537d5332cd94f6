package com.agencyos.searchsync.core.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Linear, capped reconnect backoff.
 *
 * <pre>
 * failure n (1 &lt;= n &lt;= maxRetries)  -&gt; wait min(n * step, cap), then try again
 * failure maxRetries + 1             -&gt; give up (connection disabled)
 * </pre>
 *
 * <p>With the defaults (5 retries, 200ms step, 2000ms cap) a dead endpoint sees six connect attempts,
 * spaced 200, 400, 600, 800 and 1000ms apart.</p>
 */
public record ReconnectPolicy(int maxRetries, Duration step, Duration cap) {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_STEP = Duration.ofMillis(200);
    public static final Duration DEFAULT_CAP = Duration.ofMillis(2000);

    public ReconnectPolicy {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(cap, "cap");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("step must be positive, was " + step);
        }
        if (cap.compareTo(step) < 0) {
            throw new IllegalArgumentException("cap must be >= step, was cap=" + cap + " step=" + step);
        }
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(DEFAULT_MAX_RETRIES, DEFAULT_STEP, DEFAULT_CAP);
    }

    /**
     * Delay before the attempt that follows consecutive failure number {@code failures}.
     *
     * @param failures consecutive failures so far, starting at 1
     */
    public Duration delayAfter(int failures) {
        if (failures < 1) {
            return Duration.ZERO;
        }
        Duration linear = step.multipliedBy(failures);
        return linear.compareTo(cap) > 0 ? cap : linear;
    }

    /**
     * @return true once {@code failures} consecutive failures exceed the retry budget
     */
    public boolean isExhausted(int failures) {
        return failures > maxRetries;
    }
}
