package io.vocalis.core.memory.task;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling cadence and limits for a {@link TaskTracker}. The delay before poll {@code n} (zero based) is
 * {@code min(maxInterval, initialInterval * multiplier^n)}, widened or narrowed by up to
 * {@code jitterRatio} of itself. A multiplier of 1.0 gives a fixed interval.
 */
public record PollPolicy(
    Duration initialInterval,
    Duration maxInterval,
    double multiplier,
    double jitterRatio,
    int maxAttempts,
    Duration maxWait
) {
    public PollPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval must not be null");
        Objects.requireNonNull(maxWait, "maxWait must not be null");
        if (initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval must not be negative");
        }
        maxInterval = maxInterval == null || maxInterval.compareTo(initialInterval) < 0 ? initialInterval : maxInterval;
        multiplier = Math.max(1.0, multiplier);
        jitterRatio = Math.max(0.0, Math.min(1.0, jitterRatio));
        maxAttempts = Math.max(1, maxAttempts);
    }

    public static PollPolicy defaults() {
        return new PollPolicy(Duration.ofSeconds(2), Duration.ofSeconds(15), 1.5, 0.1, 40, Duration.ofMinutes(5));
    }

    public static PollPolicy fixed(Duration interval, int maxAttempts, Duration maxWait) {
        return new PollPolicy(interval, interval, 1.0, 0.0, maxAttempts, maxWait);
    }

    /**
     * @param attempt number of polls already made
     * @param randomUnit a value in {@code [0, 1)} used for jitter
     */
    public long delayMillis(int attempt, double randomUnit) {
        double base = initialInterval.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        base = Math.min(base, maxInterval.toMillis());
        double jitter = base * jitterRatio * (2.0 * randomUnit - 1.0);
        return Math.max(0L, Math.round(base + jitter));
    }
}
