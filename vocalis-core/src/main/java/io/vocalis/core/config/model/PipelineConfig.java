package io.vocalis.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vocalis.core.memory.task.PollPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineConfig(
    @JsonAlias({"flush_threshold"}) int flushThreshold,
    @JsonAlias({"poll_interval_ms"}) long pollIntervalMs,
    @JsonAlias({"max_poll_interval_ms"}) long maxPollIntervalMs,
    @JsonAlias({"poll_backoff_multiplier"}) double pollBackoffMultiplier,
    @JsonAlias({"poll_jitter_ratio"}) double pollJitterRatio,
    @JsonAlias({"max_poll_attempts"}) int maxPollAttempts,
    @JsonAlias({"max_wait_seconds"}) long maxWaitSeconds,
    @JsonAlias({"close_grace_period_seconds"}) long closeGracePeriodSeconds
) {

    public static PipelineConfig defaults() {
        return new PipelineConfig(4, 2_000, 15_000, 1.5, 0.1, 40, 300, 10);
    }

    public PollPolicy pollPolicy() {
        return new PollPolicy(
            Duration.ofMillis(Math.max(0, pollIntervalMs)),
            Duration.ofMillis(Math.max(0, maxPollIntervalMs)),
            pollBackoffMultiplier,
            pollJitterRatio,
            maxPollAttempts,
            Duration.ofSeconds(Math.max(1, maxWaitSeconds))
        );
    }

    public Duration closeGracePeriod() {
        return Duration.ofSeconds(Math.max(0, closeGracePeriodSeconds));
    }
}
