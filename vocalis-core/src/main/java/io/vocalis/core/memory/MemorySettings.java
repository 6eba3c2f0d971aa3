package io.vocalis.core.memory;

import io.vocalis.core.memory.prompt.PromptComposer;
import io.vocalis.core.memory.task.PollPolicy;
import io.vocalis.core.model.MemoryScope;
import java.time.Duration;
import java.util.Objects;

/** Per-session settings handed to a {@link MemoryCoordinator}. */
public record MemorySettings(
    MemoryScope scope,
    String baseInstructions,
    String memoryHeader,
    int flushThreshold,
    PollPolicy pollPolicy,
    Duration closeGracePeriod
) {
    public static final int DEFAULT_FLUSH_THRESHOLD = 4;

    public MemorySettings {
        Objects.requireNonNull(scope, "scope must not be null");
        baseInstructions = baseInstructions == null ? "" : baseInstructions;
        memoryHeader = memoryHeader == null || memoryHeader.isBlank() ? PromptComposer.DEFAULT_MEMORY_HEADER : memoryHeader;
        flushThreshold = flushThreshold <= 0 ? DEFAULT_FLUSH_THRESHOLD : flushThreshold;
        pollPolicy = pollPolicy == null ? PollPolicy.defaults() : pollPolicy;
        closeGracePeriod = closeGracePeriod == null || closeGracePeriod.isNegative() ? Duration.ofSeconds(10) : closeGracePeriod;
    }

    public static MemorySettings defaults(MemoryScope scope, String baseInstructions) {
        return new MemorySettings(scope, baseInstructions, null, DEFAULT_FLUSH_THRESHOLD, null, null);
    }
}
