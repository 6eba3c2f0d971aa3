package io.vocalis.core.memory.task;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one outstanding submission. Instances are immutable; {@link TaskTracker} publishes a new
 * snapshot on every poll and state change.
 */
public record MemoryTask(
    String taskId,
    String userId,
    String agentId,
    Instant submittedAt,
    TaskState state,
    int attempts
) {
    public MemoryTask {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        Objects.requireNonNull(state, "state must not be null");
        submittedAt = submittedAt == null ? Instant.EPOCH : submittedAt;
        attempts = Math.max(0, attempts);
    }

    public static MemoryTask pending(String taskId, String userId, String agentId, Instant submittedAt) {
        return new MemoryTask(taskId, userId, agentId, submittedAt, TaskState.PENDING, 0);
    }

    MemoryTask withAttempt() {
        return new MemoryTask(taskId, userId, agentId, submittedAt, state, attempts + 1);
    }

    MemoryTask withState(TaskState next) {
        return new MemoryTask(taskId, userId, agentId, submittedAt, next, attempts);
    }
}
