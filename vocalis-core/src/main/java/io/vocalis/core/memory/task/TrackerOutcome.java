package io.vocalis.core.memory.task;

import io.vocalis.core.model.CategorySummary;
import java.util.List;
import java.util.Objects;

/**
 * Result of one tracked task. {@code retrievalSequence} orders successful retrievals: a higher value
 * was retrieved later. It is 0 for failed outcomes.
 */
public record TrackerOutcome(
    MemoryTask task,
    List<CategorySummary> categories,
    FailureReason failureReason,
    String detail,
    long retrievalSequence
) {
    public TrackerOutcome {
        Objects.requireNonNull(task, "task must not be null");
        categories = categories == null ? List.of() : List.copyOf(categories);
        detail = detail == null ? "" : detail;
    }

    public static TrackerOutcome completed(MemoryTask task, List<CategorySummary> categories, long retrievalSequence) {
        return new TrackerOutcome(task, categories, null, "", retrievalSequence);
    }

    public static TrackerOutcome failed(MemoryTask task, FailureReason reason, String detail) {
        return new TrackerOutcome(task, List.of(), Objects.requireNonNull(reason, "reason must not be null"), detail, 0L);
    }

    public boolean succeeded() {
        return failureReason == null;
    }
}
