package io.vocalis.core.memory;

/**
 * @param finalBatchSize turns submitted by the close-time flush
 * @param abandonedTasks tasks abandoned when the grace period ran out, including submissions that were
 *     still waiting for a task id
 */
public record CloseReport(int finalBatchSize, int abandonedTasks) {
}
