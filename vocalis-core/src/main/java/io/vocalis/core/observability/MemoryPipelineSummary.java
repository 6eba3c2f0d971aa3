package io.vocalis.core.observability;

public record MemoryPipelineSummary(
    int batchesSubmitted,
    int turnsSubmitted,
    int submissionFailures,
    int turnsDiscarded,
    int refreshesApplied,
    int refreshesUnchanged,
    int trackerFailures,
    int trackerTimeouts,
    double refreshSuccessRate,
    double p50RefreshLatencyMs,
    double p95RefreshLatencyMs,
    int recordedEvents
) {
}
