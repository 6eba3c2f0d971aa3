package io.vocalis.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public final class ObservabilityService implements MemoryEventSink {
    private static final int MAX_EVENTS = 20_000;

    private final MemoryEventStore store;
    private final Clock clock;

    public ObservabilityService(MemoryEventStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized void record(String type, Map<String, Object> attributes) throws IOException {
        append(type, attributes);
    }

    public synchronized MemoryEvent append(String type, Map<String, Object> attributes) throws IOException {
        List<MemoryEvent> all = new ArrayList<>(store.load());
        MemoryEvent event = MemoryEvent.fromReport(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    public synchronized List<MemoryEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(MemoryEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized MemoryPipelineSummary summary() throws IOException {
        List<MemoryEvent> all = store.load();

        List<MemoryEvent> submitted = byType(all, SUBMITTED);
        List<MemoryEvent> submitFailed = byType(all, SUBMIT_FAILED);
        List<MemoryEvent> applied = byType(all, REFRESH_APPLIED);
        List<MemoryEvent> unchanged = byType(all, REFRESH_UNCHANGED);
        List<MemoryEvent> trackerFailed = byType(all, TRACKER_FAILED);

        int turnsSubmitted = sumInt(submitted, "turns");
        int turnsDiscarded = sumInt(submitFailed, "turns") + sumInt(byType(all, TURNS_DROPPED), "turns");
        int timeouts = (int) trackerFailed.stream()
            .filter(e -> "TIMEOUT".equalsIgnoreCase(e.text("reason")))
            .count();

        int resolved = applied.size() + unchanged.size();
        double successRate = submitted.isEmpty() ? 0.0 : percentage(resolved, submitted.size());

        List<Double> latencies = new ArrayList<>();
        for (MemoryEvent event : applied) {
            addLatency(latencies, event);
        }
        for (MemoryEvent event : unchanged) {
            addLatency(latencies, event);
        }
        latencies.sort(Comparator.naturalOrder());

        return new MemoryPipelineSummary(
            submitted.size(),
            turnsSubmitted,
            submitFailed.size(),
            turnsDiscarded,
            applied.size(),
            unchanged.size(),
            trackerFailed.size(),
            timeouts,
            round2(successRate),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            all.size()
        );
    }

    private void addLatency(List<Double> latencies, MemoryEvent event) {
        event.number("latency_ms").filter(latency -> latency >= 0).ifPresent(latencies::add);
    }

    private List<MemoryEvent> byType(List<MemoryEvent> events, String type) {
        return events.stream().filter(e -> e.isType(type)).toList();
    }

    private int sumInt(List<MemoryEvent> events, String attribute) {
        int total = 0;
        for (MemoryEvent event : events) {
            total += event.number(attribute).filter(value -> value > 0).map(Double::intValue).orElse(0);
        }
        return total;
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
