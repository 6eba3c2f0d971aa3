package io.vocalis.core.observability;

import java.io.IOException;
import java.util.Map;

/** Receives memory pipeline events for diagnosis. Never consulted for conversational content. */
@FunctionalInterface
public interface MemoryEventSink {
    String SUBMITTED = "memory_submitted";
    String SUBMIT_FAILED = "memory_submit_failed";
    String REFRESH_APPLIED = "memory_refresh_applied";
    String REFRESH_UNCHANGED = "memory_refresh_unchanged";
    String TRACKER_FAILED = "memory_tracker_failed";
    String TURNS_DROPPED = "memory_turns_dropped";

    void record(String type, Map<String, Object> attributes) throws IOException;
}
