package io.vocalis.core.memory.client;

import java.util.Locale;

public enum RemoteTaskStatus {
    PENDING,
    COMPLETED,
    FAILED;

    /**
     * Maps the service's status vocabulary onto the three states the tracker cares about. Unknown but
     * non-blank values are treated as still running.
     */
    public static RemoteTaskStatus parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return switch (normalized) {
            case "completed", "complete", "success", "succeeded" -> COMPLETED;
            case "failed", "failure", "revoked", "error" -> FAILED;
            default -> PENDING;
        };
    }
}
