package io.vocalis.core.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One recorded pipeline event. The user and task a report names are lifted out of its attributes into
 * {@code userId} and {@code taskId}; both are empty when the report carried none.
 */
public record MemoryEvent(
    String id,
    Instant timestamp,
    String type,
    String userId,
    String taskId,
    Map<String, Object> attributes
) {
    public MemoryEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        userId = userId == null ? "" : userId.trim();
        taskId = taskId == null ? "" : taskId.trim();
        attributes = attributes == null ? Map.of() : withoutNulls(attributes);
    }

    static MemoryEvent fromReport(String id, Instant timestamp, String type, Map<String, Object> reported) {
        Map<String, Object> rest = new LinkedHashMap<>(reported == null ? Map.of() : reported);
        Object userId = rest.remove("user_id");
        Object taskId = rest.remove("task_id");
        return new MemoryEvent(id, timestamp, type, text(userId), text(taskId), rest);
    }

    public boolean isType(String candidate) {
        return type.equalsIgnoreCase(candidate);
    }

    /** Numeric attribute, also accepting numbers that were stored as text. */
    public Optional<Double> number(String key) {
        Object value = attributes.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(String.valueOf(value).trim()));
        } catch (NumberFormatException ignored) {
            return Optional.empty();
        }
    }

    public String text(String key) {
        return text(attributes.get(key));
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }
}
