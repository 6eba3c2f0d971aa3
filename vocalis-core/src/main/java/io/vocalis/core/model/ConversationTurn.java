package io.vocalis.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single recognized or produced utterance. Immutable; ordering within a session is the order of
 * {@code MemoryCoordinator.onTurn} calls, the timestamp is informational.
 */
public record ConversationTurn(TurnRole role, String text, Instant timestamp) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        text = text == null ? "" : text.trim();
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
    }

    public static ConversationTurn user(String text, Instant timestamp) {
        return new ConversationTurn(TurnRole.USER, text, timestamp);
    }

    public static ConversationTurn assistant(String text, Instant timestamp) {
        return new ConversationTurn(TurnRole.ASSISTANT, text, timestamp);
    }
}
