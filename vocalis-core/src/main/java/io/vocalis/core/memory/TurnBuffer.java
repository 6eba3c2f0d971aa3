package io.vocalis.core.memory;

import io.vocalis.core.model.ConversationTurn;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, count-bounded buffer of turns awaiting submission. All operations hold the buffer's monitor,
 * so a turn appended concurrently with a drain lands entirely before or entirely after it.
 *
 * <p>{@link #close()} drains and seals the buffer in one step; appends after that are rejected, so no
 * turn can land behind the final drain.
 */
public final class TurnBuffer {
    private final int flushThreshold;
    private final List<ConversationTurn> turns = new ArrayList<>();
    private boolean closed;

    public TurnBuffer(int flushThreshold) {
        if (flushThreshold <= 0) {
            throw new IllegalArgumentException("flushThreshold must be > 0");
        }
        this.flushThreshold = flushThreshold;
    }

    /**
     * @return whether the buffer has reached the flush threshold
     * @throws IllegalStateException if the buffer was closed
     */
    public synchronized boolean append(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        if (closed) {
            throw new IllegalStateException("turn buffer is closed");
        }
        turns.add(turn);
        return turns.size() >= flushThreshold;
    }

    /**
     * Appends and, when that reaches the threshold, drains in the same critical section. Flushes
     * therefore happen on exactly every {@code flushThreshold}-th turn even with concurrent callers.
     */
    public synchronized Optional<List<ConversationTurn>> offer(ConversationTurn turn) {
        if (append(turn)) {
            return Optional.of(drain());
        }
        return Optional.empty();
    }

    public synchronized List<ConversationTurn> drain() {
        if (turns.isEmpty()) {
            return List.of();
        }
        List<ConversationTurn> drained = List.copyOf(turns);
        turns.clear();
        return drained;
    }

    /** Seals the buffer and returns whatever was still in it. Later calls return an empty list. */
    public synchronized List<ConversationTurn> close() {
        closed = true;
        return drain();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int size() {
        return turns.size();
    }

    public int flushThreshold() {
        return flushThreshold;
    }
}
