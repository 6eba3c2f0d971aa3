package io.vocalis.core.memory.client;

import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import java.util.List;

/**
 * Stateless adapter over the remote summarization service. Implementations may block on network I/O;
 * callers are expected to invoke them off the conversation loop.
 */
public interface MemoryClient {

    /**
     * Submits an ordered batch of turns for summarization.
     *
     * @return the opaque id of the remote job
     * @throws IllegalArgumentException when {@code turns} is empty
     */
    String submit(MemoryScope scope, List<ConversationTurn> turns) throws MemoryClientException;

    /** Idempotent; safe to call repeatedly for the same task. */
    RemoteTaskStatus status(String taskId) throws MemoryClientException;

    /** Returns the categorized summaries in the order the service lists them. */
    List<CategorySummary> retrieveDefaultCategories(MemoryScope scope) throws MemoryClientException;
}
