package io.vocalis.core.memory.client;

import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import java.util.List;

/** Stands in for the HTTP client when no API key is configured. */
public final class DisabledMemoryClient implements MemoryClient {
    private final String reason;

    public DisabledMemoryClient(String reason) {
        this.reason = reason == null || reason.isBlank() ? "not configured" : reason;
    }

    @Override
    public String submit(MemoryScope scope, List<ConversationTurn> turns) throws MemoryClientException {
        throw disabled();
    }

    @Override
    public RemoteTaskStatus status(String taskId) throws MemoryClientException {
        throw disabled();
    }

    @Override
    public List<CategorySummary> retrieveDefaultCategories(MemoryScope scope) throws MemoryClientException {
        throw disabled();
    }

    private MemoryServiceException disabled() {
        return new MemoryServiceException("memory service is disabled: " + reason, 0);
    }
}
