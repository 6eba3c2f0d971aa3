package io.vocalis.core.model;

/**
 * Identifiers that scope remote memory to one user talking to one agent. Display names travel with
 * every submission so the memory service can label the speakers.
 */
public record MemoryScope(String userId, String userName, String agentId, String agentName) {
    public static final String DEFAULT_USER_NAME = "Voice User";
    public static final String DEFAULT_AGENT_NAME = "Voice Assistant";

    public MemoryScope {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        userId = userId.trim();
        agentId = agentId.trim();
        userName = userName == null || userName.isBlank() ? DEFAULT_USER_NAME : userName.trim();
        agentName = agentName == null || agentName.isBlank() ? DEFAULT_AGENT_NAME : agentName.trim();
    }

    public static MemoryScope of(String userId, String agentId) {
        return new MemoryScope(userId, null, agentId, null);
    }
}
