package io.vocalis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vocalis.core.memory.MemorySettings;
import io.vocalis.core.model.MemoryScope;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VocalisConfig(
    MemoryConfig memory,
    AgentConfig agent
) {

    public static VocalisConfig defaults() {
        return new VocalisConfig(
            MemoryConfig.defaults(),
            AgentConfig.defaults()
        );
    }

    /** Settings for one session; a blank {@code userIdOverride} falls back to the configured user. */
    public MemorySettings memorySettings(String userIdOverride) {
        String userId = userIdOverride == null || userIdOverride.isBlank() ? agent.userId() : userIdOverride;
        PipelineConfig pipeline = memory.pipeline();
        return new MemorySettings(
            new MemoryScope(userId, agent.userName(), agent.agentId(), agent.agentName()),
            agent.baseInstructions(),
            agent.memoryHeader(),
            pipeline.flushThreshold(),
            pipeline.pollPolicy(),
            pipeline.closeGracePeriod()
        );
    }
}
