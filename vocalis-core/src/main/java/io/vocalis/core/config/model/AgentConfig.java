package io.vocalis.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vocalis.core.memory.prompt.PromptComposer;
import io.vocalis.core.model.MemoryScope;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    @JsonAlias({"user_id"}) String userId,
    @JsonAlias({"user_name"}) String userName,
    @JsonAlias({"agent_id"}) String agentId,
    @JsonAlias({"agent_name"}) String agentName,
    @JsonAlias({"base_instructions"}) String baseInstructions,
    @JsonAlias({"memory_header"}) String memoryHeader
) {

    public static AgentConfig defaults() {
        return new AgentConfig(
            "default_user",
            MemoryScope.DEFAULT_USER_NAME,
            "voice_assistant_001",
            MemoryScope.DEFAULT_AGENT_NAME,
            "You are a helpful voice AI assistant. You eagerly help users with their questions, drawing on your broad knowledge. "
                + "Your answers are concise and free of complex formatting or punctuation, including emojis, asterisks or other symbols. "
                + "You are curious, friendly, and have a sense of humor.",
            PromptComposer.DEFAULT_MEMORY_HEADER
        );
    }
}
