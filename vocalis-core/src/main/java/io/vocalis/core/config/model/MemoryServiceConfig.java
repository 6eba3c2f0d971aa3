package io.vocalis.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vocalis.core.memory.client.HttpMemoryClient;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryServiceConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"submit_max_attempts"}) int submitMaxAttempts
) {

    public static MemoryServiceConfig defaults() {
        return new MemoryServiceConfig("", HttpMemoryClient.DEFAULT_API_BASE, 2);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String resolvedApiBase() {
        return apiBase == null || apiBase.isBlank() ? HttpMemoryClient.DEFAULT_API_BASE : apiBase.trim();
    }
}
