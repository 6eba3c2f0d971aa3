package io.vocalis.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryConfig(MemoryServiceConfig service, PipelineConfig pipeline) {

    public static MemoryConfig defaults() {
        return new MemoryConfig(MemoryServiceConfig.defaults(), PipelineConfig.defaults());
    }
}
