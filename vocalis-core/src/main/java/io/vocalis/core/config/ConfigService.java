package io.vocalis.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vocalis.core.config.model.MemoryConfig;
import io.vocalis.core.config.model.MemoryServiceConfig;
import io.vocalis.core.config.model.VocalisConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String ENV_API_KEY = "VOCALIS_MEMORY_API_KEY";
    public static final String ENV_API_BASE = "VOCALIS_MEMORY_API_BASE";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public VocalisConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return VocalisConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(VocalisConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, VocalisConfig.class);
    }

    /** Environment variables win over the file for the memory service credentials. */
    public VocalisConfig withEnvironment(VocalisConfig config, Map<String, String> env) {
        Objects.requireNonNull(config, "config must not be null");
        if (env == null) {
            return config;
        }
        String apiKey = env.get(ENV_API_KEY);
        String apiBase = env.get(ENV_API_BASE);
        boolean overrideKey = apiKey != null && !apiKey.isBlank();
        boolean overrideBase = apiBase != null && !apiBase.isBlank();
        if (!overrideKey && !overrideBase) {
            return config;
        }
        MemoryServiceConfig service = config.memory().service();
        MemoryServiceConfig updated = new MemoryServiceConfig(
            overrideKey ? apiKey.trim() : service.apiKey(),
            overrideBase ? apiBase.trim() : service.apiBase(),
            service.submitMaxAttempts()
        );
        return new VocalisConfig(new MemoryConfig(updated, config.memory().pipeline()), config.agent());
    }

    public void save(Path configPath, VocalisConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        VocalisConfig config;
        if (created || overwrite) {
            config = VocalisConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new OnboardResult(configPath, created, overwritten);
    }

    public String toPrettyJson(VocalisConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
