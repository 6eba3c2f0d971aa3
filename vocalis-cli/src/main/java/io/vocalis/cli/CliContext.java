package io.vocalis.cli;

import io.vocalis.core.config.ConfigService;
import io.vocalis.core.config.model.VocalisConfig;
import io.vocalis.core.observability.ObservabilityService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    MemoryClientFactory clientFactory,
    ObservabilityService observability
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        clientFactory = clientFactory == null ? MemoryClientFactory.http() : clientFactory;
    }

    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, Map.of(), MemoryClientFactory.http(), null);
    }

    public VocalisConfig loadConfig() throws IOException {
        return configService.withEnvironment(configService.load(configPath), environment);
    }
}
