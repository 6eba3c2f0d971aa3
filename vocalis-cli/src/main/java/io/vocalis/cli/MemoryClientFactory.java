package io.vocalis.cli;

import io.vocalis.core.config.model.MemoryServiceConfig;
import io.vocalis.core.memory.client.DisabledMemoryClient;
import io.vocalis.core.memory.client.HttpMemoryClient;
import io.vocalis.core.memory.client.MemoryClient;

@FunctionalInterface
public interface MemoryClientFactory {
    MemoryClient create(MemoryServiceConfig config);

    static MemoryClientFactory http() {
        return config -> config != null && config.configured()
            ? new HttpMemoryClient(config.apiKey(), config.resolvedApiBase(), config.submitMaxAttempts())
            : new DisabledMemoryClient("missing API key");
    }
}
