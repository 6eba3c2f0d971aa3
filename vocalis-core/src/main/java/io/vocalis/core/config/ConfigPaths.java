package io.vocalis.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".vocalis", "config.json");
    }

    public static Path defaultEventLogPath() {
        return Path.of(System.getProperty("user.home"), ".vocalis", "observability", "memory-events.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultConfigPath();
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
