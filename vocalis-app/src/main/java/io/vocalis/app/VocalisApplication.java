package io.vocalis.app;

import io.vocalis.cli.CliContext;
import io.vocalis.cli.MemoriesCommand;
import io.vocalis.cli.MemoryClientFactory;
import io.vocalis.cli.OnboardCommand;
import io.vocalis.cli.ReplayCommand;
import io.vocalis.cli.StatusCommand;
import io.vocalis.cli.VocalisCliCommand;
import io.vocalis.core.config.ConfigPaths;
import io.vocalis.core.config.ConfigService;
import io.vocalis.core.config.model.VocalisConfig;
import io.vocalis.core.observability.FileMemoryEventStore;
import io.vocalis.core.observability.ObservabilityService;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class VocalisApplication {
    private static final Logger LOG = LoggerFactory.getLogger(VocalisApplication.class);

    private VocalisApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.resolve(System.getenv("VOCALIS_CONFIG"));
        Map<String, String> environment = System.getenv();
        logMemoryServiceState(configService, configPath, environment);

        ObservabilityService observabilityService = new ObservabilityService(
            new FileMemoryEventStore(ConfigPaths.defaultEventLogPath()),
            Clock.systemUTC()
        );
        CliContext context = new CliContext(
            configService,
            configPath,
            environment,
            MemoryClientFactory.http(),
            observabilityService
        );

        CommandLine commandLine = new CommandLine(new VocalisCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("memories", new MemoriesCommand(context));
        commandLine.addSubcommand("replay", new ReplayCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static void logMemoryServiceState(ConfigService configService, Path configPath, Map<String, String> environment) {
        try {
            VocalisConfig config = configService.withEnvironment(configService.load(configPath), environment);
            if (config.memory().service().configured()) {
                LOG.info("Memory service enabled at {}", config.memory().service().resolvedApiBase());
            } else {
                LOG.warn("Memory service API key not set, memory features are disabled. Set {} or memory.service.apiKey in {}",
                    ConfigService.ENV_API_KEY, configPath);
            }
        } catch (Exception e) {
            LOG.warn("Could not read config {}: {}", configPath, e.getMessage());
        }
    }
}
