package io.vocalis.cli;

import io.vocalis.core.config.ConfigService;
import io.vocalis.core.config.OnboardResult;
import io.vocalis.core.config.model.AgentConfig;
import io.vocalis.core.config.model.VocalisConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Create or refresh the configuration file and report what memory still needs")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Overwrite existing config with defaults")
    boolean overwrite;

    @Option(names = {"-u", "--user"}, description = "User id that memories are stored under")
    String user;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            } else if (result.overwrittenConfig()) {
                System.out.println("Overwrote config with defaults: " + result.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + result.configPath());
            }

            VocalisConfig config = context.configService().load(context.configPath());
            if (user != null && !user.isBlank()) {
                config = withUser(config, user.trim());
                context.configService().save(context.configPath(), config);
            }
            System.out.println("Memories are stored for user " + config.agent().userId() + " and agent " + config.agent().agentId());

            if (context.loadConfig().memory().service().configured()) {
                System.out.println("Memory service ready at " + config.memory().service().resolvedApiBase());
            } else {
                System.out.println("Memory service is disabled until an API key is set: export "
                    + ConfigService.ENV_API_KEY + " or fill memory.service.apiKey");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }

    private VocalisConfig withUser(VocalisConfig config, String userId) {
        AgentConfig agent = config.agent();
        return new VocalisConfig(
            config.memory(),
            new AgentConfig(userId, agent.userName(), agent.agentId(), agent.agentName(), agent.baseInstructions(), agent.memoryHeader())
        );
    }
}
