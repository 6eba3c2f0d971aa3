package io.vocalis.cli;

import io.vocalis.core.config.model.VocalisConfig;
import io.vocalis.core.memory.MemorySettings;
import io.vocalis.core.memory.client.MemoryClient;
import io.vocalis.core.memory.prompt.PromptComposer;
import io.vocalis.core.model.CategorySummary;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "memories", description = "Retrieve stored memories and print the resulting system prompt")
public final class MemoriesCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "User id override")
    String user;

    public MemoriesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            VocalisConfig config = context.loadConfig();
            MemorySettings settings = config.memorySettings(user);
            MemoryClient client = context.clientFactory().create(config.memory().service());

            List<CategorySummary> categories = client.retrieveDefaultCategories(settings.scope());
            System.out.println("Categories for " + settings.scope().userId() + ": " + categories.size());
            for (CategorySummary category : categories) {
                System.out.println("- " + category.categoryName() + ": " + category.summary().orElse("(no summary)"));
            }
            System.out.println();
            System.out.println(new PromptComposer(settings.memoryHeader()).build(settings.baseInstructions(), categories));
            return 0;
        } catch (Exception e) {
            System.err.println("Memories command failed: " + e.getMessage());
            return 1;
        }
    }
}
