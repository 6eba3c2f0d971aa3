package io.vocalis.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vocalis.core.config.model.VocalisConfig;
import io.vocalis.core.memory.CloseReport;
import io.vocalis.core.memory.MemoryCoordinator;
import io.vocalis.core.memory.MemorySettings;
import io.vocalis.core.session.InMemoryLiveSession;
import io.vocalis.core.session.TranscriptListener;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Feeds a recorded transcript through a full memory session, as a live voice session would, and prints
 * the instructions the session ends up with.
 */
@Command(name = "replay", description = "Replay a JSON transcript through the memory pipeline")
public final class ReplayCommand implements Callable<Integer> {
    private final CliContext context;
    private final ObjectMapper mapper = new ObjectMapper();

    @Parameters(index = "0", arity = "1", description = "Transcript file: [{\"role\": \"user\", \"content\": \"...\"}, ...]")
    Path transcript;

    @Option(names = {"-u", "--user"}, description = "User id override")
    String user;

    @Option(names = "--skip-prime", description = "Do not load existing memories before replaying")
    boolean skipPrime;

    public ReplayCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JsonNode items = mapper.readTree(Files.readString(transcript));
            if (!items.isArray()) {
                throw new IllegalArgumentException("transcript must be a JSON array");
            }

            VocalisConfig config = context.loadConfig();
            MemorySettings settings = config.memorySettings(user);
            InMemoryLiveSession session = new InMemoryLiveSession(settings.baseInstructions());
            MemoryCoordinator coordinator = new MemoryCoordinator(
                context.clientFactory().create(config.memory().service()),
                session,
                settings,
                context.observability()
            );
            if (!skipPrime) {
                coordinator.primeInstructions().join();
            }

            TranscriptListener listener = new TranscriptListener(coordinator, Clock.systemUTC());
            int forwarded = 0;
            for (JsonNode item : items) {
                String content = item.path("content").asText(item.path("text").asText(""));
                if (listener.onConversationItem(item.path("role").asText(""), List.of(content))) {
                    forwarded++;
                }
            }
            CloseReport report = listener.onSessionClosed("transcript finished");

            System.out.println("Replayed " + forwarded + " turns for " + settings.scope().userId()
                + " (final batch " + report.finalBatchSize() + ", abandoned tasks " + report.abandonedTasks() + ")");
            System.out.println();
            System.out.println(session.currentInstructions());
            return 0;
        } catch (Exception e) {
            System.err.println("Replay command failed: " + e.getMessage());
            return 1;
        }
    }
}
