package io.vocalis.cli;

import io.vocalis.core.config.model.PipelineConfig;
import io.vocalis.core.config.model.VocalisConfig;
import io.vocalis.core.observability.MemoryPipelineSummary;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show memory configuration and pipeline statistics")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            VocalisConfig config = context.loadConfig();
            PipelineConfig pipeline = config.memory().pipeline();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Memory service: " + config.memory().service().resolvedApiBase());
            System.out.println("Memory service configured: " + config.memory().service().configured());
            System.out.println("Flush threshold: " + pipeline.flushThreshold() + " turns");
            System.out.println("Polling: every " + pipeline.pollIntervalMs() + " ms (max " + pipeline.maxPollIntervalMs()
                + " ms), up to " + pipeline.maxPollAttempts() + " attempts or " + pipeline.maxWaitSeconds() + " s");
            System.out.println("Close grace period: " + pipeline.closeGracePeriodSeconds() + " s");
            System.out.println("User: " + config.agent().userId() + " (" + config.agent().userName() + ")");
            System.out.println("Agent: " + config.agent().agentId() + " (" + config.agent().agentName() + ")");
            if (context.observability() != null) {
                MemoryPipelineSummary summary = context.observability().summary();
                System.out.println("Batches submitted: " + summary.batchesSubmitted() + " (" + summary.turnsSubmitted() + " turns)");
                System.out.println("Submission failures: " + summary.submissionFailures() + " (" + summary.turnsDiscarded() + " turns discarded)");
                System.out.println("Refreshes applied: " + summary.refreshesApplied() + ", unchanged: " + summary.refreshesUnchanged());
                System.out.println("Tracker failures: " + summary.trackerFailures() + " (timeouts: " + summary.trackerTimeouts() + ")");
                System.out.println("Refresh latency p50/p95: " + summary.p50RefreshLatencyMs() + " / " + summary.p95RefreshLatencyMs() + " ms");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
