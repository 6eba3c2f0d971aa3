package io.vocalis.core.memory;

import io.vocalis.core.memory.client.MemoryClient;
import io.vocalis.core.memory.client.MemoryClientException;
import io.vocalis.core.memory.prompt.PromptComposer;
import io.vocalis.core.memory.prompt.SystemPrompt;
import io.vocalis.core.memory.task.MemoryTask;
import io.vocalis.core.memory.task.TaskTracker;
import io.vocalis.core.memory.task.TrackerOutcome;
import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import io.vocalis.core.observability.MemoryEventSink;
import io.vocalis.core.session.LiveSession;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the memory pipeline of one voice session: buffers turns, submits full batches, tracks every
 * submission to completion and swaps the composed prompt into the live session.
 *
 * <p>Only buffer operations run on the caller's thread. Submission, polling and retrieval run on the
 * coordinator's scheduler, so {@link #onTurn(ConversationTurn)} never waits on the network. Errors are
 * logged and reported to the event sink; none of them reach the caller.
 *
 * <p>Overlapping submissions resolve independently. Whichever retrieval returns last sets the prompt, since
 * the service always returns its current view of the user. Retrievals are stamped from one sequence when
 * they return, and a result older than the applied one is ignored even if its swap runs later.
 *
 * <p>On close the buffer is sealed and its remaining turns are submitted, outstanding work is awaited for
 * the configured grace period, and whatever is still pending afterwards is abandoned. Submissions still
 * waiting for a task id at that point count as abandoned; their tasks are abandoned as soon as the id
 * arrives.
 */
public final class MemoryCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryCoordinator.class);

    private final MemoryClient client;
    private final LiveSession session;
    private final MemorySettings settings;
    private final MemoryEventSink events;
    private final PromptComposer composer;
    private final TurnBuffer buffer;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;
    private final Random random;
    private final Set<TaskTracker> trackers = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<Void>> pipelines = ConcurrentHashMap.newKeySet();
    private final ReentrantLock promptLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong retrievalSequence = new AtomicLong();
    private final Object trackerLock = new Object();
    private int submissionsInFlight;
    private boolean abandonNewTrackers;
    private SystemPrompt currentPrompt;
    private long appliedSequence;

    public MemoryCoordinator(MemoryClient client, LiveSession session, MemorySettings settings, MemoryEventSink events) {
        this(client, session, settings, events, newScheduler(settings.scope()), true, Clock.systemUTC(), new Random());
    }

    public MemoryCoordinator(
        MemoryClient client,
        LiveSession session,
        MemorySettings settings,
        MemoryEventSink events,
        ScheduledExecutorService scheduler,
        Clock clock,
        Random random
    ) {
        this(client, session, settings, events, scheduler, false, clock, random);
    }

    private MemoryCoordinator(
        MemoryClient client,
        LiveSession session,
        MemorySettings settings,
        MemoryEventSink events,
        ScheduledExecutorService scheduler,
        boolean ownsScheduler,
        Clock clock,
        Random random
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.events = events;
        this.ownsScheduler = ownsScheduler;
        this.random = random == null ? new Random() : random;
        this.composer = new PromptComposer(settings.memoryHeader());
        this.buffer = new TurnBuffer(settings.flushThreshold());
        promptLock.lock();
        try {
            currentPrompt = SystemPrompt.base(settings.baseInstructions());
            session.updateInstructions(currentPrompt.text());
        } finally {
            promptLock.unlock();
        }
    }

    /**
     * Retrieves whatever the service already knows about the user and applies it, so a returning user
     * is recognised from the first turn. A failure leaves the base instructions in place.
     */
    public CompletableFuture<SystemPrompt> primeInstructions() {
        MemoryScope scope = settings.scope();
        return CompletableFuture.supplyAsync(() -> {
            try {
                List<CategorySummary> categories = client.retrieveDefaultCategories(scope);
                long sequence = retrievalSequence.incrementAndGet();
                logCategories(categories);
                applyRetrieved(composer.compose(settings.baseInstructions(), categories), sequence);
            } catch (MemoryClientException | RuntimeException e) {
                LOG.warn("Could not retrieve existing memories for user {}, using base instructions: {}", scope.userId(), e.getMessage());
            }
            return currentPrompt();
        }, scheduler);
    }

    /** Turn-ingestion entry point. Never blocks on network I/O. */
    public void onTurn(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        if (closed.get()) {
            dropLateTurn(turn);
            return;
        }
        Optional<List<ConversationTurn>> batch;
        try {
            batch = buffer.offer(turn);
        } catch (IllegalStateException e) {
            // lost the race with onClose: the final batch is already drained
            dropLateTurn(turn);
            return;
        }
        batch.ifPresent(this::dispatch);
    }

    /**
     * Drains the buffer and submits its contents in the background. The returned future completes once
     * the batch's tracker has resolved and its result was applied or discarded.
     */
    public CompletableFuture<Void> submitAndTrack() {
        return dispatch(buffer.drain());
    }

    /**
     * Replaces the live instructions in a single write. A prompt identical to the current one is not
     * written again. The prompt supersedes every retrieval that returned before this call.
     *
     * @return whether the live instructions changed
     */
    public boolean applyPrompt(SystemPrompt prompt) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        promptLock.lock();
        try {
            appliedSequence = Math.max(appliedSequence, retrievalSequence.incrementAndGet());
            return swap(prompt);
        } finally {
            promptLock.unlock();
        }
    }

    /**
     * Applies a prompt built from the retrieval stamped {@code sequence}, unless a later retrieval has
     * already been applied.
     */
    boolean applyRetrieved(SystemPrompt prompt, long sequence) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        promptLock.lock();
        try {
            if (sequence < appliedSequence) {
                LOG.debug("Ignoring retrieval {} for user {}: retrieval {} is already applied", sequence, settings.scope().userId(), appliedSequence);
                return false;
            }
            appliedSequence = sequence;
            return swap(prompt);
        } finally {
            promptLock.unlock();
        }
    }

    private boolean swap(SystemPrompt prompt) {
        if (currentPrompt.text().equals(prompt.text())) {
            return false;
        }
        session.updateInstructions(prompt.text());
        currentPrompt = prompt;
        LOG.info(
            "Applied system prompt with {} memory categories for user {} ({} chars)",
            prompt.integratedSummaries().size(),
            settings.scope().userId(),
            prompt.text().length()
        );
        return true;
    }

    public SystemPrompt currentPrompt() {
        promptLock.lock();
        try {
            return currentPrompt;
        } finally {
            promptLock.unlock();
        }
    }

    public List<MemoryTask> outstandingTasks() {
        return trackers.stream().map(TaskTracker::task).toList();
    }

    public int bufferedTurns() {
        return buffer.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Session-close callback. Idempotent; only the first call flushes and waits.
     */
    public CloseReport onClose() {
        if (!closed.compareAndSet(false, true)) {
            return new CloseReport(0, 0);
        }
        List<ConversationTurn> remaining = buffer.close();
        if (!remaining.isEmpty()) {
            LOG.info("Session closing for user {}, submitting final {} turns", settings.scope().userId(), remaining.size());
        }
        dispatch(remaining);
        int abandoned = awaitOutstanding(settings.closeGracePeriod());
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        return new CloseReport(remaining.size(), abandoned);
    }

    private CompletableFuture<Void> dispatch(List<ConversationTurn> batch) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        synchronized (trackerLock) {
            submissionsInFlight++;
        }
        CompletableFuture<Void> pipeline;
        try {
            pipeline = CompletableFuture.supplyAsync(() -> submit(batch), scheduler)
                .thenCompose(this::track)
                .exceptionally(e -> {
                    LOG.error("Memory pipeline for user {} failed unexpectedly", settings.scope().userId(), e);
                    return null;
                });
        } catch (RejectedExecutionException e) {
            synchronized (trackerLock) {
                submissionsInFlight--;
            }
            LOG.warn("Discarding {} turns for user {}: memory pipeline is shut down", batch.size(), settings.scope().userId());
            report(MemoryEventSink.TURNS_DROPPED, attributes("turns", batch.size()));
            return CompletableFuture.completedFuture(null);
        }
        pipelines.add(pipeline);
        pipeline.whenComplete((ignored, error) -> pipelines.remove(pipeline));
        return pipeline;
    }

    private TaskTracker submit(List<ConversationTurn> batch) {
        TaskTracker tracker = null;
        try {
            tracker = submitBatch(batch);
            return tracker;
        } finally {
            registerSubmitted(tracker);
        }
    }

    private TaskTracker submitBatch(List<ConversationTurn> batch) {
        MemoryScope scope = settings.scope();
        String taskId;
        try {
            taskId = client.submit(scope, batch);
        } catch (MemoryClientException | RuntimeException e) {
            LOG.warn("Discarding {} turns for user {}: submission failed: {}", batch.size(), scope.userId(), e.getMessage());
            Map<String, Object> attributes = attributes("turns", batch.size());
            attributes.put("error", String.valueOf(e.getMessage()));
            report(MemoryEventSink.SUBMIT_FAILED, attributes);
            return null;
        }

        MemoryTask task = MemoryTask.pending(taskId, scope.userId(), scope.agentId(), clock.instant());
        LOG.info("Submitted {} turns for user {} as task {}", batch.size(), scope.userId(), taskId);
        Map<String, Object> attributes = attributes("turns", batch.size());
        attributes.put("task_id", taskId);
        report(MemoryEventSink.SUBMITTED, attributes);

        return new TaskTracker(
            task,
            client,
            scope,
            settings.pollPolicy(),
            scheduler,
            clock,
            random,
            retrievalSequence::incrementAndGet
        );
    }

    private void registerSubmitted(TaskTracker tracker) {
        synchronized (trackerLock) {
            submissionsInFlight--;
            if (tracker == null) {
                return;
            }
            trackers.add(tracker);
            if (abandonNewTrackers) {
                tracker.abandon("session closed before the task could be tracked");
            }
        }
    }

    private CompletableFuture<Void> track(TaskTracker tracker) {
        if (tracker == null) {
            return CompletableFuture.completedFuture(null);
        }
        return tracker.start().thenAccept(outcome -> {
            trackers.remove(tracker);
            try {
                if (outcome.succeeded()) {
                    onTrackerCompleted(outcome);
                } else {
                    onTrackerFailed(outcome);
                }
            } catch (RuntimeException e) {
                LOG.error("Could not apply result of memory task {}", outcome.task().taskId(), e);
            }
        });
    }

    private void onTrackerCompleted(TrackerOutcome outcome) {
        MemoryTask task = outcome.task();
        logCategories(outcome.categories());
        SystemPrompt prompt = composer.compose(settings.baseInstructions(), outcome.categories());
        boolean changed = applyRetrieved(prompt, outcome.retrievalSequence());
        if (!changed) {
            LOG.debug("Memory task {} produced an unchanged prompt", task.taskId());
        }

        Map<String, Object> attributes = attributes("task_id", task.taskId());
        attributes.put("attempts", task.attempts());
        attributes.put("categories", prompt.integratedSummaries().size());
        attributes.put("latency_ms", Math.max(0L, clock.millis() - task.submittedAt().toEpochMilli()));
        report(changed ? MemoryEventSink.REFRESH_APPLIED : MemoryEventSink.REFRESH_UNCHANGED, attributes);
    }

    private void onTrackerFailed(TrackerOutcome outcome) {
        MemoryTask task = outcome.task();
        LOG.warn(
            "Memory task {} for user {} ended {} after {} polls ({}): {}",
            task.taskId(),
            task.userId(),
            task.state(),
            task.attempts(),
            outcome.failureReason(),
            outcome.detail()
        );
        Map<String, Object> attributes = attributes("task_id", task.taskId());
        attributes.put("attempts", task.attempts());
        attributes.put("state", task.state().name());
        attributes.put("reason", outcome.failureReason().name());
        attributes.put("detail", outcome.detail());
        report(MemoryEventSink.TRACKER_FAILED, attributes);
    }

    private int awaitOutstanding(Duration grace) {
        CompletableFuture<?>[] outstanding = pipelines.toArray(new CompletableFuture<?>[0]);
        if (outstanding.length == 0) {
            return 0;
        }
        try {
            CompletableFuture.allOf(outstanding).get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return 0;
        } catch (TimeoutException e) {
            LOG.info("Grace period of {} elapsed with {} memory tasks outstanding", grace, trackers.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOG.warn("Outstanding memory work failed during close", e.getCause());
        }

        List<TaskTracker> pending;
        int inFlight;
        synchronized (trackerLock) {
            abandonNewTrackers = true;
            pending = List.copyOf(trackers);
            inFlight = submissionsInFlight;
        }
        int abandoned = inFlight;
        for (TaskTracker tracker : pending) {
            if (tracker.abandon("session closed before the task resolved")) {
                abandoned++;
            }
        }
        if (inFlight > 0) {
            LOG.info("{} submissions for user {} were still in flight at close and will be abandoned", inFlight, settings.scope().userId());
        }
        return abandoned;
    }

    private void logCategories(List<CategorySummary> categories) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        for (CategorySummary category : categories) {
            LOG.debug("  category {}: {}", category.categoryName(), category.summary().map(this::preview).orElse("(no summary)"));
        }
    }

    private String preview(String value) {
        if (value.length() <= 50) {
            return value;
        }
        return value.substring(0, 50) + "...";
    }

    private void dropLateTurn(ConversationTurn turn) {
        LOG.warn("Dropping {} turn for user {}: session already closed", turn.role().wireValue(), settings.scope().userId());
        report(MemoryEventSink.TURNS_DROPPED, attributes("turns", 1));
    }

    private Map<String, Object> attributes(String key, Object value) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("user_id", settings.scope().userId());
        attributes.put("agent_id", settings.scope().agentId());
        attributes.put(key, value);
        return attributes;
    }

    private void report(String type, Map<String, Object> attributes) {
        if (events == null) {
            return;
        }
        try {
            events.record(type, attributes);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to record memory event {}", type, e);
        }
    }

    private static ScheduledExecutorService newScheduler(MemoryScope scope) {
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "memory-pipeline-" + scope.userId());
            thread.setDaemon(true);
            return thread;
        });
    }
}
