package io.vocalis.core.memory.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.vocalis.core.memory.client.MemoryClient;
import io.vocalis.core.memory.client.MemoryClientException;
import io.vocalis.core.memory.client.MemoryServiceException;
import io.vocalis.core.memory.client.MemoryTransportException;
import io.vocalis.core.memory.client.RemoteTaskStatus;
import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskTrackerTest {
    private static final MemoryScope SCOPE = MemoryScope.of("user_123", "assistant_001");
    private static final PollPolicy FAST = PollPolicy.fixed(Duration.ofMillis(5), 50, Duration.ofMinutes(1));

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(1);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldRetrieveCategoriesOnceAfterCompletion() throws Exception {
        ScriptedClient client = new ScriptedClient(
            List.of(new CategorySummary("preferences", "Likes tea")),
            "pending", "pending", "completed"
        );
        TaskTracker tracker = tracker(client, FAST, Clock.systemUTC());

        TrackerOutcome outcome = tracker.start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.categories()).extracting(CategorySummary::categoryName).containsExactly("preferences");
        assertThat(outcome.task().state()).isEqualTo(TaskState.COMPLETED);
        assertThat(outcome.task().attempts()).isEqualTo(3);
        assertThat(client.retrievals.get()).isEqualTo(1);
        assertThat(tracker.start()).isSameAs(tracker.outcome());
    }

    @Test
    void sharedSequenceShouldStampRetrievalsInTheOrderTheyReturn() throws Exception {
        AtomicLong sequence = new AtomicLong(10);
        List<CategorySummary> none = List.of();
        MemoryTask first = MemoryTask.pending("task-a", "user_123", "assistant_001", Instant.now());
        MemoryTask second = MemoryTask.pending("task-b", "user_123", "assistant_001", Instant.now());

        TrackerOutcome earlier = new TaskTracker(first, new ScriptedClient(none, "completed"), SCOPE, FAST, scheduler,
            Clock.systemUTC(), new Random(3), sequence::incrementAndGet).start().get(5, TimeUnit.SECONDS);
        TrackerOutcome later = new TaskTracker(second, new ScriptedClient(none, "completed"), SCOPE, FAST, scheduler,
            Clock.systemUTC(), new Random(3), sequence::incrementAndGet).start().get(5, TimeUnit.SECONDS);

        assertThat(earlier.retrievalSequence()).isEqualTo(11);
        assertThat(later.retrievalSequence()).isEqualTo(12);
        assertThat(tracker(new ScriptedClient(none, "failed"), FAST, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS)
            .retrievalSequence()).isZero();
    }

    @Test
    void shouldFailWhenServiceReportsFailure() throws Exception {
        ScriptedClient client = new ScriptedClient(List.of(), "pending", "failed");

        TrackerOutcome outcome = tracker(client, FAST, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failureReason()).isEqualTo(FailureReason.SERVICE_FAILURE);
        assertThat(outcome.task().state()).isEqualTo(TaskState.FAILED);
        assertThat(client.retrievals.get()).isZero();
    }

    @Test
    void shouldAbandonAfterMaxAttemptsAndStopPolling() throws Exception {
        ScriptedClient client = new ScriptedClient(List.of(), "pending");
        PollPolicy policy = PollPolicy.fixed(Duration.ofMillis(5), 4, Duration.ofMinutes(1));

        TrackerOutcome outcome = tracker(client, policy, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS);
        Thread.sleep(50);

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.TIMEOUT);
        assertThat(outcome.task().state()).isEqualTo(TaskState.ABANDONED);
        assertThat(client.statusCalls.get()).isEqualTo(4);
    }

    @Test
    void shouldAbandonOnceWaitDeadlinePassed() throws Exception {
        ScriptedClient client = new ScriptedClient(List.of(), "pending");
        Clock later = Clock.fixed(Instant.parse("2026-01-01T00:10:00Z"), ZoneOffset.UTC);
        MemoryTask task = MemoryTask.pending("task-1", "user_123", "assistant_001", Instant.parse("2026-01-01T00:00:00Z"));
        TaskTracker tracker = new TaskTracker(task, client, SCOPE, FAST, scheduler, later, new Random(3));

        TrackerOutcome outcome = tracker.start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.TIMEOUT);
        assertThat(outcome.task().attempts()).isEqualTo(1);
    }

    @Test
    void shouldKeepPollingThroughTransientErrors() throws Exception {
        ScriptedClient client = new ScriptedClient(List.of(), "transport", "http503", "completed");

        TrackerOutcome outcome = tracker(client, FAST, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.task().attempts()).isEqualTo(3);
    }

    @Test
    void shouldFailOnNonRetryableStatusError() throws Exception {
        ScriptedClient client = new ScriptedClient(List.of(), "http404");

        TrackerOutcome outcome = tracker(client, FAST, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.SERVICE_FAILURE);
        assertThat(outcome.detail()).contains("404");
        assertThat(client.statusCalls.get()).isEqualTo(1);
    }

    @Test
    void shouldReportRetrievalFailureSeparately() throws Exception {
        ScriptedClient client = new ScriptedClient(null, "completed");

        TrackerOutcome outcome = tracker(client, FAST, Clock.systemUTC()).start().get(5, TimeUnit.SECONDS);

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.RETRIEVAL_FAILURE);
        assertThat(outcome.task().state()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    void abandonShouldWinOnlyWhilePending() throws Exception {
        ScriptedClient pendingClient = new ScriptedClient(List.of(), "pending");
        TaskTracker pending = tracker(pendingClient, FAST, Clock.systemUTC());
        pending.start();

        assertThat(pending.abandon("closing")).isTrue();
        assertThat(pending.abandon("again")).isFalse();
        TrackerOutcome outcome = pending.outcome().get(1, TimeUnit.SECONDS);
        assertThat(outcome.failureReason()).isEqualTo(FailureReason.CLOSED);
        int callsAtAbandon = pendingClient.statusCalls.get();
        Thread.sleep(50);
        assertThat(pendingClient.statusCalls.get()).isLessThanOrEqualTo(callsAtAbandon + 1);

        TaskTracker done = tracker(new ScriptedClient(List.of(), "completed"), FAST, Clock.systemUTC());
        done.start().get(5, TimeUnit.SECONDS);
        assertThat(done.abandon("too late")).isFalse();
        assertThat(done.task().state()).isEqualTo(TaskState.COMPLETED);
    }

    @Test
    void shouldAbandonWhenSchedulerIsShutDown() throws Exception {
        scheduler.shutdown();

        TrackerOutcome outcome = tracker(new ScriptedClient(List.of(), "pending"), FAST, Clock.systemUTC())
            .start()
            .get(1, TimeUnit.SECONDS);

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.CLOSED);
    }

    private TaskTracker tracker(MemoryClient client, PollPolicy policy, Clock clock) {
        MemoryTask task = MemoryTask.pending("task-1", "user_123", "assistant_001", clock.instant());
        return new TaskTracker(task, client, SCOPE, policy, scheduler, clock, new Random(3));
    }

    /** Serves scripted status answers; the last one repeats. A null category list makes retrieval fail. */
    private static final class ScriptedClient implements MemoryClient {
        final AtomicInteger statusCalls = new AtomicInteger();
        final AtomicInteger retrievals = new AtomicInteger();
        private final Deque<String> script;
        private final List<CategorySummary> categories;

        ScriptedClient(List<CategorySummary> categories, String... script) {
            this.categories = categories;
            this.script = new ArrayDeque<>(List.of(script));
        }

        @Override
        public String submit(MemoryScope scope, List<ConversationTurn> turns) {
            throw new UnsupportedOperationException();
        }

        @Override
        public synchronized RemoteTaskStatus status(String taskId) throws MemoryClientException {
            statusCalls.incrementAndGet();
            String next = script.size() == 1 ? script.peek() : script.poll();
            return switch (next) {
                case "transport" -> throw new MemoryTransportException("connection reset", new IOException("reset"));
                case "http503" -> throw new MemoryServiceException("HTTP 503", 503);
                case "http404" -> throw new MemoryServiceException("HTTP 404 for task", 404);
                default -> RemoteTaskStatus.parse(next);
            };
        }

        @Override
        public List<CategorySummary> retrieveDefaultCategories(MemoryScope scope) throws MemoryClientException {
            retrievals.incrementAndGet();
            if (categories == null) {
                throw new MemoryServiceException("HTTP 500", 500);
            }
            return categories;
        }
    }
}
