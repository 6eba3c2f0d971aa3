package io.vocalis.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.vocalis.core.memory.client.DisabledMemoryClient;
import io.vocalis.core.memory.client.RemoteTaskStatus;
import io.vocalis.core.memory.prompt.PromptComposer;
import io.vocalis.core.memory.prompt.SystemPrompt;
import io.vocalis.core.memory.task.PollPolicy;
import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import io.vocalis.core.observability.MemoryEventSink;
import io.vocalis.core.session.InMemoryLiveSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryCoordinatorTest {
    private static final String BASE = "You are a helpful voice assistant.";
    private static final MemoryScope SCOPE = MemoryScope.of("user_123", "assistant_001");

    private ScheduledExecutorService scheduler;
    private FakeMemoryClient client;
    private InMemoryLiveSession session;
    private List<String> events;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        client = new FakeMemoryClient();
        session = new InMemoryLiveSession("");
        events = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldStartWithBaseInstructions() {
        MemoryCoordinator coordinator = coordinator(4, Duration.ofSeconds(1));

        assertThat(session.currentInstructions()).isEqualTo(BASE);
        assertThat(coordinator.currentPrompt().text()).isEqualTo(session.currentInstructions());
        assertThat(coordinator.currentPrompt().hasMemory()).isFalse();
        assertThat(coordinator.applyPrompt(SystemPrompt.base(BASE))).isFalse();
    }

    @Test
    void shouldSubmitOnEveryThresholdMultipleAndOnClose() {
        MemoryCoordinator coordinator = coordinator(3, Duration.ofSeconds(5));
        List<ConversationTurn> appended = new ArrayList<>();

        for (int i = 1; i <= 7; i++) {
            ConversationTurn turn = ConversationTurn.user("turn " + i, Instant.EPOCH);
            appended.add(turn);
            coordinator.onTurn(turn);
            assertThat(coordinator.bufferedTurns()).isEqualTo(i % 3);
        }
        CloseReport report = coordinator.onClose();

        assertThat(report.finalBatchSize()).isEqualTo(1);
        assertThat(client.submissions).hasSize(3);
        assertThat(client.submissions).extracting(List::size).containsExactlyInAnyOrder(3, 3, 1);
        assertThat(client.submittedTurns()).containsExactlyInAnyOrderElementsOf(appended);
        for (List<ConversationTurn> batch : client.submissions) {
            assertThat(appended).containsSubsequence(batch);
        }
    }

    @Test
    void closeWithEmptyBufferShouldNotSubmit() {
        MemoryCoordinator coordinator = coordinator(2, Duration.ofSeconds(1));
        coordinator.onTurn(ConversationTurn.user("a", Instant.EPOCH));
        coordinator.onTurn(ConversationTurn.assistant("b", Instant.EPOCH));

        CloseReport report = coordinator.onClose();

        assertThat(report.finalBatchSize()).isZero();
        assertThat(client.submissions).hasSize(1);
    }

    @Test
    void failedSubmissionShouldDiscardItsBatchWithoutResubmitting() {
        client.failSubmissionsWhen(batch -> batch.stream().anyMatch(t -> t.text().startsWith("bad")));
        MemoryCoordinator coordinator = coordinator(2, Duration.ofSeconds(5));

        coordinator.onTurn(ConversationTurn.user("bad 1", Instant.EPOCH));
        coordinator.onTurn(ConversationTurn.assistant("bad 2", Instant.EPOCH));
        coordinator.onTurn(ConversationTurn.user("good 1", Instant.EPOCH));
        coordinator.onTurn(ConversationTurn.assistant("good 2", Instant.EPOCH));
        coordinator.onClose();

        assertThat(client.submittedTurns()).extracting(ConversationTurn::text).containsExactly("good 1", "good 2");
        assertThat(events).contains(MemoryEventSink.SUBMIT_FAILED, MemoryEventSink.SUBMITTED);
        assertThat(session.currentInstructions()).isEqualTo(BASE);
    }

    @Test
    void completedTaskShouldSwapComposedPromptIntoSession() throws Exception {
        client.script("T-hello", RemoteTaskStatus.PENDING, RemoteTaskStatus.PENDING, RemoteTaskStatus.COMPLETED)
            .categories(call -> List.of(
                new CategorySummary("hobbies", ""),
                new CategorySummary("preferences", "likes tea")
            ));
        MemoryCoordinator coordinator = coordinator(2, Duration.ofSeconds(5));

        coordinator.onTurn(ConversationTurn.user("hello", Instant.EPOCH));
        coordinator.onTurn(ConversationTurn.assistant("hi there", Instant.EPOCH));
        coordinator.onClose();

        assertThat(session.currentInstructions()).isEqualTo(
            BASE + "\n\nHere's what you know about the user:\n\n**preferences:** likes tea"
        );
        assertThat(coordinator.currentPrompt().integratedSummaries()).extracting(CategorySummary::categoryName)
            .containsExactly("preferences");
        assertThat(client.statusCalls.get()).isEqualTo(3);
        assertThat(client.retrievals.get()).isEqualTo(1);
        assertThat(events).contains(MemoryEventSink.REFRESH_APPLIED);
    }

    @Test
    void identicalRefreshShouldBeRecordedAsUnchanged() throws Exception {
        client.categories(call -> List.of(new CategorySummary("preferences", "likes tea")));
        MemoryCoordinator coordinator = coordinator(10, Duration.ofSeconds(5));

        coordinator.onTurn(ConversationTurn.user("one", Instant.EPOCH));
        coordinator.submitAndTrack().get(5, TimeUnit.SECONDS);
        String afterFirst = session.currentInstructions();
        coordinator.onTurn(ConversationTurn.user("two", Instant.EPOCH));
        coordinator.onClose();

        assertThat(session.currentInstructions()).isEqualTo(afterFirst);
        assertThat(events).containsSubsequence(MemoryEventSink.REFRESH_APPLIED, MemoryEventSink.REFRESH_UNCHANGED);
    }

    @Test
    void laterCompletionShouldWinEvenWhenSubmittedEarlier() throws Exception {
        client.hold("T-first", RemoteTaskStatus.PENDING)
            .categories(call -> List.of(new CategorySummary("mood", call == 1 ? "from second batch" : "from first batch")));
        MemoryCoordinator coordinator = coordinator(10, Duration.ofSeconds(5));

        coordinator.onTurn(ConversationTurn.user("first", Instant.EPOCH));
        CompletableFuture<Void> firstPipeline = coordinator.submitAndTrack();
        coordinator.onTurn(ConversationTurn.user("second", Instant.EPOCH));
        coordinator.submitAndTrack().get(5, TimeUnit.SECONDS);

        assertThat(session.currentInstructions()).contains("from second batch");
        assertThat(firstPipeline).isNotDone();

        client.release("T-first");
        firstPipeline.get(5, TimeUnit.SECONDS);

        assertThat(session.currentInstructions()).contains("from first batch").doesNotContain("from second batch");
    }

    @Test
    void failedTaskShouldLeaveLastAppliedPrompt() throws Exception {
        client.categories(call -> List.of(new CategorySummary("work", "nurse")));
        MemoryCoordinator coordinator = coordinator(10, Duration.ofSeconds(5));
        coordinator.onTurn(ConversationTurn.user("ok", Instant.EPOCH));
        coordinator.submitAndTrack().get(5, TimeUnit.SECONDS);
        String applied = session.currentInstructions();

        client.script("T-broken", RemoteTaskStatus.FAILED);
        coordinator.onTurn(ConversationTurn.user("broken", Instant.EPOCH));
        coordinator.submitAndTrack().get(5, TimeUnit.SECONDS);

        assertThat(session.currentInstructions()).isEqualTo(applied);
        assertThat(events).contains(MemoryEventSink.TRACKER_FAILED);
    }

    @Test
    void closeShouldAbandonTasksStillPendingAfterGracePeriod() {
        client.defaultStatus(RemoteTaskStatus.PENDING);
        MemoryCoordinator coordinator = coordinator(10, Duration.ofMillis(100));
        coordinator.onTurn(ConversationTurn.user("never finishes", Instant.EPOCH));

        CloseReport report = coordinator.onClose();

        assertThat(report.finalBatchSize()).isEqualTo(1);
        assertThat(report.abandonedTasks()).isEqualTo(1);
        assertThat(coordinator.outstandingTasks()).isEmpty();
        assertThat(session.currentInstructions()).isEqualTo(BASE);
        assertThat(events).contains(MemoryEventSink.TRACKER_FAILED);
    }

    @Test
    void turnsAfterCloseShouldBeDropped() {
        MemoryCoordinator coordinator = coordinator(1, Duration.ofSeconds(1));
        coordinator.onClose();

        coordinator.onTurn(ConversationTurn.user("late", Instant.EPOCH));

        assertThat(coordinator.isClosed()).isTrue();
        assertThat(client.submissions).isEmpty();
        assertThat(events).containsExactly(MemoryEventSink.TURNS_DROPPED);
        assertThat(coordinator.onClose()).isEqualTo(new CloseReport(0, 0));
    }

    @Test
    void turnRacingCloseShouldBeSubmittedOrReportedAsDropped() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int run = 0; run < 200; run++) {
                FakeMemoryClient runClient = new FakeMemoryClient();
                List<String> runEvents = new CopyOnWriteArrayList<>();
                MemoryCoordinator coordinator = new MemoryCoordinator(
                    runClient,
                    new InMemoryLiveSession(""),
                    settings(10, Duration.ofSeconds(5)),
                    (type, attributes) -> runEvents.add(type),
                    scheduler,
                    Clock.systemUTC(),
                    new Random(run)
                );
                CyclicBarrier start = new CyclicBarrier(2);
                ConversationTurn turn = ConversationTurn.user("racing " + run, Instant.EPOCH);

                Future<Object> turnCall = callers.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    coordinator.onTurn(turn);
                    return null;
                });
                Future<CloseReport> closeCall = callers.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    return coordinator.onClose();
                });
                turnCall.get(10, TimeUnit.SECONDS);
                CloseReport report = closeCall.get(10, TimeUnit.SECONDS);

                boolean submitted = runClient.submittedTurns().contains(turn);
                boolean dropped = runEvents.contains(MemoryEventSink.TURNS_DROPPED);
                assertThat(submitted ^ dropped).as("run %d submitted=%s dropped=%s", run, submitted, dropped).isTrue();
                assertThat(report.finalBatchSize()).isEqualTo(submitted ? 1 : 0);
                assertThat(coordinator.bufferedTurns()).isZero();
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void submissionStillInFlightAtCloseShouldCountAsAbandoned() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        client.gateSubmissions(gate);
        MemoryCoordinator coordinator = coordinator(10, Duration.ofMillis(50));
        coordinator.onTurn(ConversationTurn.user("slow", Instant.EPOCH));

        CloseReport report = coordinator.onClose();
        gate.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (!events.contains(MemoryEventSink.TRACKER_FAILED) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(report.abandonedTasks()).isEqualTo(1);
        assertThat(events).containsSubsequence(MemoryEventSink.SUBMITTED, MemoryEventSink.TRACKER_FAILED);
        assertThat(client.statusCalls.get()).isZero();
        assertThat(coordinator.outstandingTasks()).isEmpty();
        assertThat(session.currentInstructions()).isEqualTo(BASE);
    }

    @Test
    void olderRetrievalShouldNotReplaceNewerOne() {
        MemoryCoordinator coordinator = coordinator(4, Duration.ofSeconds(1));
        PromptComposer composer = new PromptComposer();
        SystemPrompt newer = composer.compose(BASE, List.of(new CategorySummary("mood", "newer view")));
        SystemPrompt older = composer.compose(BASE, List.of(new CategorySummary("mood", "older view")));

        assertThat(coordinator.applyRetrieved(newer, 2)).isTrue();
        assertThat(coordinator.applyRetrieved(older, 1)).isFalse();

        assertThat(session.currentInstructions()).contains("newer view").doesNotContain("older view");
        assertThat(coordinator.currentPrompt()).isEqualTo(newer);
    }

    @Test
    void primeShouldApplyExistingMemoriesAndFallBackOnFailure() throws Exception {
        client.categories(call -> List.of(new CategorySummary("name", "Alex")));
        MemoryCoordinator coordinator = coordinator(4, Duration.ofSeconds(1));

        SystemPrompt primed = coordinator.primeInstructions().get(5, TimeUnit.SECONDS);

        assertThat(primed.hasMemory()).isTrue();
        assertThat(session.currentInstructions()).contains("**name:** Alex");

        InMemoryLiveSession other = new InMemoryLiveSession("");
        MemoryCoordinator disabled = new MemoryCoordinator(
            new DisabledMemoryClient("missing API key"),
            other,
            settings(4, Duration.ofSeconds(1)),
            null,
            scheduler,
            Clock.systemUTC(),
            new Random(7)
        );
        assertThat(disabled.primeInstructions().get(5, TimeUnit.SECONDS).text()).isEqualTo(BASE);
        assertThat(other.currentInstructions()).isEqualTo(BASE);
    }

    @Test
    void disabledClientShouldNeverReachTheConversation() {
        MemoryCoordinator coordinator = new MemoryCoordinator(
            new DisabledMemoryClient("missing API key"),
            session,
            settings(1, Duration.ofSeconds(1)),
            (type, attributes) -> {
                throw new IllegalStateException("sink down");
            },
            scheduler,
            Clock.systemUTC(),
            new Random(7)
        );

        coordinator.onTurn(ConversationTurn.user("hello", Instant.EPOCH));
        CloseReport report = coordinator.onClose();

        assertThat(report.abandonedTasks()).isZero();
        assertThat(session.currentInstructions()).isEqualTo(BASE);
    }

    @Test
    void readersShouldOnlyEverSeeWholePrompts() throws Exception {
        MemoryCoordinator coordinator = coordinator(4, Duration.ofSeconds(1));
        SystemPrompt withMemory = new PromptComposer()
            .compose(BASE, List.of(new CategorySummary("profile", "x".repeat(10_000))));
        SystemPrompt plain = SystemPrompt.base(BASE);
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<String> torn = new AtomicReference<>();

        List<Thread> readers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Thread reader = new Thread(() -> {
                while (running.get()) {
                    String seen = session.currentInstructions();
                    if (!seen.equals(withMemory.text()) && !seen.equals(plain.text())) {
                        torn.compareAndSet(null, seen);
                    }
                }
            });
            reader.start();
            readers.add(reader);
        }
        for (int i = 0; i < 2_000; i++) {
            coordinator.applyPrompt(i % 2 == 0 ? withMemory : plain);
        }
        running.set(false);
        for (Thread reader : readers) {
            reader.join(5_000);
        }

        assertThat(torn.get()).isNull();
    }

    private MemoryCoordinator coordinator(int threshold, Duration grace) {
        return new MemoryCoordinator(
            client,
            session,
            settings(threshold, grace),
            (type, attributes) -> events.add(type),
            scheduler,
            Clock.systemUTC(),
            new Random(7)
        );
    }

    private MemorySettings settings(int threshold, Duration grace) {
        return new MemorySettings(
            SCOPE,
            BASE,
            null,
            threshold,
            PollPolicy.fixed(Duration.ofMillis(5), 1_000, Duration.ofMinutes(1)),
            grace
        );
    }
}
