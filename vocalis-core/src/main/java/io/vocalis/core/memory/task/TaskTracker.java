package io.vocalis.core.memory.task;

import io.vocalis.core.memory.client.MemoryClient;
import io.vocalis.core.memory.client.MemoryClientException;
import io.vocalis.core.memory.client.RemoteTaskStatus;
import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.MemoryScope;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one submitted {@link MemoryTask} to a terminal state by polling its remote status on the
 * supplied scheduler.
 *
 * <p>{@code PENDING} moves to {@code COMPLETED}, {@code FAILED} or {@code ABANDONED} exactly once; the
 * move is a compare-and-set on the task snapshot, so a poll racing {@link #abandon(String)} can never
 * produce a second transition. Once terminal no further poll is scheduled. After {@code COMPLETED} the
 * tracker retrieves the default categories exactly once and completes {@link #outcome()} with them.
 */
public final class TaskTracker {
    private static final Logger LOG = LoggerFactory.getLogger(TaskTracker.class);

    private final MemoryClient client;
    private final MemoryScope scope;
    private final PollPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Random random;
    private final LongSupplier retrievalSequence;
    private final Instant deadline;
    private final AtomicReference<MemoryTask> task;
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<TrackerOutcome> outcome = new CompletableFuture<>();
    private final Object pollLock = new Object();
    private ScheduledFuture<?> nextPoll;

    public TaskTracker(
        MemoryTask task,
        MemoryClient client,
        MemoryScope scope,
        PollPolicy policy,
        ScheduledExecutorService scheduler,
        Clock clock,
        Random random
    ) {
        this(task, client, scope, policy, scheduler, clock, random, new AtomicLong()::incrementAndGet);
    }

    /**
     * @param retrievalSequence stamps each successful retrieval the moment it returns; trackers that share
     *     a supplier can be ordered by when their categories were read
     */
    public TaskTracker(
        MemoryTask task,
        MemoryClient client,
        MemoryScope scope,
        PollPolicy policy,
        ScheduledExecutorService scheduler,
        Clock clock,
        Random random,
        LongSupplier retrievalSequence
    ) {
        Objects.requireNonNull(task, "task must not be null");
        if (task.state() != TaskState.PENDING) {
            throw new IllegalArgumentException("task must start out pending, was " + task.state());
        }
        this.task = new AtomicReference<>(task);
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = random == null ? new Random() : random;
        this.retrievalSequence = Objects.requireNonNull(retrievalSequence, "retrievalSequence must not be null");
        this.deadline = task.submittedAt().plus(policy.maxWait());
    }

    /** Schedules the first poll. Calling it again returns the same outcome without rescheduling. */
    public CompletableFuture<TrackerOutcome> start() {
        if (started.compareAndSet(false, true)) {
            scheduleNextPoll();
        }
        return outcome;
    }

    public CompletableFuture<TrackerOutcome> outcome() {
        return outcome;
    }

    public MemoryTask task() {
        return task.get();
    }

    /**
     * Moves a still pending task to {@code ABANDONED} and cancels its next poll.
     *
     * @return false when the task had already reached a terminal state
     */
    public boolean abandon(String detail) {
        return finish(TaskState.ABANDONED, FailureReason.CLOSED, detail);
    }

    private void poll() {
        MemoryTask current = task.updateAndGet(t -> t.state().isTerminal() ? t : t.withAttempt());
        if (current.state().isTerminal()) {
            return;
        }

        RemoteTaskStatus status = null;
        try {
            status = client.status(current.taskId());
        } catch (MemoryClientException e) {
            if (!e.retryable()) {
                finish(TaskState.FAILED, FailureReason.SERVICE_FAILURE, e.getMessage());
                return;
            }
            LOG.debug("Status poll {} for task {} failed, will retry: {}", current.attempts(), current.taskId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Status poll {} for task {} raised an unexpected error", current.attempts(), current.taskId(), e);
        }

        if (status == RemoteTaskStatus.COMPLETED) {
            retrieveOnce();
            return;
        }
        if (status == RemoteTaskStatus.FAILED) {
            finish(TaskState.FAILED, FailureReason.SERVICE_FAILURE, "memory service reported the task as failed");
            return;
        }
        if (current.attempts() >= policy.maxAttempts()) {
            finish(TaskState.ABANDONED, FailureReason.TIMEOUT, "still pending after " + current.attempts() + " polls");
            return;
        }
        if (!clock.instant().isBefore(deadline)) {
            finish(TaskState.ABANDONED, FailureReason.TIMEOUT, "still pending after " + policy.maxWait());
            return;
        }
        scheduleNextPoll();
    }

    private void retrieveOnce() {
        MemoryTask completed = transition(TaskState.COMPLETED);
        if (completed == null) {
            return;
        }
        LOG.debug("Task {} completed after {} polls, retrieving categories for user {}", completed.taskId(), completed.attempts(), scope.userId());
        try {
            List<CategorySummary> categories = client.retrieveDefaultCategories(scope);
            outcome.complete(TrackerOutcome.completed(completed, categories, retrievalSequence.getAsLong()));
        } catch (MemoryClientException | RuntimeException e) {
            outcome.complete(TrackerOutcome.failed(completed, FailureReason.RETRIEVAL_FAILURE, e.getMessage()));
        }
    }

    private boolean finish(TaskState state, FailureReason reason, String detail) {
        MemoryTask finished = transition(state);
        if (finished == null) {
            return false;
        }
        cancelNextPoll();
        outcome.complete(TrackerOutcome.failed(finished, reason, detail));
        return true;
    }

    private MemoryTask transition(TaskState next) {
        while (true) {
            MemoryTask current = task.get();
            if (current.state().isTerminal()) {
                return null;
            }
            MemoryTask updated = current.withState(next);
            if (task.compareAndSet(current, updated)) {
                return updated;
            }
        }
    }

    private void scheduleNextPoll() {
        synchronized (pollLock) {
            MemoryTask current = task.get();
            if (current.state().isTerminal()) {
                return;
            }
            long delayMs = policy.delayMillis(current.attempts(), random.nextDouble());
            try {
                nextPoll = scheduler.schedule(this::pollSafely, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                finish(TaskState.ABANDONED, FailureReason.CLOSED, "scheduler is shut down");
            }
        }
    }

    private void cancelNextPoll() {
        synchronized (pollLock) {
            if (nextPoll != null) {
                nextPoll.cancel(false);
                nextPoll = null;
            }
        }
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            LOG.error("Tracker for task {} failed unexpectedly", task.get().taskId(), e);
            finish(TaskState.FAILED, FailureReason.SERVICE_FAILURE, String.valueOf(e.getMessage()));
        }
    }
}
