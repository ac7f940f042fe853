package io.github.drompincen.annostore.runtime.task;

import io.github.drompincen.annostore.protocol.api.TaskState;
import io.github.drompincen.annostore.protocol.api.TaskSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A fire-and-forget unit of work with pollable status.
 *
 * <p>State moves CREATED → RUNNING → DONE or FAILED and never leaves a terminal state.
 * Subclasses implement {@link #execute(Progress)} and report through the {@link Progress}
 * handle; {@link #summary()} can be called from any thread at any time and returns an
 * immutable snapshot.
 *
 * <p>A finished task stays retrievable until {@code finishedAt + timeToLive}; evicting it is
 * up to whichever registry holds it.
 */
public abstract class BackgroundTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTask.class);

    private final String id = UUID.randomUUID().toString();
    private final Clock clock;
    private final Duration timeToLive;
    private final Instant createdAt;

    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.CREATED);
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private final AtomicInteger totalUnits = new AtomicInteger();
    private final AtomicInteger unitsProcessed = new AtomicInteger();
    private final AtomicInteger resultCount = new AtomicInteger();
    private final ConcurrentLinkedQueue<Map<String, Object>> results = new ConcurrentLinkedQueue<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final Progress progress = new Progress();

    protected BackgroundTask(Duration timeToLive, Clock clock) {
        this.timeToLive = timeToLive;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    /** The operation-specific routine. Anything it throws, errors included, marks the whole task FAILED. */
    protected abstract void execute(Progress progress) throws Exception;

    @Override
    public final void run() {
        if (!state.compareAndSet(TaskState.CREATED, TaskState.RUNNING)) {
            log.warn("Task {} already started (state {}), not running it again", id, state.get());
            return;
        }
        startedAt = clock.instant();
        TaskState outcome = TaskState.FAILED;
        try {
            execute(progress);
            outcome = TaskState.DONE;
        } catch (Throwable t) {
            // Errors included: a task must never stay RUNNING
            log.error("Task {} failed", id, t);
            errors.add(describe(t));
        } finally {
            finishedAt = clock.instant();
            state.set(outcome);
            log.debug("Task {} finished with state {} in {}ms", id, outcome,
                    finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        }
    }

    /**
     * Marks a task that never got to run as FAILED, e.g. when the worker pool rejected it.
     */
    public void abort(String reason) {
        Instant now = clock.instant();
        if (state.compareAndSet(TaskState.CREATED, TaskState.FAILED)) {
            startedAt = now;
            finishedAt = now;
            errors.add(reason);
        }
    }

    /**
     * Runs {@code work} for every unit, one at a time. A unit that throws contributes one error
     * line and the remaining units still run.
     */
    protected <U> void forEachUnit(Collection<U> units, UnitWork<U> work) {
        progress.addTotalUnits(units.size());
        for (U unit : units) {
            try {
                work.process(unit, progress);
            } catch (Throwable t) {
                log.warn("Task {}: unit {} failed: {}", id, unit, t.toString());
                progress.addError(unit + ": " + describe(t));
            } finally {
                progress.unitProcessed();
            }
        }
    }

    public TaskSummary summary() {
        // state first: finishedAt is written before the terminal state is published
        TaskState current = state.get();
        Instant start = startedAt;
        Instant end = finishedAt;
        long elapsed = start == null ? 0L
                : (end != null ? end : clock.instant()).toEpochMilli() - start.toEpochMilli();
        return new TaskSummary(id, current, createdAt, start, end, expiresAfter(),
                totalUnits.get(), unitsProcessed.get(), resultCount.get(),
                List.copyOf(errors), elapsed);
    }

    /** Snapshot of the results gathered so far, in the order they were added. */
    public List<Map<String, Object>> results() {
        return List.copyOf(results);
    }

    public String getId() { return id; }

    public TaskState getState() { return state.get(); }

    public Instant getCreatedAt() { return createdAt; }

    public boolean isFinished() {
        return state.get().isTerminal();
    }

    /** Null while the task has not finished yet. */
    public Instant expiresAfter() {
        Instant end = finishedAt;
        return end == null ? null : end.plus(timeToLive);
    }

    public boolean isExpired() {
        Instant expiry = expiresAfter();
        return isFinished() && expiry != null && clock.instant().isAfter(expiry);
    }

    private static String describe(Throwable t) {
        return t.getClass().getSimpleName() + ": " + (t.getMessage() != null ? t.getMessage() : "");
    }

    @FunctionalInterface
    public interface UnitWork<U> {
        void process(U unit, Progress progress) throws Exception;
    }

    /**
     * Write side of the task status, handed to {@link #execute(Progress)}.
     */
    public final class Progress {

        private Progress() {}

        public void addTotalUnits(int units) {
            totalUnits.addAndGet(units);
        }

        public void unitProcessed() {
            unitsProcessed.incrementAndGet();
        }

        public void addResult(Map<String, Object> result) {
            results.add(result);
            resultCount.incrementAndGet();
        }

        public void addResults(Collection<? extends Map<String, Object>> found) {
            found.forEach(this::addResult);
        }

        public void addError(String error) {
            errors.add(error);
        }
    }
}
