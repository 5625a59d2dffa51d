package com.krishnamouli.cohort.recording;

import com.krishnamouli.cohort.exception.RecordingException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.RecordedAssignment;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.model.SubjectType;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persists the first assignment a subject was exposed to.
 *
 * <p>
 * Recording never fails the caller: if the store throws or does not answer
 * within the configured timeout, the assignment the caller already computed is
 * handed back unchanged. Store failures and slow writes are logged and counted
 * separately; a slow write that eventually succeeds still counts as written.
 */
public class AssignmentRecorder {
    private static final Logger logger = LoggerFactory.getLogger(AssignmentRecorder.class);

    private final AssignmentStore store;
    private final MetricsCollector metrics;
    private final long timeoutMillis;
    private final ExecutorService executor;

    public AssignmentRecorder(AssignmentStore store, MetricsCollector metrics, long timeoutMillis, int threads) {
        this.store = store;
        this.metrics = metrics;
        this.timeoutMillis = timeoutMillis;

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "cohort-recorder-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("Assignment recorder started: store={}, timeout={}ms, threads={}",
                store.getClass().getSimpleName(), timeoutMillis, threads);
    }

    public ExperimentAssignment recordIfAbsent(String subjectKey, ExperimentAssignment assignment) {
        return recordIfAbsent(new Subject(subjectKey, SubjectType.USER), assignment);
    }

    /**
     * Stores {@code assignment} for the subject unless a record already exists.
     *
     * <p>
     * The wait is bounded by the configured timeout. A write that outlives the
     * wait still completes in the background and is counted when it lands.
     *
     * @return the stored assignment, which is the earlier one if the subject was
     *         already recorded, or {@code assignment} itself if recording failed
     *         or did not finish in time
     */
    public ExperimentAssignment recordIfAbsent(Subject subject, ExperimentAssignment assignment) {
        RecordedAssignment candidate = RecordedAssignment.now(subject, assignment);
        CompletableFuture<RecordedAssignment> write = submit(candidate);
        try {
            RecordedAssignment stored = timeoutMillis > 0
                    ? write.get(timeoutMillis, TimeUnit.MILLISECONDS)
                    : write.get();
            return stored.getAssignment();
        } catch (TimeoutException e) {
            onTimeout(candidate);
        } catch (ExecutionException e) {
            // Already counted by the write itself
            logger.debug("Returning computed assignment after failed write: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while recording subject {} in {}",
                    candidate.getSubjectKey(), assignment.getExperimentKey());
        }
        return assignment;
    }

    /**
     * Fire-and-forget variant. The future never completes exceptionally; on
     * failure or timeout it completes with the assignment that was passed in.
     */
    public CompletableFuture<ExperimentAssignment> recordAsync(Subject subject, ExperimentAssignment assignment) {
        RecordedAssignment candidate = RecordedAssignment.now(subject, assignment);
        CompletableFuture<ExperimentAssignment> result = submit(candidate)
                .thenApply(RecordedAssignment::getAssignment);
        if (timeoutMillis > 0) {
            // Times out this view only; the write keeps going
            result = result.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
        }
        return result.exceptionally(e -> {
            if (unwrap(e) instanceof TimeoutException) {
                onTimeout(candidate);
            }
            return assignment;
        });
    }

    /**
     * Starts the store write. Metrics are settled by the write's own outcome,
     * independent of how long any caller waits for it.
     */
    private CompletableFuture<RecordedAssignment> submit(RecordedAssignment candidate) {
        return CompletableFuture
                .supplyAsync(() -> store.insertIfAbsent(candidate), executor)
                .whenComplete((stored, error) -> {
                    if (error != null) {
                        onFailure(candidate, asRecordingException(unwrap(error)));
                    } else {
                        onStored(candidate, stored);
                    }
                });
    }

    public Optional<RecordedAssignment> find(String subjectKey, String experimentKey) {
        return store.find(new AssignmentKey(subjectKey, experimentKey));
    }

    public int recordedCount() {
        return store.size();
    }

    public void shutdown() {
        logger.info("Assignment recorder shutting down");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        store.shutdown();
    }

    private void onStored(RecordedAssignment candidate, RecordedAssignment stored) {
        if (stored == candidate) {
            metrics.recordWritten();
            ExperimentAssignment assignment = stored.getAssignment();
            if (assignment.isInExperiment()) {
                metrics.tracker(assignment.getExperimentKey()).recordExposure(assignment.getVariant());
            }
            logger.debug("Recorded {}", stored);
        } else {
            metrics.recordExisting();
        }
    }

    private void onTimeout(RecordedAssignment candidate) {
        metrics.recordTimeout();
        logger.warn("Recording subject {} in {} did not finish within {}ms, returning computed assignment",
                candidate.getSubjectKey(), candidate.getAssignment().getExperimentKey(), timeoutMillis);
    }

    private void onFailure(RecordedAssignment candidate, RecordingException e) {
        metrics.recordFailure();
        logger.warn("Failed to record assignment for subject {} in {}: {}",
                candidate.getSubjectKey(), candidate.getAssignment().getExperimentKey(), e.getMessage(), e);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static RecordingException asRecordingException(Throwable cause) {
        if (cause instanceof RecordingException) {
            return (RecordingException) cause;
        }
        return new RecordingException("Assignment store failed", cause);
    }
}
