package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.exception.ExperimentNotFoundException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.model.RecordedAssignment;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.recording.AssignmentRecorder;
import com.krishnamouli.cohort.store.ConfigSnapshot;
import com.krishnamouli.cohort.store.ConfigurationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;

/**
 * Entry point for feature code: resolves, records exposures and counts
 * conversions, keeping metrics as it goes.
 */
public class ExperimentEngine {
    private static final Logger logger = LoggerFactory.getLogger(ExperimentEngine.class);

    private final ConfigurationStore store;
    private final AssignmentResolver resolver;
    private final AssignmentRecorder recorder;
    private final MetricsCollector metrics;

    public ExperimentEngine(ConfigurationStore store, AssignmentRecorder recorder, MetricsCollector metrics) {
        this.store = store;
        this.resolver = new AssignmentResolver(store);
        this.recorder = recorder;
        this.metrics = metrics;
    }

    /**
     * @throws ExperimentNotFoundException if the experiment is not published
     */
    public ExperimentAssignment resolve(String subjectKey, String experimentKey) {
        long start = System.nanoTime();
        try {
            ExperimentAssignment assignment = resolver.resolve(subjectKey, experimentKey);
            metrics.recordResolution(assignment.isInExperiment(), System.nanoTime() - start);
            return assignment;
        } catch (ExperimentNotFoundException e) {
            metrics.recordNotFound();
            throw e;
        }
    }

    public ExperimentAssignment resolve(Subject subject, String experimentKey) {
        return resolve(subject.getKey(), experimentKey);
    }

    /**
     * Resolves and records in one step, marking this call as the subject's
     * exposure. Returns the recorded assignment, so a subject keeps the variant
     * it first saw even if the configuration has changed since.
     */
    public ExperimentAssignment assign(Subject subject, String experimentKey) {
        ExperimentAssignment computed = resolve(subject, experimentKey);
        return recorder.recordIfAbsent(subject, computed);
    }

    /**
     * Like {@link #assign} but returns as soon as the assignment is computed;
     * recording continues in the background.
     */
    public ExperimentAssignment assignAsync(Subject subject, String experimentKey) {
        ExperimentAssignment computed = resolve(subject, experimentKey);
        recorder.recordAsync(subject, computed);
        return computed;
    }

    public ExperimentAssignment recordIfAbsent(String subjectKey, ExperimentAssignment assignment) {
        return recorder.recordIfAbsent(subjectKey, assignment);
    }

    public ExperimentAssignment recordIfAbsent(Subject subject, ExperimentAssignment assignment) {
        return recorder.recordIfAbsent(subject, assignment);
    }

    public Optional<RecordedAssignment> findRecorded(String subjectKey, String experimentKey) {
        return recorder.find(subjectKey, experimentKey);
    }

    /**
     * Counts an outcome event (for example {@code reservation_success}) against
     * the subject's variant. The recorded assignment is preferred over a fresh
     * resolution so conversions land on the arm the subject was exposed to.
     *
     * @param latencyMillis duration of the converting operation, or 0 if not measured
     * @return false if the subject is not in the experiment, in which case nothing is counted
     */
    public boolean recordConversion(String experimentKey, String subjectKey, String event, long latencyMillis) {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("Conversion event must not be blank");
        }
        ExperimentAssignment assignment = recorder.find(subjectKey, experimentKey)
                .map(RecordedAssignment::getAssignment)
                .orElseGet(() -> resolver.resolve(subjectKey, experimentKey));
        if (!assignment.isInExperiment()) {
            logger.debug("Ignoring conversion {} for {} outside experiment {}", event, subjectKey, experimentKey);
            return false;
        }
        metrics.tracker(experimentKey).recordConversion(assignment.getVariant(), event, latencyMillis * 1_000_000L);
        return true;
    }

    public ConfigSnapshot publish(Collection<ExperimentConfig> experiments) {
        return store.publish(experiments);
    }

    public ConfigSnapshot snapshot() {
        return store.snapshot();
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public int recordedCount() {
        return recorder.recordedCount();
    }
}
