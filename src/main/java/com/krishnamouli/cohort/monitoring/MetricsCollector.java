package com.krishnamouli.cohort.monitoring;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Engine-wide counters plus per-experiment trackers.
 * Uses HdrHistogram for resolve latency.
 */
public class MetricsCollector {
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final Histogram resolveLatency;
    private final AtomicLong resolutions;
    private final AtomicLong participations;
    private final AtomicLong notFound;
    private final AtomicLong recordsWritten;
    private final AtomicLong recordsExisting;
    private final AtomicLong recordingFailures;
    private final AtomicLong recordingTimeouts;
    private final Map<String, ExperimentTracker> trackers;

    public MetricsCollector() {
        this.resolveLatency = new ConcurrentHistogram(3600000000L, 3); // 1 hour max, 3 significant digits
        this.resolutions = new AtomicLong(0);
        this.participations = new AtomicLong(0);
        this.notFound = new AtomicLong(0);
        this.recordsWritten = new AtomicLong(0);
        this.recordsExisting = new AtomicLong(0);
        this.recordingFailures = new AtomicLong(0);
        this.recordingTimeouts = new AtomicLong(0);
        this.trackers = new ConcurrentHashMap<>();
    }

    public void recordResolution(boolean inExperiment, long latencyNanos) {
        resolutions.incrementAndGet();
        if (inExperiment) {
            participations.incrementAndGet();
        }
        try {
            resolveLatency.recordValue(latencyNanos / 1000); // Convert to microseconds
        } catch (ArrayIndexOutOfBoundsException e) {
            logger.warn("Latency value out of bounds: {}ns", latencyNanos);
        }
    }

    public void recordNotFound() {
        notFound.incrementAndGet();
    }

    public void recordWritten() {
        recordsWritten.incrementAndGet();
    }

    public void recordExisting() {
        recordsExisting.incrementAndGet();
    }

    public void recordFailure() {
        recordingFailures.incrementAndGet();
    }

    /**
     * A caller stopped waiting for a write. The write's own outcome is counted
     * separately when it completes.
     */
    public void recordTimeout() {
        recordingTimeouts.incrementAndGet();
    }

    public ExperimentTracker tracker(String experimentKey) {
        return trackers.computeIfAbsent(experimentKey, ExperimentTracker::new);
    }

    public Collection<ExperimentTracker> getTrackers() {
        return new ArrayList<>(trackers.values());
    }

    public MetricsSnapshot getSnapshot() {
        Histogram latency = resolveLatency.copy();
        return new MetricsSnapshot(
                resolutions.get(),
                participations.get(),
                notFound.get(),
                recordsWritten.get(),
                recordsExisting.get(),
                recordingFailures.get(),
                recordingTimeouts.get(),
                latency.getValueAtPercentile(50.0) / 1000.0, // P50 in ms
                latency.getValueAtPercentile(95.0) / 1000.0, // P95 in ms
                latency.getValueAtPercentile(99.0) / 1000.0); // P99 in ms
    }

    public void reset() {
        resolveLatency.reset();
        resolutions.set(0);
        participations.set(0);
        notFound.set(0);
        recordsWritten.set(0);
        recordsExisting.set(0);
        recordingFailures.set(0);
        recordingTimeouts.set(0);
        trackers.clear();
    }

    public static class MetricsSnapshot {
        public final long resolutions;
        public final long participations;
        public final long notFound;
        public final long recordsWritten;
        public final long recordsExisting;
        public final long recordingFailures;
        public final long recordingTimeouts;
        public final double p50LatencyMs;
        public final double p95LatencyMs;
        public final double p99LatencyMs;

        public MetricsSnapshot(
                long resolutions, long participations, long notFound,
                long recordsWritten, long recordsExisting, long recordingFailures, long recordingTimeouts,
                double p50LatencyMs, double p95LatencyMs, double p99LatencyMs) {

            this.resolutions = resolutions;
            this.participations = participations;
            this.notFound = notFound;
            this.recordsWritten = recordsWritten;
            this.recordsExisting = recordsExisting;
            this.recordingFailures = recordingFailures;
            this.recordingTimeouts = recordingTimeouts;
            this.p50LatencyMs = p50LatencyMs;
            this.p95LatencyMs = p95LatencyMs;
            this.p99LatencyMs = p99LatencyMs;
        }

        public double getParticipationRate() {
            return resolutions == 0 ? 0.0 : (double) participations / resolutions;
        }

        public double getRecordingFailureRate() {
            long attempts = recordsWritten + recordsExisting + recordingFailures;
            return attempts == 0 ? 0.0 : (double) recordingFailures / attempts;
        }
    }
}
