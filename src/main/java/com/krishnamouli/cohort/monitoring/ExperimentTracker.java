package com.krishnamouli.cohort.monitoring;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks exposures and conversion outcomes per variant of one experiment.
 * Raw counts and latency percentiles only; comparing variants is left to
 * downstream analysis.
 */
public class ExperimentTracker {
    private static final long MAX_LATENCY_MICROS = 3_600_000_000L;

    private final String experimentKey;
    private final Map<String, VariantCounters> variants;

    public ExperimentTracker(String experimentKey) {
        this.experimentKey = experimentKey;
        this.variants = new ConcurrentHashMap<>();
    }

    public void recordExposure(String variant) {
        counters(variant).exposures.incrementAndGet();
    }

    public void recordConversion(String variant, String event, long latencyNanos) {
        VariantCounters counters = counters(variant);
        counters.conversions.computeIfAbsent(event, e -> new AtomicLong()).incrementAndGet();
        if (latencyNanos > 0) {
            try {
                counters.latency.recordValue(latencyNanos / 1000); // microseconds
            } catch (ArrayIndexOutOfBoundsException e) {
                // Beyond an hour, not worth tracking
            }
        }
    }

    public String getExperimentKey() {
        return experimentKey;
    }

    public List<VariantMetrics> getMetrics() {
        List<VariantMetrics> result = new ArrayList<>();
        for (Map.Entry<String, VariantCounters> entry : new TreeMap<>(variants).entrySet()) {
            VariantCounters counters = entry.getValue();
            Map<String, Long> conversions = new TreeMap<>();
            counters.conversions.forEach((event, count) -> conversions.put(event, count.get()));
            Histogram latency = counters.latency.copy();
            result.add(new VariantMetrics(
                    entry.getKey(),
                    counters.exposures.get(),
                    Collections.unmodifiableMap(conversions),
                    latency.getValueAtPercentile(50.0) / 1000.0,
                    latency.getValueAtPercentile(99.0) / 1000.0));
        }
        return result;
    }

    private VariantCounters counters(String variant) {
        return variants.computeIfAbsent(variant, v -> new VariantCounters());
    }

    private static final class VariantCounters {
        final AtomicLong exposures = new AtomicLong();
        final Map<String, AtomicLong> conversions = new ConcurrentHashMap<>();
        final Histogram latency = new ConcurrentHistogram(MAX_LATENCY_MICROS, 3);
    }

    public static class VariantMetrics {
        public final String variant;
        public final long exposures;
        public final Map<String, Long> conversions;
        public final double p50LatencyMs;
        public final double p99LatencyMs;

        public VariantMetrics(String variant, long exposures, Map<String, Long> conversions,
                double p50LatencyMs, double p99LatencyMs) {
            this.variant = variant;
            this.exposures = exposures;
            this.conversions = conversions;
            this.p50LatencyMs = p50LatencyMs;
            this.p99LatencyMs = p99LatencyMs;
        }

        public long getConversions(String event) {
            return conversions.getOrDefault(event, 0L);
        }

        @Override
        public String toString() {
            return String.format("%s: exposures=%d, conversions=%s, p50=%.2fms, p99=%.2fms",
                    variant, exposures, conversions, p50LatencyMs, p99LatencyMs);
        }
    }
}
