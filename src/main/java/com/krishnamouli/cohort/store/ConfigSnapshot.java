package com.krishnamouli.cohort.store;

import com.krishnamouli.cohort.model.ExperimentConfig;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every published experiment at one point in time.
 * Each publish builds a brand-new snapshot; nothing is mutated in place.
 */
public final class ConfigSnapshot {
    private final long version;
    private final Instant publishedAt;
    private final Map<String, ExperimentConfig> experiments;

    ConfigSnapshot(long version, Instant publishedAt, Map<String, ExperimentConfig> experiments) {
        this.version = version;
        this.publishedAt = publishedAt;
        this.experiments = Collections.unmodifiableMap(new LinkedHashMap<>(experiments));
    }

    static ConfigSnapshot empty() {
        return new ConfigSnapshot(0, Instant.EPOCH, Collections.emptyMap());
    }

    public Optional<ExperimentConfig> get(String key) {
        return Optional.ofNullable(experiments.get(key));
    }

    public long getVersion() {
        return version;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Map<String, ExperimentConfig> getExperiments() {
        return experiments;
    }

    public int size() {
        return experiments.size();
    }

    @Override
    public String toString() {
        return String.format("ConfigSnapshot{version=%d, experiments=%d, publishedAt=%s}",
                version, experiments.size(), publishedAt);
    }
}
