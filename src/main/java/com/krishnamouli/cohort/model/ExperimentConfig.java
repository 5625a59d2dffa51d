package com.krishnamouli.cohort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.krishnamouli.cohort.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable definition of an experiment.
 *
 * <p>
 * Instances are only created through {@link Builder#build()} (or the JSON
 * creator, which delegates to it), so every instance satisfies the invariants:
 * a non-blank key, at least one variant, unique variant names and a sampling
 * rate within [0, 1].
 *
 * <p>
 * The key must never be reused for a different variant set: assignments are a
 * pure function of the key, so changing variants under the same key silently
 * moves subjects between arms.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExperimentConfig {
    private final String key;
    private final String name;
    private final String description;
    private final List<String> variants;
    private final double sampling;
    private final ExperimentStatus status;

    private ExperimentConfig(Builder builder) {
        this.key = builder.key;
        this.name = builder.name != null ? builder.name : builder.key;
        this.description = builder.description;
        this.variants = Collections.unmodifiableList(new ArrayList<>(builder.variants));
        this.sampling = builder.sampling;
        this.status = builder.status;
    }

    @JsonCreator
    public static ExperimentConfig fromJson(
            @JsonProperty("key") String key,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("variants") List<String> variants,
            @JsonProperty("sampling") Double sampling,
            @JsonProperty("status") ExperimentStatus status) {
        // A missing rate would otherwise fall back to enrolling everyone
        if (sampling == null) {
            throw new ConfigurationException("Experiment '" + key + "' must declare a sampling rate");
        }
        if (status == null) {
            throw new ConfigurationException("Experiment '" + key + "' must declare a status");
        }
        Builder builder = builder(key)
                .name(name)
                .description(description)
                .sampling(sampling)
                .status(status);
        if (variants != null) {
            builder.variants(variants);
        }
        return builder.build();
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public Builder toBuilder() {
        return new Builder(key)
                .name(name)
                .description(description)
                .variants(variants)
                .sampling(sampling)
                .status(status);
    }

    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getVariants() {
        return variants;
    }

    public double getSampling() {
        return sampling;
    }

    public ExperimentStatus getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == ExperimentStatus.ACTIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExperimentConfig)) {
            return false;
        }
        ExperimentConfig other = (ExperimentConfig) o;
        return Double.compare(sampling, other.sampling) == 0
                && key.equals(other.key)
                && name.equals(other.name)
                && Objects.equals(description, other.description)
                && variants.equals(other.variants)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, name, description, variants, sampling, status);
    }

    @Override
    public String toString() {
        return String.format("ExperimentConfig{key=%s, variants=%s, sampling=%.4f, status=%s}",
                key, variants, sampling, status.wireName());
    }

    public static final class Builder {
        private final String key;
        private String name;
        private String description;
        private List<String> variants = new ArrayList<>();
        private double sampling = 1.0;
        private ExperimentStatus status = ExperimentStatus.ACTIVE;

        private Builder(String key) {
            this.key = key;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder variants(List<String> variants) {
            this.variants = new ArrayList<>(variants);
            return this;
        }

        public Builder variants(String... variants) {
            return variants(Arrays.asList(variants));
        }

        public Builder sampling(double sampling) {
            this.sampling = sampling;
            return this;
        }

        public Builder status(ExperimentStatus status) {
            this.status = status;
            return this;
        }

        public ExperimentConfig build() {
            validate();
            return new ExperimentConfig(this);
        }

        private void validate() {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Experiment key must not be blank");
            }
            if (variants == null || variants.isEmpty()) {
                throw new ConfigurationException("Experiment '" + key + "' must declare at least one variant");
            }
            Set<String> seen = new HashSet<>();
            for (String variant : variants) {
                if (variant == null || variant.isBlank()) {
                    throw new ConfigurationException("Experiment '" + key + "' has a blank variant name");
                }
                if (!seen.add(variant)) {
                    throw new ConfigurationException(
                            "Experiment '" + key + "' declares variant '" + variant + "' more than once");
                }
            }
            // NaN fails both comparisons, so check it explicitly
            if (Double.isNaN(sampling) || sampling < 0.0 || sampling > 1.0) {
                throw new ConfigurationException(
                        "Experiment '" + key + "' sampling must be within [0, 1], got " + sampling);
            }
            if (status == null) {
                throw new ConfigurationException("Experiment '" + key + "' status is required");
            }
        }
    }
}
