package com.krishnamouli.cohort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result of resolving a subject against an experiment. Computed on every call;
 * a null variant means the subject is not in the experiment.
 */
public final class ExperimentAssignment {
    private final String experimentKey;
    private final String variant;
    private final boolean inExperiment;

    @JsonCreator
    public ExperimentAssignment(
            @JsonProperty("experimentKey") String experimentKey,
            @JsonProperty("variant") String variant,
            @JsonProperty("inExperiment") boolean inExperiment) {
        if (experimentKey == null || experimentKey.isEmpty()) {
            throw new IllegalArgumentException("experimentKey must not be empty");
        }
        if (inExperiment && variant == null) {
            throw new IllegalArgumentException("An in-experiment assignment needs a variant");
        }
        this.experimentKey = experimentKey;
        this.variant = inExperiment ? variant : null;
        this.inExperiment = inExperiment;
    }

    public static ExperimentAssignment assigned(String experimentKey, String variant) {
        return new ExperimentAssignment(experimentKey, variant, true);
    }

    public static ExperimentAssignment notInExperiment(String experimentKey) {
        return new ExperimentAssignment(experimentKey, null, false);
    }

    public String getExperimentKey() {
        return experimentKey;
    }

    public String getVariant() {
        return variant;
    }

    @JsonProperty("inExperiment")
    public boolean isInExperiment() {
        return inExperiment;
    }

    public boolean hasVariant() {
        return variant != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExperimentAssignment)) {
            return false;
        }
        ExperimentAssignment other = (ExperimentAssignment) o;
        return inExperiment == other.inExperiment
                && experimentKey.equals(other.experimentKey)
                && Objects.equals(variant, other.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(experimentKey, variant, inExperiment);
    }

    @Override
    public String toString() {
        return String.format("ExperimentAssignment{experiment=%s, variant=%s, inExperiment=%s}",
                experimentKey, variant, inExperiment);
    }
}
