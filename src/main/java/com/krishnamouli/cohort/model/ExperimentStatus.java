package com.krishnamouli.cohort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.krishnamouli.cohort.exception.ConfigurationException;

import java.util.Locale;

/**
 * Lifecycle state of an experiment. Only ACTIVE experiments assign live variants.
 */
public enum ExperimentStatus {
    ACTIVE, PAUSED, COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExperimentStatus fromString(String value) {
        if (value == null) {
            throw new ConfigurationException("Experiment status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown experiment status: " + value, e);
        }
    }
}
