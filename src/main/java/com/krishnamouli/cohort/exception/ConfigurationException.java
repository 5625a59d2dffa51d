package com.krishnamouli.cohort.exception;

/**
 * Raised when an experiment configuration violates its invariants.
 * A publish that fails with this exception leaves the previous snapshot in place.
 */
public class ConfigurationException extends ExperimentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
