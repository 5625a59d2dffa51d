package com.krishnamouli.cohort.exception;

/**
 * Base type for all failures raised by the assignment engine.
 */
public class ExperimentException extends RuntimeException {

    public ExperimentException(String message) {
        super(message);
    }

    public ExperimentException(String message, Throwable cause) {
        super(message, cause);
    }
}
