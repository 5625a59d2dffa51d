package com.krishnamouli.cohort.exception;

/**
 * Persistence failure while recording an assignment.
 * Never propagated to callers of the recorder; logged and counted instead.
 */
public class RecordingException extends ExperimentException {

    public RecordingException(String message) {
        super(message);
    }

    public RecordingException(String message, Throwable cause) {
        super(message, cause);
    }
}
