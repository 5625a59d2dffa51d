package com.krishnamouli.cohort.exception;

public class ExperimentNotFoundException extends ExperimentException {
    private final String experimentKey;

    public ExperimentNotFoundException(String experimentKey) {
        super("Unknown experiment: " + experimentKey);
        this.experimentKey = experimentKey;
    }

    public String getExperimentKey() {
        return experimentKey;
    }
}
