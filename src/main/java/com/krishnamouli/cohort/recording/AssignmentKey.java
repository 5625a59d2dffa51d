package com.krishnamouli.cohort.recording;

import java.util.Objects;

/**
 * Identity of a recorded assignment: one record per (subject, experiment) pair.
 */
public final class AssignmentKey {
    private final String subjectKey;
    private final String experimentKey;

    public AssignmentKey(String subjectKey, String experimentKey) {
        this.subjectKey = Objects.requireNonNull(subjectKey, "subjectKey");
        this.experimentKey = Objects.requireNonNull(experimentKey, "experimentKey");
    }

    public String getSubjectKey() {
        return subjectKey;
    }

    public String getExperimentKey() {
        return experimentKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssignmentKey)) {
            return false;
        }
        AssignmentKey other = (AssignmentKey) o;
        return subjectKey.equals(other.subjectKey) && experimentKey.equals(other.experimentKey);
    }

    @Override
    public int hashCode() {
        return 31 * subjectKey.hashCode() + experimentKey.hashCode();
    }

    @Override
    public String toString() {
        return subjectKey + "@" + experimentKey;
    }
}
