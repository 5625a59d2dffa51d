package com.krishnamouli.cohort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * The first assignment stored for a (subject, experiment) pair.
 * {@code recordedAt} is written as an ISO-8601 instant.
 */
public final class RecordedAssignment {
    private final String subjectKey;
    private final SubjectType subjectType;
    private final ExperimentAssignment assignment;
    private final Instant recordedAt;

    public RecordedAssignment(String subjectKey, SubjectType subjectType,
            ExperimentAssignment assignment, Instant recordedAt) {
        if (subjectKey == null || subjectKey.isEmpty()) {
            throw new IllegalArgumentException("Recorded assignment needs a subject key");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("Recorded assignment for " + subjectKey + " has no assignment");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("Recorded assignment for " + subjectKey + " has no timestamp");
        }
        this.subjectKey = subjectKey;
        this.subjectType = subjectType != null ? subjectType : SubjectType.USER;
        this.assignment = assignment;
        this.recordedAt = recordedAt;
    }

    @JsonCreator
    public static RecordedAssignment fromJson(
            @JsonProperty("subjectKey") String subjectKey,
            @JsonProperty("subjectType") SubjectType subjectType,
            @JsonProperty("assignment") ExperimentAssignment assignment,
            @JsonProperty("recordedAt") String recordedAt) {
        Instant timestamp;
        try {
            timestamp = recordedAt != null ? Instant.parse(recordedAt) : null;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid recordedAt: " + recordedAt, e);
        }
        return new RecordedAssignment(subjectKey, subjectType, assignment, timestamp);
    }

    public static RecordedAssignment now(Subject subject, ExperimentAssignment assignment) {
        return new RecordedAssignment(subject.getKey(), subject.getType(), assignment, Instant.now());
    }

    public String getSubjectKey() {
        return subjectKey;
    }

    public SubjectType getSubjectType() {
        return subjectType;
    }

    public ExperimentAssignment getAssignment() {
        return assignment;
    }

    @JsonSerialize(using = ToStringSerializer.class)
    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return String.format("RecordedAssignment{subject=%s, %s, at=%s}", subjectKey, assignment, recordedAt);
    }
}
