package com.krishnamouli.cohort.recording;

import com.krishnamouli.cohort.exception.RecordingException;
import com.krishnamouli.cohort.model.RecordedAssignment;

import java.util.Optional;

/**
 * Backing store for recorded assignments.
 *
 * <p>
 * Implementations must make {@link #insertIfAbsent} an atomic conditional
 * insert per key: concurrent first writers for the same pair all get back the
 * single record that won. Writers for different pairs must not serialize.
 */
public interface AssignmentStore {

    /**
     * Stores the record unless one already exists for its (subject, experiment) pair.
     *
     * @return the record now stored for the pair, which is {@code record} only if it won
     * @throws RecordingException if the store could not complete the write
     */
    RecordedAssignment insertIfAbsent(RecordedAssignment record);

    Optional<RecordedAssignment> find(AssignmentKey key);

    int size();

    default void shutdown() {
    }
}
