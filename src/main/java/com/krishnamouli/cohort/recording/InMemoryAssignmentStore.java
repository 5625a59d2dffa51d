package com.krishnamouli.cohort.recording;

import com.krishnamouli.cohort.model.RecordedAssignment;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Assignment store backed by a {@link ConcurrentHashMap}; {@code putIfAbsent}
 * gives the per-key atomic insert.
 */
public class InMemoryAssignmentStore implements AssignmentStore {
    private final ConcurrentMap<AssignmentKey, RecordedAssignment> records = new ConcurrentHashMap<>();

    @Override
    public RecordedAssignment insertIfAbsent(RecordedAssignment record) {
        RecordedAssignment existing = records.putIfAbsent(keyOf(record), record);
        return existing != null ? existing : record;
    }

    @Override
    public Optional<RecordedAssignment> find(AssignmentKey key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Removes a record only if it is still the one stored for its key.
     */
    boolean removeIfSame(RecordedAssignment record) {
        return records.remove(keyOf(record), record);
    }

    static AssignmentKey keyOf(RecordedAssignment record) {
        return new AssignmentKey(record.getSubjectKey(), record.getAssignment().getExperimentKey());
    }
}
