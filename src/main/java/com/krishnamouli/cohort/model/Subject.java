package com.krishnamouli.cohort.model;

import java.util.Objects;

/**
 * The entity being bucketed. Only the key takes part in hashing; the type is
 * carried along for recorded assignments.
 */
public final class Subject {
    public static final String ANONYMOUS_KEY = "anonymous";

    private final String key;
    private final SubjectType type;

    public Subject(String key, SubjectType type) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Subject key must not be empty");
        }
        this.key = key;
        this.type = type != null ? type : SubjectType.USER;
    }

    public static Subject user(String userId) {
        return new Subject(userId, SubjectType.USER);
    }

    public static Subject session(String sessionId) {
        return new Subject(sessionId, SubjectType.SESSION);
    }

    public static Subject device(String deviceId) {
        return new Subject(deviceId, SubjectType.DEVICE);
    }

    /**
     * Picks the most stable identifier available: user id, then session id,
     * then the shared anonymous subject.
     */
    public static Subject of(String userId, String sessionId) {
        if (userId != null && !userId.isEmpty()) {
            return user(userId);
        }
        if (sessionId != null && !sessionId.isEmpty()) {
            return session(sessionId);
        }
        return new Subject(ANONYMOUS_KEY, SubjectType.ANONYMOUS);
    }

    public String getKey() {
        return key;
    }

    public SubjectType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Subject)) {
            return false;
        }
        Subject other = (Subject) o;
        return key.equals(other.key) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, type);
    }

    @Override
    public String toString() {
        return type.wireName() + ":" + key;
    }
}
