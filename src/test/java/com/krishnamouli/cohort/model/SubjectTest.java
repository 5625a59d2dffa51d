package com.krishnamouli.cohort.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubjectTest {

    @Test
    void testPrefersUserId() {
        Subject subject = Subject.of("user-1", "session-9");
        assertEquals("user-1", subject.getKey());
        assertEquals(SubjectType.USER, subject.getType());
    }

    @Test
    void testFallsBackToSession() {
        Subject subject = Subject.of(null, "session-9");
        assertEquals("session-9", subject.getKey());
        assertEquals(SubjectType.SESSION, subject.getType());
    }

    @Test
    void testFallsBackToAnonymous() {
        Subject subject = Subject.of("", null);
        assertEquals(Subject.ANONYMOUS_KEY, subject.getKey());
        assertEquals(SubjectType.ANONYMOUS, subject.getType());
    }

    @Test
    void testRejectsEmptyKey() {
        assertThrows(IllegalArgumentException.class, () -> new Subject("", SubjectType.DEVICE));
    }
}
