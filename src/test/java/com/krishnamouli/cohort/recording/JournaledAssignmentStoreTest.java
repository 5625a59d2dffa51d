package com.krishnamouli.cohort.recording;

import com.krishnamouli.cohort.exception.RecordingException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.RecordedAssignment;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.model.SubjectType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JournaledAssignmentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testRecordsSurviveRestart() {
        Path journal = tempDir.resolve("data/assignments.jsonl");

        JournaledAssignmentStore first = new JournaledAssignmentStore(journal.toString(), 100);
        first.insertIfAbsent(record(Subject.user("user-42"), ExperimentAssignment.assigned("inv.strategy", "pessimistic")));
        first.insertIfAbsent(record(Subject.session("s1"), ExperimentAssignment.notInExperiment("inv.strategy")));
        first.shutdown();

        assertEquals(0, first.pendingWrites());
        assertEquals(0, first.getJournalFailures());
        assertTrue(Files.exists(journal));

        JournaledAssignmentStore second = new JournaledAssignmentStore(journal.toString(), 100);
        try {
            assertEquals(2, second.size());
            RecordedAssignment restored = second.find(new AssignmentKey("user-42", "inv.strategy")).orElseThrow();
            assertEquals("pessimistic", restored.getAssignment().getVariant());
            assertEquals(SubjectType.USER, restored.getSubjectType());

            RecordedAssignment outside = second.find(new AssignmentKey("s1", "inv.strategy")).orElseThrow();
            assertFalse(outside.getAssignment().isInExperiment());
            assertEquals(SubjectType.SESSION, outside.getSubjectType());
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testOnlyWinnersAreJournaled() throws IOException {
        Path journal = tempDir.resolve("assignments.jsonl");
        JournaledAssignmentStore store = new JournaledAssignmentStore(journal.toString(), 100);

        RecordedAssignment winner = record(Subject.user("u1"), ExperimentAssignment.assigned("e", "a"));
        assertSame(winner, store.insertIfAbsent(winner));
        assertSame(winner, store.insertIfAbsent(record(Subject.user("u1"), ExperimentAssignment.assigned("e", "b"))));
        store.shutdown();

        List<String> lines = Files.readAllLines(journal, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"variant\":\"a\""), lines.get(0));
    }

    @Test
    void testReplayKeepsFirstLinePerPair() throws IOException {
        Path journal = tempDir.resolve("assignments.jsonl");
        Files.write(journal, List.of(
                "{\"subjectKey\":\"u1\",\"subjectType\":\"user\",\"assignment\":"
                        + "{\"experimentKey\":\"e\",\"variant\":\"a\",\"inExperiment\":true},\"recordedAt\":\"2024-01-01T00:00:00Z\"}",
                "not json at all",
                "",
                "{\"subjectKey\":\"u1\",\"subjectType\":\"user\",\"assignment\":"
                        + "{\"experimentKey\":\"e\",\"variant\":\"b\",\"inExperiment\":true},\"recordedAt\":\"2024-01-02T00:00:00Z\"}"),
                StandardCharsets.UTF_8);

        JournaledAssignmentStore store = new JournaledAssignmentStore(journal.toString(), 100);
        try {
            assertEquals(1, store.size());
            assertEquals("a", store.find(new AssignmentKey("u1", "e")).orElseThrow().getAssignment().getVariant());
        } finally {
            store.shutdown();
        }
    }

    @Test
    void testReplaySkipsIncompleteRecords() throws IOException {
        Path journal = tempDir.resolve("assignments.jsonl");
        Files.write(journal, List.of(
                "{\"subjectKey\":\"u1\",\"subjectType\":\"user\",\"assignment\":"
                        + "{\"experimentKey\":\"e\",\"variant\":\"a\",\"inExperiment\":true},\"recordedAt\":\"2024-01-01T00:00:00Z\"}",
                "null",
                "{}",
                "{\"subjectKey\":\"u2\",\"subjectType\":\"user\"}",
                "{\"subjectKey\":\"u3\",\"assignment\":{\"experimentKey\":\"e\",\"variant\":\"a\",\"inExperiment\":true}}",
                "{\"subjectKey\":\"u4\",\"assignment\":"
                        + "{\"experimentKey\":\"e\",\"variant\":\"a\",\"inExperiment\":true},\"recordedAt\":\"yesterday\"}",
                "[1, 2]"),
                StandardCharsets.UTF_8);

        JournaledAssignmentStore store = new JournaledAssignmentStore(journal.toString(), 100);
        try {
            assertEquals(1, store.size());
            assertTrue(store.find(new AssignmentKey("u1", "e")).isPresent());
        } finally {
            store.shutdown();
        }
    }

    @Test
    void testRecordedAtSurvivesRestart() throws IOException {
        Path journal = tempDir.resolve("assignments.jsonl");
        Instant recordedAt = Instant.parse("2024-03-01T12:30:45.123Z");
        JournaledAssignmentStore first = new JournaledAssignmentStore(journal.toString(), 100);
        first.insertIfAbsent(new RecordedAssignment("u1", SubjectType.DEVICE,
                ExperimentAssignment.assigned("e", "a"), recordedAt));
        first.shutdown();

        String line = Files.readAllLines(journal, StandardCharsets.UTF_8).get(0);
        assertTrue(line.contains("\"recordedAt\":\"2024-03-01T12:30:45.123Z\""), line);

        JournaledAssignmentStore second = new JournaledAssignmentStore(journal.toString(), 100);
        try {
            assertEquals(recordedAt, second.find(new AssignmentKey("u1", "e")).orElseThrow().getRecordedAt());
        } finally {
            second.shutdown();
        }
    }

    @Test
    void testFailedAppendKeepsRecordInMemoryAndCountsFailure() throws Exception {
        // A directory where the journal file should be makes every append fail
        Path journal = Files.createDirectory(tempDir.resolve("assignments.jsonl"));
        JournaledAssignmentStore store = new JournaledAssignmentStore(journal.toString(), 100);
        try {
            RecordedAssignment record = record(Subject.user("u1"), ExperimentAssignment.assigned("e", "a"));
            assertSame(record, store.insertIfAbsent(record));

            for (int i = 0; i < 100 && store.getJournalFailures() == 0; i++) {
                Thread.sleep(20);
            }

            assertEquals(1, store.getJournalFailures());
            assertSame(record, store.find(new AssignmentKey("u1", "e")).orElseThrow());
        } finally {
            store.shutdown();
        }
    }

    @Test
    void testFullQueueRejectsWithoutKeepingRecord() {
        Path journal = tempDir.resolve("assignments.jsonl");
        JournaledAssignmentStore store = new JournaledAssignmentStore(journal.toString(), 1);
        try {
            // The writer may drain between inserts, so keep inserting until the queue overflows
            RecordingException rejected = null;
            int i = 0;
            while (rejected == null && i < 100_000) {
                RecordedAssignment record = record(Subject.user("u" + i), ExperimentAssignment.assigned("e", "a"));
                try {
                    store.insertIfAbsent(record);
                } catch (RecordingException e) {
                    rejected = e;
                    assertTrue(store.find(new AssignmentKey("u" + i, "e")).isEmpty());
                }
                i++;
            }
            assertNotNull(rejected);
        } finally {
            store.shutdown();
        }
    }

    private static RecordedAssignment record(Subject subject, ExperimentAssignment assignment) {
        return RecordedAssignment.now(subject, assignment);
    }
}
