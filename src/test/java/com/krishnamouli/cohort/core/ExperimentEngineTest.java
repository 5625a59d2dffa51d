package com.krishnamouli.cohort.core;

import com.krishnamouli.cohort.exception.ExperimentNotFoundException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.model.ExperimentStatus;
import com.krishnamouli.cohort.model.RecordedAssignment;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.model.SubjectType;
import com.krishnamouli.cohort.monitoring.ExperimentTracker;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.recording.AssignmentRecorder;
import com.krishnamouli.cohort.recording.InMemoryAssignmentStore;
import com.krishnamouli.cohort.store.ConfigurationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentEngineTest {

    private MetricsCollector metrics;
    private AssignmentRecorder recorder;
    private ExperimentEngine engine;

    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector();
        recorder = new AssignmentRecorder(new InMemoryAssignmentStore(), metrics, 1000, 2);
        engine = new ExperimentEngine(new ConfigurationStore(), recorder, metrics);
        engine.publish(List.of(ExperimentConfig.builder("inv.strategy")
                .variants("optimistic", "pessimistic")
                .build()));
    }

    @AfterEach
    void tearDown() {
        recorder.shutdown();
    }

    @Test
    void testAssignRecordsExposure() {
        ExperimentAssignment assignment = engine.assign(Subject.user("user-42"), "inv.strategy");

        assertEquals("pessimistic", assignment.getVariant());
        RecordedAssignment recorded = engine.findRecorded("user-42", "inv.strategy").orElseThrow();
        assertEquals(assignment, recorded.getAssignment());
        assertEquals(SubjectType.USER, recorded.getSubjectType());
        assertEquals(1, engine.recordedCount());
        assertEquals(1, exposures("pessimistic"));
    }

    @Test
    void testAssignmentIsStickyAcrossConfigChanges() {
        ExperimentAssignment first = engine.assign(Subject.user("user-42"), "inv.strategy");

        engine.publish(List.of(ExperimentConfig.builder("inv.strategy")
                .variants("pessimistic", "optimistic")
                .build()));
        assertNotEquals(first, engine.resolve("user-42", "inv.strategy"));

        assertEquals(first, engine.assign(Subject.user("user-42"), "inv.strategy"));
        assertEquals(1, engine.recordedCount());
        assertEquals(1, exposures("pessimistic"));
    }

    @Test
    void testRecordIfAbsentKeepsFirstAssignment() {
        ExperimentAssignment first = ExperimentAssignment.assigned("inv.strategy", "optimistic");
        ExperimentAssignment second = ExperimentAssignment.assigned("inv.strategy", "pessimistic");

        assertEquals(first, engine.recordIfAbsent("user-1", first));
        assertEquals(first, engine.recordIfAbsent("user-1", second));

        MetricsCollector.MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(1, snapshot.recordsWritten);
        assertEquals(1, snapshot.recordsExisting);
    }

    @Test
    void testResolveCountsMetrics() {
        engine.resolve("user-1", "inv.strategy");
        engine.resolve("user-2", "inv.strategy");
        assertThrows(ExperimentNotFoundException.class, () -> engine.resolve("user-1", "missing"));

        MetricsCollector.MetricsSnapshot snapshot = metrics.getSnapshot();
        assertEquals(2, snapshot.resolutions);
        assertEquals(2, snapshot.participations);
        assertEquals(1, snapshot.notFound);
        assertEquals(1.0, snapshot.getParticipationRate());
    }

    @Test
    void testConversionCountedAgainstRecordedVariant() {
        engine.assign(Subject.user("user-42"), "inv.strategy");

        assertTrue(engine.recordConversion("inv.strategy", "user-42", "reservation_success", 12));

        ExperimentTracker.VariantMetrics pessimistic = variant("pessimistic");
        assertEquals(1, pessimistic.getConversions("reservation_success"));
        assertEquals(0, pessimistic.getConversions("reservation_conflict"));
        assertTrue(pessimistic.p50LatencyMs > 0);
    }

    @Test
    void testConversionIgnoredOutsideExperiment() {
        engine.publish(List.of(ExperimentConfig.builder("inv.strategy")
                .variants("optimistic", "pessimistic")
                .status(ExperimentStatus.PAUSED)
                .build()));

        assertFalse(engine.recordConversion("inv.strategy", "user-42", "reservation_success", 0));
        assertTrue(metrics.tracker("inv.strategy").getMetrics().isEmpty());
    }

    @Test
    void testConversionRequiresEvent() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.recordConversion("inv.strategy", "user-42", " ", 0));
    }

    @Test
    void testConversionForUnknownExperimentThrows() {
        assertThrows(ExperimentNotFoundException.class,
                () -> engine.recordConversion("missing", "user-42", "reservation_success", 0));
    }

    @Test
    void testAssignAsyncEventuallyRecords() throws InterruptedException {
        ExperimentAssignment assignment = engine.assignAsync(Subject.session("session-abc"), "inv.strategy");
        assertEquals("optimistic", assignment.getVariant());

        for (int i = 0; i < 50 && engine.recordedCount() == 0; i++) {
            Thread.sleep(20);
        }
        assertEquals(SubjectType.SESSION,
                engine.findRecorded("session-abc", "inv.strategy").orElseThrow().getSubjectType());
    }

    private long exposures(String variant) {
        return variant(variant).exposures;
    }

    private ExperimentTracker.VariantMetrics variant(String variant) {
        return metrics.tracker("inv.strategy").getMetrics().stream()
                .filter(m -> m.variant.equals(variant))
                .findFirst()
                .orElseThrow();
    }
}
