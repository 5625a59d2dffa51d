package com.krishnamouli.cohort.store;

import com.krishnamouli.cohort.exception.ConfigurationException;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.model.ExperimentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationStoreTest {

    private ConfigurationStore store;

    @BeforeEach
    void setUp() {
        store = new ConfigurationStore();
    }

    @Test
    void testStartsEmpty() {
        assertEquals(0, store.snapshot().getVersion());
        assertEquals(0, store.snapshot().size());
        assertTrue(store.get("anything").isEmpty());
    }

    @Test
    void testPublishAndGet() {
        ExperimentConfig config = experiment("inv.strategy", "optimistic", "pessimistic");
        ConfigSnapshot snapshot = store.publish(List.of(config));

        assertEquals(1, snapshot.getVersion());
        assertEquals(config, store.get("inv.strategy").orElseThrow());
    }

    @Test
    void testPublishReplacesWholeSet() {
        store.publish(List.of(experiment("a", "x"), experiment("b", "x")));
        store.publish(List.of(experiment("c", "x")));

        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("b").isEmpty());
        assertTrue(store.get("c").isPresent());
        assertEquals(2, store.snapshot().getVersion());
    }

    @Test
    void testEarlierSnapshotIsUnaffectedByPublish() {
        store.publish(List.of(experiment("a", "x")));
        ConfigSnapshot before = store.snapshot();

        store.publish(List.of(experiment("b", "x")));

        assertTrue(before.get("a").isPresent());
        assertTrue(before.get("b").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> before.getExperiments().clear());
    }

    @Test
    void testRejectsDuplicateKeysAndKeepsPreviousSnapshot() {
        store.publish(List.of(experiment("a", "x")));
        ConfigSnapshot before = store.snapshot();

        assertThrows(ConfigurationException.class,
                () -> store.publish(List.of(experiment("b", "x"), experiment("b", "y"))));

        assertSame(before, store.snapshot());
    }

    @Test
    void testRejectsMismatchedMapKey() {
        Map<String, ExperimentConfig> snapshot = new LinkedHashMap<>();
        snapshot.put("wrong", experiment("right", "x"));

        assertThrows(ConfigurationException.class, () -> store.publish(snapshot));
        assertEquals(0, store.snapshot().getVersion());
    }

    @Test
    void testRejectsNullEntry() {
        Map<String, ExperimentConfig> snapshot = new LinkedHashMap<>();
        snapshot.put("a", null);

        assertThrows(ConfigurationException.class, () -> store.publish(snapshot));
    }

    @Test
    void testPublishingEmptySetClearsExperiments() {
        store.publish(List.of(experiment("a", "x")));
        store.publish(new ArrayList<>());

        assertTrue(store.get("a").isEmpty());
        assertEquals(2, store.snapshot().getVersion());
    }

    @Test
    void testCompletedExperimentStaysResolvable() {
        ExperimentConfig completed = ExperimentConfig.builder("old")
                .variants("x", "y")
                .status(ExperimentStatus.COMPLETED)
                .build();
        store.publish(List.of(completed));

        assertEquals(ExperimentStatus.COMPLETED, store.get("old").orElseThrow().getStatus());
    }

    @Test
    void testListenersSeePreviousAndCurrent() {
        List<Long> versions = new ArrayList<>();
        store.addListener((previous, current) -> {
            versions.add(previous.getVersion());
            versions.add(current.getVersion());
        });

        store.publish(List.of(experiment("a", "x")));

        assertEquals(List.of(0L, 1L), versions);
    }

    @Test
    void testFailingListenerDoesNotUndoPublish() {
        AtomicInteger calls = new AtomicInteger();
        store.addListener((previous, current) -> {
            throw new IllegalStateException("boom");
        });
        store.addListener((previous, current) -> calls.incrementAndGet());

        store.publish(List.of(experiment("a", "x")));

        assertTrue(store.get("a").isPresent());
        assertEquals(1, calls.get());
    }

    @Test
    void testRemovedListenerIsNotCalled() {
        AtomicInteger calls = new AtomicInteger();
        SnapshotListener listener = (previous, current) -> calls.incrementAndGet();
        store.addListener(listener);
        store.publish(List.of(experiment("a", "x")));

        store.removeListener(listener);
        store.publish(List.of(experiment("b", "x")));

        assertEquals(1, calls.get());
    }

    private static ExperimentConfig experiment(String key, String... variants) {
        return ExperimentConfig.builder(key).variants(variants).build();
    }
}
