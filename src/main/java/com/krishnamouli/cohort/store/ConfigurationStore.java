package com.krishnamouli.cohort.store;

import com.krishnamouli.cohort.exception.ConfigurationException;
import com.krishnamouli.cohort.model.ExperimentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published experiment configurations.
 *
 * <p>
 * Readers dereference a single {@link AtomicReference} and never lock. A publish
 * validates the complete new set first and then swaps the reference, so readers
 * observe either the old snapshot or the new one in full. Publishers are
 * serialized among themselves only so that version numbers stay monotonic.
 */
public class ConfigurationStore {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationStore.class);

    private final AtomicReference<ConfigSnapshot> current;
    private final List<SnapshotListener> listeners;
    private final Object publishLock = new Object();

    public ConfigurationStore() {
        this.current = new AtomicReference<>(ConfigSnapshot.empty());
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public Optional<ExperimentConfig> get(String key) {
        return current.get().get(key);
    }

    public ConfigSnapshot snapshot() {
        return current.get();
    }

    /**
     * Atomically replaces the visible configuration set.
     *
     * @throws ConfigurationException if any entry is invalid; the previous snapshot stays in place
     */
    public ConfigSnapshot publish(Map<String, ExperimentConfig> experiments) {
        if (experiments == null) {
            throw new ConfigurationException("Snapshot must not be null");
        }
        Map<String, ExperimentConfig> validated = new LinkedHashMap<>();
        for (Map.Entry<String, ExperimentConfig> entry : experiments.entrySet()) {
            ExperimentConfig config = entry.getValue();
            if (config == null) {
                throw new ConfigurationException("Experiment '" + entry.getKey() + "' has no configuration");
            }
            if (!config.getKey().equals(entry.getKey())) {
                throw new ConfigurationException(String.format(
                        "Snapshot key '%s' does not match experiment key '%s'", entry.getKey(), config.getKey()));
            }
            // Re-run builder validation so hand-built maps get the same checks as parsed files
            validated.put(entry.getKey(), config.toBuilder().build());
        }

        ConfigSnapshot previous;
        ConfigSnapshot next;
        synchronized (publishLock) {
            previous = current.get();
            next = new ConfigSnapshot(previous.getVersion() + 1, Instant.now(), validated);
            current.set(next);
        }

        logger.info("Published configuration snapshot v{} with {} experiments", next.getVersion(), next.size());
        notifyListeners(previous, next);
        return next;
    }

    /**
     * Publishes a list of configurations, rejecting duplicate keys.
     */
    public ConfigSnapshot publish(Collection<ExperimentConfig> experiments) {
        if (experiments == null) {
            throw new ConfigurationException("Snapshot must not be null");
        }
        Map<String, ExperimentConfig> byKey = new LinkedHashMap<>();
        for (ExperimentConfig config : experiments) {
            if (config == null) {
                throw new ConfigurationException("Snapshot contains a null experiment");
            }
            if (byKey.putIfAbsent(config.getKey(), config) != null) {
                throw new ConfigurationException("Duplicate experiment key: " + config.getKey());
            }
        }
        return publish(byKey);
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SnapshotListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ConfigSnapshot previous, ConfigSnapshot next) {
        for (SnapshotListener listener : listeners) {
            try {
                listener.onPublish(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Snapshot listener failed for v{}", next.getVersion(), e);
            }
        }
    }
}
