package com.krishnamouli.cohort.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.exception.ConfigurationException;
import com.krishnamouli.cohort.model.ExperimentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Loads experiment definitions from a JSON file into a {@link ConfigurationStore}
 * and republishes whenever the file changes.
 *
 * <p>
 * The file holds either a bare array of experiments or an object with an
 * {@code experiments} array. A file that fails to parse or validate is rejected
 * as a whole and the store keeps serving the last good snapshot.
 */
public class ExperimentFileLoader {
    private static final Logger logger = LoggerFactory.getLogger(ExperimentFileLoader.class);
    private static final TypeReference<List<ExperimentConfig>> CONFIG_LIST = new TypeReference<>() {
    };

    private final ConfigurationStore store;
    private final Path path;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong failedReloads;
    private volatile FileTime lastLoaded;
    private volatile FileTime lastRejected;

    public ExperimentFileLoader(ConfigurationStore store, String path, long reloadIntervalSeconds) {
        this.store = store;
        this.path = Paths.get(path);
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.failedReloads = new AtomicLong(0);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cohort-config-reload");
            t.setDaemon(true);
            return t;
        });

        if (reloadIntervalSeconds > 0) {
            scheduler.scheduleWithFixedDelay(
                    this::reloadIfChanged,
                    reloadIntervalSeconds,
                    reloadIntervalSeconds,
                    TimeUnit.SECONDS);
            logger.info("Config reload scheduled: interval={}s, path={}", reloadIntervalSeconds, path);
        }
    }

    /**
     * Reads the file and publishes it.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public ConfigSnapshot load() {
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            List<ExperimentConfig> experiments = parse(Files.readAllBytes(path));
            ConfigSnapshot snapshot = store.publish(experiments);
            lastLoaded = modified;
            logger.info("Loaded {} experiments from {}", snapshot.size(), path);
            return snapshot;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read experiments from " + path, e);
        }
    }

    /**
     * Republishes only when the file's modification time moved since the last
     * successful load. Failures are logged and counted, never thrown; a rejected
     * file is not retried until it is modified again.
     */
    public void reloadIfChanged() {
        try {
            if (!Files.exists(path)) {
                logger.debug("Experiments file {} not present, keeping current snapshot", path);
                return;
            }
            FileTime modified = Files.getLastModifiedTime(path);
            if (modified.equals(lastLoaded) || modified.equals(lastRejected)) {
                return;
            }
            try {
                load();
            } catch (ConfigurationException e) {
                lastRejected = modified;
                throw e;
            }
        } catch (ConfigurationException e) {
            failedReloads.incrementAndGet();
            logger.error("Rejected experiments file {}, keeping snapshot v{}: {}",
                    path, store.snapshot().getVersion(), e.getMessage());
        } catch (IOException | RuntimeException e) {
            failedReloads.incrementAndGet();
            logger.error("Config reload failed for {}", path, e);
        }
    }

    List<ExperimentConfig> parse(byte[] content) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed experiments JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode array = root != null && root.isObject() ? root.get("experiments") : root;
        if (array == null || !array.isArray()) {
            throw new ConfigurationException("Expected an array of experiments or an 'experiments' field");
        }
        try {
            return mapper.convertValue(array, CONFIG_LIST);
        } catch (IllegalArgumentException e) {
            throw unwrap(e);
        }
    }

    public long getFailedReloads() {
        return failedReloads.get();
    }

    public Path getPath() {
        return path;
    }

    public void shutdown() {
        logger.info("Config loader shutting down");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Jackson wraps exceptions thrown by creators; surface the validation message
    private static ConfigurationException unwrap(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConfigurationException) {
                return (ConfigurationException) cause;
            }
            cause = cause.getCause();
        }
        return new ConfigurationException("Invalid experiment definition: " + e.getMessage(), e);
    }
}
