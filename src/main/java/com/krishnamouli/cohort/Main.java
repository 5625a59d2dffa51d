package com.krishnamouli.cohort;

import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.config.EngineDefaults;
import com.krishnamouli.cohort.core.ExperimentEngine;
import com.krishnamouli.cohort.exception.ConfigurationException;
import com.krishnamouli.cohort.monitoring.EngineHealthMonitor;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.network.http.HTTPServer;
import com.krishnamouli.cohort.recording.AssignmentRecorder;
import com.krishnamouli.cohort.recording.AssignmentStore;
import com.krishnamouli.cohort.recording.InMemoryAssignmentStore;
import com.krishnamouli.cohort.recording.JournaledAssignmentStore;
import com.krishnamouli.cohort.store.ConfigurationStore;
import com.krishnamouli.cohort.store.ExperimentFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Main entry point for Cohort - deterministic experiment assignment.
 * Wires configuration loading, resolution, recording, monitoring and the HTTP API.
 *
 * <p>
 * Usage: {@code java -jar cohort.jar [experiments.json] [httpPort]}
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Cohort - experiment assignment engine v1.0");

        EngineDefaults.validate();
        CohortConfig config = new CohortConfig();

        // Parse command line arguments
        if (args.length > 0) {
            config.setExperimentsPath(args[0]);
        }
        if (args.length > 1) {
            try {
                config.setHttpPort(Integer.parseInt(args[1]));
            } catch (NumberFormatException e) {
                logger.error("Invalid port number: {}", args[1]);
                System.exit(1);
            }
        }

        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
        }

        logger.info("Configuration: {}", config);

        logger.info("Loading experiment configuration...");
        ConfigurationStore store = new ConfigurationStore();
        ExperimentFileLoader loader = new ExperimentFileLoader(
                store,
                config.getExperimentsPath(),
                config.getConfigReloadIntervalSeconds());
        if (Files.exists(Paths.get(config.getExperimentsPath()))) {
            try {
                loader.load();
            } catch (ConfigurationException e) {
                // Keep running on an empty snapshot; the next valid edit is picked up by the reloader
                logger.error("Initial experiments file rejected: {}", e.getMessage());
            }
        } else {
            logger.warn("Experiments file {} not found, starting with no experiments",
                    config.getExperimentsPath());
        }

        logger.info("Initializing recording...");
        MetricsCollector metrics = new MetricsCollector();
        AssignmentStore assignmentStore = config.isEnableJournal()
                ? new JournaledAssignmentStore(config.getJournalPath(), config.getJournalQueueCapacity())
                : new InMemoryAssignmentStore();
        AssignmentRecorder recorder = new AssignmentRecorder(
                assignmentStore,
                metrics,
                config.getRecordTimeoutMillis(),
                config.getRecorderThreads());

        ExperimentEngine engine = new ExperimentEngine(store, recorder, metrics);

        EngineHealthMonitor healthMonitor = new EngineHealthMonitor(
                store,
                metrics,
                loader,
                config.isEnableHealthMonitor() ? config.getHealthCheckIntervalSeconds() : 0);

        HTTPServer httpServer = config.isEnableHttp() ? new HTTPServer(config, engine, healthMonitor) : null;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, cleaning up...");

            if (httpServer != null) {
                httpServer.shutdown();
            }
            healthMonitor.shutdown();
            loader.shutdown();
            recorder.shutdown();

            logger.info("Cohort shutdown complete");
        }));

        if (httpServer == null) {
            logger.info("HTTP API disabled, nothing left to run");
            return;
        }

        try {
            httpServer.start();
            logger.info("Cohort is ready: http://localhost:{}/health", httpServer.getPort());
            httpServer.awaitTermination();

        } catch (InterruptedException e) {
            logger.error("Server interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error", e);
            System.exit(1);
        }
    }
}
