package com.krishnamouli.cohort.config;

/**
 * Centralized defaults for the assignment engine.
 */
public class EngineDefaults {

    // HTTP
    /**
     * Maximum HTTP request body (1MB).
     * Rationale: experiment snapshots are small; anything larger is a mistake.
     */
    public static final int HTTP_MAX_CONTENT_LENGTH = 1024 * 1024;

    public static final int DEFAULT_HTTP_PORT = 8080;

    // Configuration reload
    /**
     * How often the experiments file is checked for changes (10s).
     */
    public static final long CONFIG_RELOAD_INTERVAL_SECONDS = 10;

    public static final String DEFAULT_EXPERIMENTS_PATH = "./config/experiments.json";

    // Recording
    /**
     * Upper bound on how long a caller waits for a record to be stored (250ms).
     * Rationale: recording is best effort and must not stall request threads.
     */
    public static final long RECORD_TIMEOUT_MILLIS = 250;

    public static final int RECORDER_THREADS = 4;

    /**
     * Records buffered ahead of the journal writer before new ones are refused.
     */
    public static final int JOURNAL_QUEUE_CAPACITY = 10_000;

    public static final String DEFAULT_JOURNAL_PATH = "./data/assignments.jsonl";

    // Health monitoring
    public static final long HEALTH_CHECK_INTERVAL_SECONDS = 30;

    /**
     * Recording failure rate above which the engine reports itself degraded (5%).
     */
    public static final double RECORDING_FAILURE_RATE_THRESHOLD = 0.05;

    /**
     * Health score at or below which /health reports "degraded".
     */
    public static final int HEALTHY_SCORE_THRESHOLD = 70;

    private EngineDefaults() {
        throw new AssertionError("Configuration class should not be instantiated");
    }

    /**
     * Validates default values on startup.
     * Throws IllegalArgumentException if a default is invalid.
     */
    public static void validate() {
        if (HTTP_MAX_CONTENT_LENGTH <= 0) {
            throw new IllegalArgumentException("HTTP_MAX_CONTENT_LENGTH must be positive");
        }
        if (RECORD_TIMEOUT_MILLIS < 0) {
            throw new IllegalArgumentException("RECORD_TIMEOUT_MILLIS must not be negative");
        }
        if (RECORDER_THREADS <= 0) {
            throw new IllegalArgumentException("RECORDER_THREADS must be positive");
        }
        if (JOURNAL_QUEUE_CAPACITY <= 0) {
            throw new IllegalArgumentException("JOURNAL_QUEUE_CAPACITY must be positive");
        }
        if (RECORDING_FAILURE_RATE_THRESHOLD < 0 || RECORDING_FAILURE_RATE_THRESHOLD > 1.0) {
            throw new IllegalArgumentException("RECORDING_FAILURE_RATE_THRESHOLD must be in [0, 1]");
        }
    }
}
