package com.krishnamouli.cohort.config;

/**
 * Runtime configuration for the Cohort server.
 */
public class CohortConfig {

    // Server configuration
    private int httpPort = EngineDefaults.DEFAULT_HTTP_PORT;
    private boolean enableHttp = true;

    // Experiment definitions
    private String experimentsPath = EngineDefaults.DEFAULT_EXPERIMENTS_PATH;
    private long configReloadIntervalSeconds = EngineDefaults.CONFIG_RELOAD_INTERVAL_SECONDS;

    // Recording configuration
    private boolean enableJournal = true;
    private String journalPath = EngineDefaults.DEFAULT_JOURNAL_PATH;
    private int journalQueueCapacity = EngineDefaults.JOURNAL_QUEUE_CAPACITY;
    private long recordTimeoutMillis = EngineDefaults.RECORD_TIMEOUT_MILLIS;
    private int recorderThreads = EngineDefaults.RECORDER_THREADS;

    // Monitoring configuration
    private boolean enableHealthMonitor = true;
    private long healthCheckIntervalSeconds = EngineDefaults.HEALTH_CHECK_INTERVAL_SECONDS;

    /**
     * Checks values that would otherwise fail later in a less obvious place.
     */
    public void validate() {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("Invalid HTTP port: " + httpPort);
        }
        if (experimentsPath == null || experimentsPath.isBlank()) {
            throw new IllegalArgumentException("Experiments path must be set");
        }
        if (enableJournal && (journalPath == null || journalPath.isBlank())) {
            throw new IllegalArgumentException("Journal path must be set when the journal is enabled");
        }
        if (journalQueueCapacity <= 0) {
            throw new IllegalArgumentException("Journal queue capacity must be positive");
        }
        if (recordTimeoutMillis < 0) {
            throw new IllegalArgumentException("Record timeout must not be negative");
        }
        if (recorderThreads <= 0) {
            throw new IllegalArgumentException("Recorder threads must be positive");
        }
    }

    // Getters and setters
    public int getHttpPort() {
        return httpPort;
    }

    public void setHttpPort(int httpPort) {
        this.httpPort = httpPort;
    }

    public boolean isEnableHttp() {
        return enableHttp;
    }

    public void setEnableHttp(boolean enableHttp) {
        this.enableHttp = enableHttp;
    }

    public String getExperimentsPath() {
        return experimentsPath;
    }

    public void setExperimentsPath(String experimentsPath) {
        this.experimentsPath = experimentsPath;
    }

    public long getConfigReloadIntervalSeconds() {
        return configReloadIntervalSeconds;
    }

    public void setConfigReloadIntervalSeconds(long configReloadIntervalSeconds) {
        this.configReloadIntervalSeconds = configReloadIntervalSeconds;
    }

    public boolean isEnableJournal() {
        return enableJournal;
    }

    public void setEnableJournal(boolean enableJournal) {
        this.enableJournal = enableJournal;
    }

    public String getJournalPath() {
        return journalPath;
    }

    public void setJournalPath(String journalPath) {
        this.journalPath = journalPath;
    }

    public int getJournalQueueCapacity() {
        return journalQueueCapacity;
    }

    public void setJournalQueueCapacity(int journalQueueCapacity) {
        this.journalQueueCapacity = journalQueueCapacity;
    }

    public long getRecordTimeoutMillis() {
        return recordTimeoutMillis;
    }

    public void setRecordTimeoutMillis(long recordTimeoutMillis) {
        this.recordTimeoutMillis = recordTimeoutMillis;
    }

    public int getRecorderThreads() {
        return recorderThreads;
    }

    public void setRecorderThreads(int recorderThreads) {
        this.recorderThreads = recorderThreads;
    }

    public boolean isEnableHealthMonitor() {
        return enableHealthMonitor;
    }

    public void setEnableHealthMonitor(boolean enableHealthMonitor) {
        this.enableHealthMonitor = enableHealthMonitor;
    }

    public long getHealthCheckIntervalSeconds() {
        return healthCheckIntervalSeconds;
    }

    public void setHealthCheckIntervalSeconds(long healthCheckIntervalSeconds) {
        this.healthCheckIntervalSeconds = healthCheckIntervalSeconds;
    }

    @Override
    public String toString() {
        return String.format(
                "CohortConfig{httpPort=%d, experiments=%s, reload=%ds, journal=%s, recordTimeout=%dms}",
                httpPort, experimentsPath, configReloadIntervalSeconds,
                enableJournal ? journalPath : "disabled", recordTimeoutMillis);
    }
}
