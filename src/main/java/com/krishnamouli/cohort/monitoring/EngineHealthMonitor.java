package com.krishnamouli.cohort.monitoring;

import com.krishnamouli.cohort.config.EngineDefaults;
import com.krishnamouli.cohort.store.ConfigSnapshot;
import com.krishnamouli.cohort.store.ConfigurationStore;
import com.krishnamouli.cohort.store.ExperimentFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic health check over configuration state and recording failures.
 */
public class EngineHealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(EngineHealthMonitor.class);

    private final ConfigurationStore store;
    private final MetricsCollector metrics;
    private final ExperimentFileLoader loader;
    private final ScheduledExecutorService scheduler;
    private volatile HealthReport lastReport;

    /**
     * @param loader may be null when configuration is only published programmatically
     */
    public EngineHealthMonitor(ConfigurationStore store, MetricsCollector metrics,
            ExperimentFileLoader loader, long checkIntervalSeconds) {
        this.store = store;
        this.metrics = metrics;
        this.loader = loader;

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cohort-health-monitor");
            t.setDaemon(true);
            return t;
        });

        if (checkIntervalSeconds > 0) {
            scheduler.scheduleAtFixedRate(
                    this::runHealthCheck,
                    checkIntervalSeconds,
                    checkIntervalSeconds,
                    TimeUnit.SECONDS);
            logger.info("Health monitoring started: interval={}s", checkIntervalSeconds);
        }
    }

    public HealthReport diagnose() {
        MetricsCollector.MetricsSnapshot snapshot = metrics.getSnapshot();
        ConfigSnapshot config = store.snapshot();
        HealthReport report = new HealthReport(config.getVersion(), config.size());
        int score = 100;

        if (config.getVersion() == 0) {
            report.addIssue(Severity.HIGH, "No experiment configuration has been published");
            score -= 40;
        } else if (config.size() == 0) {
            report.addIssue(Severity.LOW, "Published snapshot contains no experiments");
        }

        double failureRate = snapshot.getRecordingFailureRate();
        if (failureRate > EngineDefaults.RECORDING_FAILURE_RATE_THRESHOLD) {
            report.addIssue(Severity.HIGH, String.format(
                    "Recording failure rate %.1f%% (%d failures). Check the assignment store.",
                    failureRate * 100, snapshot.recordingFailures));
            score -= 30;
        } else if (snapshot.recordingFailures > 0) {
            report.addIssue(Severity.LOW,
                    String.format("%d recording failures", snapshot.recordingFailures));
            score -= 5;
        }

        if (snapshot.recordingTimeouts > 0) {
            report.addIssue(Severity.INFO, String.format(
                    "%d recording calls returned before the store answered", snapshot.recordingTimeouts));
        }

        if (loader != null && loader.getFailedReloads() > 0) {
            report.addIssue(Severity.MEDIUM, String.format(
                    "%d rejected reloads of %s; serving snapshot v%d",
                    loader.getFailedReloads(), loader.getPath(), config.getVersion()));
            score -= 15;
        }

        if (snapshot.notFound > 0) {
            report.addIssue(Severity.INFO,
                    String.format("%d lookups for unknown experiments", snapshot.notFound));
        }

        report.setScore(Math.max(0, score));
        return report;
    }

    public HealthReport getLastReport() {
        return lastReport != null ? lastReport : diagnose();
    }

    public void shutdown() {
        logger.info("Health monitor shutting down");
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

    private void runHealthCheck() {
        try {
            HealthReport report = diagnose();
            lastReport = report;

            if (!report.getIssues().isEmpty()) {
                logger.info("Health check: score={}/100, issues={}",
                        report.getScore(), report.getIssues().size());

                for (HealthIssue issue : report.getIssues()) {
                    if (issue.severity == Severity.HIGH) {
                        logger.warn("Health issue: {}", issue.message);
                    }
                }
            }
        } catch (Exception e) {
            logger.error("Health check failed", e);
        }
    }

    public static class HealthReport {
        private final List<HealthIssue> issues = new ArrayList<>();
        private final long snapshotVersion;
        private final int experiments;
        private int score;

        public HealthReport(long snapshotVersion, int experiments) {
            this.snapshotVersion = snapshotVersion;
            this.experiments = experiments;
        }

        public void addIssue(Severity severity, String message) {
            issues.add(new HealthIssue(severity, message));
        }

        public void setScore(int score) {
            this.score = score;
        }

        public List<HealthIssue> getIssues() {
            return issues;
        }

        public int getScore() {
            return score;
        }

        public long getSnapshotVersion() {
            return snapshotVersion;
        }

        public int getExperiments() {
            return experiments;
        }

        public boolean isHealthy() {
            return score > EngineDefaults.HEALTHY_SCORE_THRESHOLD;
        }
    }

    public static class HealthIssue {
        public final Severity severity;
        public final String message;

        public HealthIssue(Severity severity, String message) {
            this.severity = severity;
            this.message = message;
        }
    }

    public enum Severity {
        INFO, LOW, MEDIUM, HIGH
    }
}
