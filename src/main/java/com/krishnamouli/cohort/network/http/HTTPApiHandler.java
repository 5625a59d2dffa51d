package com.krishnamouli.cohort.network.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.core.ExperimentEngine;
import com.krishnamouli.cohort.exception.ConfigurationException;
import com.krishnamouli.cohort.exception.ExperimentNotFoundException;
import com.krishnamouli.cohort.model.ExperimentAssignment;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.model.RecordedAssignment;
import com.krishnamouli.cohort.model.Subject;
import com.krishnamouli.cohort.model.SubjectType;
import com.krishnamouli.cohort.monitoring.EngineHealthMonitor;
import com.krishnamouli.cohort.monitoring.ExperimentTracker;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.store.ConfigSnapshot;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP/JSON API over the experiment engine.
 * Assignment, recording, conversion, configuration and monitoring endpoints.
 */
public class HTTPApiHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger logger = LoggerFactory.getLogger(HTTPApiHandler.class);
    private static final TypeReference<List<ExperimentConfig>> CONFIG_LIST = new TypeReference<>() {
    };

    private final ExperimentEngine engine;
    private final EngineHealthMonitor healthMonitor;
    private final ObjectMapper objectMapper;

    public HTTPApiHandler(ExperimentEngine engine, EngineHealthMonitor healthMonitor) {
        this.engine = engine;
        this.healthMonitor = healthMonitor;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String uri = request.uri();
        HttpMethod method = request.method();
        QueryStringDecoder query = new QueryStringDecoder(uri);
        String path = query.path();

        try {
            FullHttpResponse response;

            if (method == HttpMethod.GET && path.equals("/assign")) {
                response = handleAssign(query);
            } else if (method == HttpMethod.POST && path.equals("/assignments")) {
                response = handleRecord(request);
            } else if (method == HttpMethod.GET && path.equals("/assignments")) {
                response = handleFindRecorded(query);
            } else if (method == HttpMethod.POST && path.equals("/conversions")) {
                response = handleConversion(request);
            } else if (method == HttpMethod.GET && path.equals("/experiments")) {
                response = handleListExperiments();
            } else if (method == HttpMethod.PUT && path.equals("/experiments")) {
                response = handlePublish(request);
            } else if (method == HttpMethod.GET && path.equals("/health")) {
                response = handleHealth();
            } else if (method == HttpMethod.GET && path.equals("/metrics")) {
                response = handleMetrics();
            } else if (method == HttpMethod.GET && path.equals("/stats")) {
                response = handleStats();
            } else {
                response = createErrorResponse(HttpResponseStatus.NOT_FOUND, "Not Found");
            }

            sendResponse(ctx, response);

        } catch (ExperimentNotFoundException e) {
            sendResponse(ctx, createErrorResponse(HttpResponseStatus.NOT_FOUND, e.getMessage()));
        } catch (ConfigurationException | IllegalArgumentException e) {
            sendResponse(ctx, createErrorResponse(HttpResponseStatus.BAD_REQUEST, e.getMessage()));
        } catch (Exception e) {
            logger.error("Error handling HTTP request: {}", uri, e);
            sendResponse(ctx, createErrorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, e.getMessage()));
        }
    }

    private FullHttpResponse handleAssign(QueryStringDecoder query) throws Exception {
        String subjectKey = requiredParam(query, "subject");
        String experimentKey = requiredParam(query, "experiment");
        Subject subject = new Subject(subjectKey, SubjectType.fromString(param(query, "subjectType")));

        ExperimentAssignment assignment = Boolean.parseBoolean(param(query, "record"))
                ? engine.assign(subject, experimentKey)
                : engine.resolve(subject, experimentKey);
        return createJsonResponse(HttpResponseStatus.OK, assignment);
    }

    private FullHttpResponse handleRecord(FullHttpRequest request) throws Exception {
        JsonNode body = readBody(request);
        String experimentKey = requiredField(body, "experimentKey");
        Subject subject;
        if (body.hasNonNull("subjectKey")) {
            subject = new Subject(requiredField(body, "subjectKey"),
                    SubjectType.fromString(body.path("subjectType").asText(null)));
        } else {
            subject = Subject.of(body.path("userId").asText(null), body.path("sessionId").asText(null));
        }

        ExperimentAssignment stored = engine.assign(subject, experimentKey);
        return createJsonResponse(HttpResponseStatus.OK, stored);
    }

    private FullHttpResponse handleFindRecorded(QueryStringDecoder query) throws Exception {
        String subjectKey = requiredParam(query, "subject");
        String experimentKey = requiredParam(query, "experiment");
        RecordedAssignment recorded = engine.findRecorded(subjectKey, experimentKey).orElse(null);
        if (recorded == null) {
            return createErrorResponse(HttpResponseStatus.NOT_FOUND,
                    "No recorded assignment for " + subjectKey + " in " + experimentKey);
        }
        return createJsonResponse(HttpResponseStatus.OK, recorded);
    }

    private FullHttpResponse handleConversion(FullHttpRequest request) throws Exception {
        JsonNode body = readBody(request);
        String experimentKey = requiredField(body, "experimentKey");
        String subjectKey = requiredField(body, "subjectKey");
        String event = requiredField(body, "event");
        long latencyMs = body.path("latencyMs").asLong(0);

        boolean counted = engine.recordConversion(experimentKey, subjectKey, event, latencyMs);
        return createJsonResponse(HttpResponseStatus.ACCEPTED, Map.of("counted", counted));
    }

    private FullHttpResponse handleListExperiments() throws Exception {
        return createJsonResponse(HttpResponseStatus.OK, describe(engine.snapshot()));
    }

    private FullHttpResponse handlePublish(FullHttpRequest request) throws Exception {
        JsonNode body = readBody(request);
        JsonNode array = body.isObject() ? body.get("experiments") : body;
        if (array == null || !array.isArray()) {
            throw new ConfigurationException("Expected an array of experiments or an 'experiments' field");
        }
        List<ExperimentConfig> configs;
        try {
            configs = objectMapper.convertValue(array, CONFIG_LIST);
        } catch (IllegalArgumentException e) {
            throw configurationCause(e);
        }
        ConfigSnapshot snapshot = engine.publish(configs);
        return createJsonResponse(HttpResponseStatus.OK, describe(snapshot));
    }

    private FullHttpResponse handleHealth() throws Exception {
        EngineHealthMonitor.HealthReport report = healthMonitor.getLastReport();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("score", report.getScore());
        data.put("status", report.isHealthy() ? "healthy" : "degraded");
        data.put("snapshotVersion", report.getSnapshotVersion());
        data.put("experiments", report.getExperiments());
        List<Map<String, String>> issues = new ArrayList<>();
        for (EngineHealthMonitor.HealthIssue issue : report.getIssues()) {
            issues.add(Map.of("severity", issue.severity.name(), "message", issue.message));
        }
        data.put("issues", issues);

        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private FullHttpResponse handleMetrics() {
        MetricsCollector metrics = engine.getMetrics();
        MetricsCollector.MetricsSnapshot snapshot = metrics.getSnapshot();

        // Prometheus-compatible format
        StringBuilder prometheus = new StringBuilder();
        prometheus.append("# HELP cohort_resolutions_total Total resolve calls\n");
        prometheus.append("# TYPE cohort_resolutions_total counter\n");
        prometheus.append(String.format("cohort_resolutions_total %d\n", snapshot.resolutions));

        prometheus.append("# HELP cohort_participations_total Resolutions that placed the subject in an experiment\n");
        prometheus.append("# TYPE cohort_participations_total counter\n");
        prometheus.append(String.format("cohort_participations_total %d\n", snapshot.participations));

        prometheus.append("# HELP cohort_not_found_total Resolutions for unknown experiments\n");
        prometheus.append("# TYPE cohort_not_found_total counter\n");
        prometheus.append(String.format("cohort_not_found_total %d\n", snapshot.notFound));

        prometheus.append("# HELP cohort_records_total Recording outcomes\n");
        prometheus.append("# TYPE cohort_records_total counter\n");
        prometheus.append(String.format("cohort_records_total{outcome=\"written\"} %d\n", snapshot.recordsWritten));
        prometheus.append(String.format("cohort_records_total{outcome=\"existing\"} %d\n", snapshot.recordsExisting));
        prometheus.append(String.format("cohort_records_total{outcome=\"failed\"} %d\n", snapshot.recordingFailures));

        prometheus.append("# HELP cohort_record_timeouts_total Calls that stopped waiting for a recording write\n");
        prometheus.append("# TYPE cohort_record_timeouts_total counter\n");
        prometheus.append(String.format("cohort_record_timeouts_total %d\n", snapshot.recordingTimeouts));

        prometheus.append("# HELP cohort_resolve_latency_milliseconds Resolve latency percentiles\n");
        prometheus.append("# TYPE cohort_resolve_latency_milliseconds summary\n");
        prometheus.append(String.format("cohort_resolve_latency_milliseconds{quantile=\"0.5\"} %.4f\n",
                snapshot.p50LatencyMs));
        prometheus.append(String.format("cohort_resolve_latency_milliseconds{quantile=\"0.95\"} %.4f\n",
                snapshot.p95LatencyMs));
        prometheus.append(String.format("cohort_resolve_latency_milliseconds{quantile=\"0.99\"} %.4f\n",
                snapshot.p99LatencyMs));

        prometheus.append("# HELP cohort_exposures_total First recorded exposures per variant\n");
        prometheus.append("# TYPE cohort_exposures_total counter\n");
        for (ExperimentTracker tracker : metrics.getTrackers()) {
            for (ExperimentTracker.VariantMetrics variant : tracker.getMetrics()) {
                prometheus.append(String.format("cohort_exposures_total{experiment=\"%s\",variant=\"%s\"} %d\n",
                        tracker.getExperimentKey(), variant.variant, variant.exposures));
            }
        }

        prometheus.append("# HELP cohort_conversions_total Conversion events per variant\n");
        prometheus.append("# TYPE cohort_conversions_total counter\n");
        for (ExperimentTracker tracker : metrics.getTrackers()) {
            for (ExperimentTracker.VariantMetrics variant : tracker.getMetrics()) {
                for (Map.Entry<String, Long> conversion : variant.conversions.entrySet()) {
                    prometheus.append(String.format(
                            "cohort_conversions_total{experiment=\"%s\",variant=\"%s\",event=\"%s\"} %d\n",
                            tracker.getExperimentKey(), variant.variant, conversion.getKey(),
                            conversion.getValue()));
                }
            }
        }

        return createTextResponse(HttpResponseStatus.OK, prometheus.toString());
    }

    private FullHttpResponse handleStats() throws Exception {
        MetricsCollector metrics = engine.getMetrics();
        MetricsCollector.MetricsSnapshot snapshot = metrics.getSnapshot();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("resolutions", snapshot.resolutions);
        data.put("participations", snapshot.participations);
        data.put("participationRate", snapshot.getParticipationRate());
        data.put("notFound", snapshot.notFound);
        data.put("recorded", engine.recordedCount());
        data.put("recordingFailures", snapshot.recordingFailures);
        data.put("recordingTimeouts", snapshot.recordingTimeouts);
        data.put("latency", Map.of(
                "p50Ms", snapshot.p50LatencyMs,
                "p95Ms", snapshot.p95LatencyMs,
                "p99Ms", snapshot.p99LatencyMs));

        Map<String, Object> experiments = new LinkedHashMap<>();
        for (ExperimentTracker tracker : metrics.getTrackers()) {
            Map<String, Object> variants = new LinkedHashMap<>();
            for (ExperimentTracker.VariantMetrics variant : tracker.getMetrics()) {
                variants.put(variant.variant, Map.of(
                        "exposures", variant.exposures,
                        "conversions", variant.conversions,
                        "p50Ms", variant.p50LatencyMs,
                        "p99Ms", variant.p99LatencyMs));
            }
            experiments.put(tracker.getExperimentKey(), variants);
        }
        data.put("experiments", experiments);

        return createJsonResponse(HttpResponseStatus.OK, data);
    }

    private Map<String, Object> describe(ConfigSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", snapshot.getVersion());
        data.put("publishedAt", snapshot.getPublishedAt().toString());
        data.put("experiments", new ArrayList<>(snapshot.getExperiments().values()));
        return data;
    }

    private JsonNode readBody(FullHttpRequest request) {
        String content = request.content().toString(StandardCharsets.UTF_8);
        if (content.isBlank()) {
            throw new IllegalArgumentException("Request body is required");
        }
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
    }

    private static String param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String requiredParam(QueryStringDecoder query, String name) {
        String value = param(query, name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing query parameter: " + name);
        }
        return value;
    }

    private static String requiredField(JsonNode body, String name) {
        JsonNode node = body.get(name);
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            throw new IllegalArgumentException("Missing field: " + name);
        }
        return node.asText();
    }

    private static ConfigurationException configurationCause(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConfigurationException) {
                return (ConfigurationException) cause;
            }
            cause = cause.getCause();
        }
        return new ConfigurationException("Invalid experiment definition: " + e.getMessage(), e);
    }

    private FullHttpResponse createJsonResponse(HttpResponseStatus status, Object data) throws Exception {
        String json = objectMapper.writeValueAsString(data);
        byte[] content = json.getBytes(StandardCharsets.UTF_8);

        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(content));

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);

        return response;
    }

    private FullHttpResponse createTextResponse(HttpResponseStatus status, String text) {
        byte[] content = text.getBytes(StandardCharsets.UTF_8);

        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(content));

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.length);

        return response;
    }

    private FullHttpResponse createErrorResponse(HttpResponseStatus status, String message) {
        try {
            return createJsonResponse(status, Map.of("error", message != null ? message : status.reasonPhrase()));
        } catch (Exception e) {
            return createTextResponse(status, "Error: " + message);
        }
    }

    private void sendResponse(ChannelHandlerContext ctx, FullHttpResponse response) {
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("HTTP handler exception", cause);
        ctx.close();
    }
}
