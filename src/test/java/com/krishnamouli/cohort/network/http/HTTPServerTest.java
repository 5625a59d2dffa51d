package com.krishnamouli.cohort.network.http;

import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.core.ExperimentEngine;
import com.krishnamouli.cohort.model.ExperimentConfig;
import com.krishnamouli.cohort.monitoring.EngineHealthMonitor;
import com.krishnamouli.cohort.monitoring.MetricsCollector;
import com.krishnamouli.cohort.recording.AssignmentRecorder;
import com.krishnamouli.cohort.recording.InMemoryAssignmentStore;
import com.krishnamouli.cohort.store.ConfigurationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HTTPServerTest {

    private AssignmentRecorder recorder;
    private EngineHealthMonitor healthMonitor;
    private HTTPServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws InterruptedException {
        ConfigurationStore store = new ConfigurationStore();
        MetricsCollector metrics = new MetricsCollector();
        recorder = new AssignmentRecorder(new InMemoryAssignmentStore(), metrics, 1000, 2);
        ExperimentEngine engine = new ExperimentEngine(store, recorder, metrics);
        healthMonitor = new EngineHealthMonitor(store, metrics, null, 0);
        engine.publish(List.of(ExperimentConfig.builder("inv.strategy")
                .variants("optimistic", "pessimistic")
                .build()));

        CohortConfig config = new CohortConfig();
        config.setHttpPort(0);
        server = new HTTPServer(config, engine, healthMonitor);
        server.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.shutdown();
        healthMonitor.shutdown();
        recorder.shutdown();
    }

    @Test
    @Timeout(20)
    void testServesAssignmentsOverTheWire() throws Exception {
        assertTrue(server.getPort() > 0);

        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(uri("/assign?subject=user-42&experiment=inv.strategy")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"variant\":\"pessimistic\""), response.body());
    }

    @Test
    @Timeout(20)
    void testPublishOverTheWire() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(uri("/experiments"))
                        .PUT(HttpRequest.BodyPublishers.ofString(
                                "[{\"key\":\"search.ranking\",\"variants\":[\"bm25\",\"learned\"],\"sampling\":1.0,\"status\":\"active\"}]"))
                        .header("Content-Type", "application/json")
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"version\":2"), response.body());
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.getPort() + pathAndQuery);
    }
}
