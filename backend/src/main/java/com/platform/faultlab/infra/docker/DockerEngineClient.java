package com.platform.faultlab.infra.docker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.faultlab.error.OrchestratorException;
import com.platform.faultlab.infra.NodeState;
import com.platform.faultlab.infra.NodeStatus;
import com.platform.faultlab.infra.OrchestratorBackend;
import com.platform.faultlab.infra.docker.DockerModels.ConnectRequest;
import com.platform.faultlab.infra.docker.DockerModels.ContainerInspect;
import com.platform.faultlab.infra.docker.DockerModels.DisconnectRequest;
import com.platform.faultlab.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;

/**
 * Client for the Docker Engine REST API.
 * Stops, starts and inspects containers and moves them in and out of networks.
 */
@Slf4j
@Component
public class DockerEngineClient implements OrchestratorBackend {

    private final DockerConfig config;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;

    public DockerEngineClient(DockerConfig config, ObjectMapper objectMapper, MetricsRegistry metricsRegistry) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.getConnectionTimeoutMs()))
            .build();
    }

    @Override
    public boolean ping() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getApiUrl() + "/_ping"))
                .timeout(Duration.ofMillis(config.getConnectionTimeoutMs()))
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            boolean available = response.statusCode() == 200;
            if (available) {
                log.info("Docker Engine available at {}", config.getApiUrl());
            } else {
                log.warn("Docker Engine at {} answered ping with HTTP {}", config.getApiUrl(), response.statusCode());
            }
            return available;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Docker Engine not reachable at {}: {}", config.getApiUrl(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<NodeStatus> inspectContainer(String name) {
        HttpResponse<String> response = send("inspect",
            get("/containers/" + encode(name) + "/json"));

        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        expect("inspect", response, 200);

        try {
            ContainerInspect inspect = objectMapper.readValue(response.body(), ContainerInspect.class);
            return Optional.of(toNodeStatus(name, inspect));
        } catch (IOException e) {
            throw new OrchestratorException("inspect", "Unreadable inspect response for " + name, e);
        }
    }

    @Override
    public void stopContainer(String name, int timeoutSeconds) {
        HttpResponse<String> response = send("stop",
            post("/containers/" + encode(name) + "/stop?t=" + timeoutSeconds, null,
                Duration.ofMillis(config.getReadTimeoutMs()).plusSeconds(timeoutSeconds)));

        if (response.statusCode() == 304) {
            log.debug("Container {} already stopped", name);
            return;
        }
        expect("stop", response, 204);
        log.info("Stopped container {}", name);
        metricsRegistry.incrementCounter("faultlab.docker.operations", "operation", "stop");
    }

    @Override
    public void startContainer(String name) {
        HttpResponse<String> response = send("start",
            post("/containers/" + encode(name) + "/start", null, Duration.ofMillis(config.getReadTimeoutMs())));

        if (response.statusCode() == 304) {
            log.debug("Container {} already running", name);
            return;
        }
        expect("start", response, 204);
        log.info("Started container {}", name);
        metricsRegistry.incrementCounter("faultlab.docker.operations", "operation", "start");
    }

    @Override
    public boolean networkExists(String network) {
        HttpResponse<String> response = send("network", get("/networks/" + encode(network)));
        if (response.statusCode() == 404) {
            return false;
        }
        expect("network", response, 200);
        return true;
    }

    @Override
    public void disconnect(String network, String container) {
        String body = toJson(new DisconnectRequest(container, false));
        HttpResponse<String> response = send("disconnect",
            post("/networks/" + encode(network) + "/disconnect", body, Duration.ofMillis(config.getReadTimeoutMs())));

        expect("disconnect", response, 200);
        log.info("Disconnected {} from network {}", container, network);
        metricsRegistry.incrementCounter("faultlab.docker.operations", "operation", "disconnect");
    }

    @Override
    public void connect(String network, String container) {
        String body = toJson(new ConnectRequest(container));
        HttpResponse<String> response = send("connect",
            post("/networks/" + encode(network) + "/connect", body, Duration.ofMillis(config.getReadTimeoutMs())));

        expect("connect", response, 200);
        log.info("Connected {} to network {}", container, network);
        metricsRegistry.incrementCounter("faultlab.docker.operations", "operation", "connect");
    }

    // ==================== HTTP helpers ====================

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(config.getApiUrl() + path))
            .timeout(Duration.ofMillis(config.getReadTimeoutMs()))
            .GET()
            .build();
    }

    private HttpRequest post(String path, String json, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(config.getApiUrl() + path))
            .timeout(timeout);
        if (json != null) {
            builder.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        } else {
            builder.POST(HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private HttpResponse<String> send(String operation, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestratorException(operation, "Interrupted while calling Docker " + operation, e);
        } catch (IOException e) {
            throw new OrchestratorException(operation,
                String.format("Docker %s request to %s failed: %s", operation, request.uri(), e.getMessage()), e);
        }
    }

    private void expect(String operation, HttpResponse<String> response, int expectedStatus) {
        if (response.statusCode() != expectedStatus) {
            throw OrchestratorException.unexpectedStatus(operation, response.statusCode(), response.body());
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new OrchestratorException("serialize", "Failed to serialize Docker request", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    static NodeStatus toNodeStatus(String name, ContainerInspect inspect) {
        NodeState state = NodeState.UNKNOWN;
        Instant startedAt = null;
        if (inspect.getState() != null) {
            state = inspect.getState().isRunning() ? NodeState.RUNNING : NodeState.STOPPED;
            startedAt = parseStartedAt(inspect.getState().getStartedAt());
        }
        Set<String> networks = Set.of();
        if (inspect.getNetworkSettings() != null && inspect.getNetworkSettings().getNetworks() != null) {
            networks = inspect.getNetworkSettings().getNetworks().keySet();
        }
        return new NodeStatus(name, state, networks, startedAt);
    }

    private static Instant parseStartedAt(String startedAt) {
        if (startedAt == null || startedAt.isBlank()) {
            return null;
        }
        try {
            Instant parsed = Instant.parse(startedAt);
            // Docker reports 0001-01-01T00:00:00Z for containers that never started
            return parsed.isBefore(Instant.EPOCH) ? null : parsed;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable StartedAt '{}'", startedAt);
            return null;
        }
    }
}
