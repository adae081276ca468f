package com.platform.faultlab.infra.docker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.faultlab.error.OrchestratorException;
import com.platform.faultlab.infra.NodeState;
import com.platform.faultlab.infra.NodeStatus;
import com.platform.faultlab.observability.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DockerEngineClientTest {

    private HttpServer server;
    private DockerEngineClient client;
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final Map<String, String> bodies = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        DockerConfig config = new DockerConfig();
        config.setUrl("http://127.0.0.1:" + server.getAddress().getPort());
        client = new DockerEngineClient(config, new ObjectMapper(), new MetricsRegistry(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void pingSucceedsOnlyOn200() {
        replies.put("GET /v1.43/_ping", new Reply(200, "OK"));
        assertThat(client.ping()).isTrue();

        replies.put("GET /v1.43/_ping", new Reply(500, "down"));
        assertThat(client.ping()).isFalse();
    }

    @Test
    void pingIsFalseWhenNothingListens() {
        DockerConfig config = new DockerConfig();
        config.setUrl("http://127.0.0.1:1");
        config.setConnectionTimeoutMs(500);
        DockerEngineClient unreachable =
            new DockerEngineClient(config, new ObjectMapper(), new MetricsRegistry(new SimpleMeterRegistry()));

        assertThat(unreachable.ping()).isFalse();
    }

    @Test
    void inspectReadsStateAndNetworks() {
        replies.put("GET /v1.43/containers/mongo1/json", new Reply(200, """
            {"Name": "/mongo1",
             "State": {"Status": "running", "Running": true, "StartedAt": "2024-05-01T10:00:00.123456789Z"},
             "NetworkSettings": {"Networks": {"distributed_db_network": {"IPAddress": "172.18.0.2"}}},
             "Config": {"Image": "mongo:6"}}
            """));

        NodeStatus status = client.inspectContainer("mongo1").orElseThrow();

        assertThat(status.state()).isEqualTo(NodeState.RUNNING);
        assertThat(status.networks()).containsExactly("distributed_db_network");
        assertThat(status.startedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00.123456789Z"));
    }

    @Test
    void neverStartedContainerHasNoStartTime() {
        replies.put("GET /v1.43/containers/cassandra3/json", new Reply(200,
            "{\"State\": {\"Running\": false, \"StartedAt\": \"0001-01-01T00:00:00Z\"}}"));

        NodeStatus status = client.inspectContainer("cassandra3").orElseThrow();

        assertThat(status.state()).isEqualTo(NodeState.STOPPED);
        assertThat(status.startedAt()).isNull();
        assertThat(status.networks()).isEmpty();
    }

    @Test
    void missingContainerIsEmpty() {
        replies.put("GET /v1.43/containers/ghost/json", new Reply(404, "{\"message\": \"No such container\"}"));

        assertThat(client.inspectContainer("ghost")).isEmpty();
    }

    @Test
    void stopPassesGraceTimeoutAndToleratesAlreadyStopped() {
        replies.put("POST /v1.43/containers/mongo1/stop", new Reply(304, ""));

        client.stopContainer("mongo1", 5);

        assertThat(requests).containsExactly("POST /v1.43/containers/mongo1/stop?t=5");
    }

    @Test
    void unexpectedStatusRaisesOrchestratorException() {
        replies.put("POST /v1.43/containers/mongo2/start", new Reply(500, "{\"message\": \"driver failed\"}"));

        assertThatThrownBy(() -> client.startContainer("mongo2"))
            .isInstanceOf(OrchestratorException.class)
            .hasMessageContaining("HTTP 500")
            .hasFieldOrPropertyWithValue("statusCode", 500)
            .hasFieldOrPropertyWithValue("operation", "start");
    }

    @Test
    void disconnectSendsContainerInBody() {
        replies.put("POST /v1.43/networks/distributed_db_network/disconnect", new Reply(200, ""));

        client.disconnect("distributed_db_network", "cassandra1");

        assertThat(bodies.get("POST /v1.43/networks/distributed_db_network/disconnect"))
            .contains("\"Container\":\"cassandra1\"")
            .contains("\"Force\":false");
    }

    @Test
    void networkExistsFollowsStatus() {
        replies.put("GET /v1.43/networks/distributed_db_network", new Reply(200, "{}"));
        replies.put("GET /v1.43/networks/other", new Reply(404, ""));

        assertThat(client.networkExists("distributed_db_network")).isTrue();
        assertThat(client.networkExists("other")).isFalse();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getRawQuery();
        requests.add(query != null ? key + "?" + query : key);
        bodies.put(key, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

        Reply reply = replies.getOrDefault(key, new Reply(404, "{\"message\": \"not mocked\"}"));
        byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
        if (reply.status() == 304 || body.length == 0) {
            exchange.sendResponseHeaders(reply.status(), -1);
        } else {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        }
        exchange.close();
    }

    private record Reply(int status, String body) {
    }
}
