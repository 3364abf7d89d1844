package io.llmrelay.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Integration test for the relay's own HTTP surface: liveness endpoint,
 * unsupported methods and request id handling.
 */
@DisplayName("Relay: health, methods, request id")
class RelayEndpointsTest extends RelayTestHarness {

    private static final RelayEndpointsTest INSTANCE = new RelayEndpointsTest();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** UUID pattern (case-insensitive). */
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    @BeforeAll
    static void startInfrastructure() throws Exception {
        INSTANCE.startRelay();
    }

    @AfterAll
    static void stopAll() {
        INSTANCE.stopInfrastructure();
    }

    // ---------------------------------------------------------------
    // Liveness
    // ---------------------------------------------------------------

    @Test
    @DisplayName("GET /_relay/health → 200 {\"status\":\"UP\"}, not forwarded")
    void healthAnsweredLocally() throws Exception {
        int hitsBefore = INSTANCE.upstreamHits.get();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/_relay/health"))
                .GET()
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(response.body()).path("status").asText()).isEqualTo("UP");
        assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(ct -> assertThat(ct)
                .startsWith("application/json"));
        assertThat(INSTANCE.upstreamHits.get()).isEqualTo(hitsBefore);
    }

    @Test
    @DisplayName("health disabled → path is forwarded like any other")
    void healthDisabled() throws Exception {
        RelayEndpointsTest local = new RelayEndpointsTest();
        local.startRelay(builder -> builder.healthEnabled(false));
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(local.relayUri("/_relay/health"))
                    .GET()
                    .build();

            HttpResponse<String> response = local.testClient.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"path\":\"/api/v1/_relay/health\"");
        } finally {
            local.stopInfrastructure();
        }
    }

    // ---------------------------------------------------------------
    // Methods
    // ---------------------------------------------------------------

    @Test
    @DisplayName("PATCH → 405 problem+json, not forwarded")
    void patchRejected() throws Exception {
        int hitsBefore = INSTANCE.upstreamHits.get();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/v1/models"))
                .method("PATCH", HttpRequest.BodyPublishers.ofString("{}"))
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(ct -> assertThat(ct)
                .startsWith("application/problem+json"));
        JsonNode problem = MAPPER.readTree(response.body());
        assertThat(problem.path("type").asText()).isEqualTo(ProblemDetail.URN_METHOD_NOT_ALLOWED);
        assertThat(problem.path("status").asInt()).isEqualTo(405);
        assertThat(problem.path("detail").asText()).contains("PATCH");
        assertThat(problem.path("instance").asText()).isEqualTo("/v1/models");
        assertThat(INSTANCE.upstreamHits.get()).isEqualTo(hitsBefore);
    }

    @Test
    @DisplayName("OPTIONS is forwarded")
    void optionsForwarded() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/v1/models"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("x-upstream-method")).hasValue("OPTIONS");
    }

    // ---------------------------------------------------------------
    // Request id
    // ---------------------------------------------------------------

    @Test
    @DisplayName("no X-Request-ID → generated UUID in response")
    void requestIdGenerated() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/v1/models"))
                .GET()
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.headers().firstValue("x-request-id")).hasValueSatisfying(id -> assertThat(id)
                .matches(UUID_PATTERN));
    }

    @Test
    @DisplayName("X-Request-ID echoed in response and forwarded upstream")
    void requestIdEchoed() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/v1/models?rid=1"))
                .header("X-Request-ID", "abc-123")
                .GET()
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.headers().firstValue("x-request-id")).hasValue("abc-123");
        assertThat(receivedHeader(INSTANCE.receivedRequests.get("/api/v1/models?rid=1"), "x-request-id"))
                .containsExactly("abc-123");
    }

    @Test
    @DisplayName("rejected messages request still carries the request id")
    void requestIdOnLocalRejection() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(INSTANCE.relayUri("/v1/messages"))
                .header("X-Request-ID", "rej-1")
                .POST(HttpRequest.BodyPublishers.ofString("{\"model\":\"claude-unknown\"}"))
                .build();

        HttpResponse<String> response = INSTANCE.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.headers().firstValue("x-request-id")).hasValue("rej-1");
    }
}
