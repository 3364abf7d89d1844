package io.llmrelay.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Integration test for an unreachable upstream: {@code 502} with a
 * route-specific plain-text body.
 */
@DisplayName("Relay: unreachable upstream")
class UpstreamUnreachableTest extends RelayTestHarness {

    private static final UpstreamUnreachableTest HARNESS = new UpstreamUnreachableTest();

    @BeforeAll
    static void startInfrastructure() throws Exception {
        HARNESS.startRelay(builder -> builder.openAiBaseUrl("http://127.0.0.1:1/api/v1")
                .anthropicBaseUrl("http://127.0.0.1:1/api/anthropic/v1")
                .modelMap(Map.of("claude-sonnet-4-20250514", "anthropic/claude-sonnet-4")));
    }

    @AfterAll
    static void stopAll() {
        HARNESS.stopInfrastructure();
    }

    @Test
    @DisplayName("chat completions → 502 Connection Error")
    void chatCompletions() throws Exception {
        HttpResponse<String> response =
                HARNESS.postJson("/v1/chat/completions", "{\"model\":\"gpt-4o\",\"stream\":true}");

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(response.body()).startsWith("Connection Error: ");
        assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(ct -> assertThat(ct)
                .startsWith("text/plain"));
    }

    @Test
    @DisplayName("messages → 502 Connection Error")
    void messages() throws Exception {
        HttpResponse<String> response =
                HARNESS.postJson("/v1/messages", "{\"model\":\"claude-sonnet-4-20250514\"}");

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(response.body()).startsWith("Connection Error: ");
    }

    @Test
    @DisplayName("pass-through → 502 Proxy Error")
    void passthrough() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(HARNESS.relayUri("/v1/models"))
                .GET()
                .build();

        HttpResponse<String> response = HARNESS.testClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(response.body()).startsWith("Proxy Error: ");
    }

    @Test
    @DisplayName("failed sends leave no connection behind")
    void noConnectionOpened() throws Exception {
        HARNESS.postJson("/v1/chat/completions", "{\"stream\":true}");

        assertThat(HARNESS.connections.opened.get()).isZero();
        assertThat(HARNESS.connections.closed.get()).isZero();
    }
}
