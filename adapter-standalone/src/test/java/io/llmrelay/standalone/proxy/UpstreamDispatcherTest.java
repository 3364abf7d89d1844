package io.llmrelay.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import io.llmrelay.core.model.HttpHeaders;
import io.llmrelay.core.model.MessageBody;
import io.llmrelay.core.model.OutboundRequest;
import io.llmrelay.standalone.config.RelayConfig;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link UpstreamDispatcher} against a JDK {@link HttpServer} mock
 * upstream.
 */
class UpstreamDispatcherTest {

    private static HttpServer upstream;
    private static String baseUrl;

    private static final AtomicReference<Headers> receivedHeaders = new AtomicReference<>();
    private static final AtomicReference<byte[]> receivedBody = new AtomicReference<>();
    private static final AtomicReference<URI> receivedUri = new AtomicReference<>();

    @BeforeAll
    static void startUpstream() throws IOException {
        upstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        upstream.setExecutor(Executors.newCachedThreadPool());
        baseUrl = "http://127.0.0.1:" + upstream.getAddress().getPort();

        upstream.createContext("/echo", exchange -> {
            receivedHeaders.set(exchange.getRequestHeaders());
            receivedBody.set(exchange.getRequestBody().readAllBytes());
            receivedUri.set(exchange.getRequestURI());

            byte[] bytes = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.getResponseHeaders().set("X-Custom", "preserved");
            exchange.getResponseHeaders().add("Set-Cookie", "a=1");
            exchange.getResponseHeaders().add("Set-Cookie", "b=2");
            exchange.getResponseHeaders().set("Keep-Alive", "timeout=5");
            exchange.getResponseHeaders().set("Proxy-Authenticate", "Basic");
            exchange.getResponseHeaders().set("Content-Encoding", "identity");
            exchange.sendResponseHeaders(201, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });

        upstream.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });

        upstream.start();
    }

    @AfterAll
    static void stopUpstream() {
        if (upstream != null) {
            upstream.stop(0);
        }
    }

    private static RelayConfig.Builder config() {
        return RelayConfig.builder().connectTimeoutMs(2000);
    }

    private static OutboundRequest post(String url, String body, Map<String, List<String>> headers) {
        return new OutboundRequest("POST", url, HttpHeaders.ofMulti(headers), MessageBody.json(body), false);
    }

    @Nested
    @DisplayName("sendBuffered")
    class SendBuffered {

        @Test
        @DisplayName("status and body are returned, framing and hop-by-hop headers dropped")
        void mirrorsResponse() throws Exception {
            CountingConnectionListener listener = new CountingConnectionListener();
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().build(), listener);

            UpstreamResponse response = dispatcher.sendBuffered(post(baseUrl + "/echo", "{}", Map.of()));

            assertThat(response.statusCode()).isEqualTo(201);
            assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"ok\":true}");
            assertThat(response.headers().first("x-custom")).isEqualTo("preserved");
            assertThat(response.headers().all("set-cookie")).containsExactlyInAnyOrder("a=1", "b=2");
            assertThat(response.headers().contains("content-type")).isTrue();
            assertThat(response.headers().contains("content-length")).isFalse();
            assertThat(response.headers().contains("content-encoding")).isFalse();
            assertThat(response.headers().contains("keep-alive")).isFalse();
            assertThat(response.headers().contains("proxy-authenticate")).isFalse();
            assertThat(listener.opened.get()).isEqualTo(1);
            assertThat(listener.closed.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("request headers, repeated values and body bytes reach upstream")
        void forwardsRequest() throws Exception {
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().build());

            dispatcher.sendBuffered(post(
                    baseUrl + "/echo?a=1&a=2",
                    "{\"model\":\"gpt-4o\"}",
                    Map.of(
                            "authorization", List.of("Bearer sk-test"),
                            "x-multi", List.of("v1", "v2"),
                            "upgrade", List.of("websocket"))));

            assertThat(receivedHeaders.get().getFirst("Authorization")).isEqualTo("Bearer sk-test");
            assertThat(receivedHeaders.get().get("X-multi")).containsExactly("v1", "v2");
            assertThat(receivedHeaders.get().containsKey("Upgrade")).isFalse();
            assertThat(new String(receivedBody.get(), StandardCharsets.UTF_8)).isEqualTo("{\"model\":\"gpt-4o\"}");
            assertThat(receivedUri.get().getRawQuery()).isEqualTo("a=1&a=2");
        }
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("returns the unread body; closing releases it once")
        void returnsOpenConnection() throws Exception {
            CountingConnectionListener listener = new CountingConnectionListener();
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().build(), listener);

            try (UpstreamConnection connection = dispatcher.open(post(baseUrl + "/echo", "{}", Map.of()))) {
                assertThat(connection.status()).isEqualTo(201);
                assertThat(listener.opened.get()).isEqualTo(1);
                assertThat(listener.closed.get()).isZero();
                assertThat(new String(connection.body().readAllBytes(), StandardCharsets.UTF_8))
                        .isEqualTo("{\"ok\":true}");
            }
            assertThat(listener.closed.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("refused connection → UpstreamConnectException, nothing left open")
        void connectionRefused() {
            CountingConnectionListener listener = new CountingConnectionListener();
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().build(), listener);

            assertThatThrownBy(() -> dispatcher.open(post("http://127.0.0.1:1/v1/chat/completions", "{}", Map.of())))
                    .isInstanceOf(UpstreamConnectException.class)
                    .hasMessageContaining("127.0.0.1:1");
            assertThat(listener.opened.get()).isZero();
        }

        @Test
        @DisplayName("no headers within the response ceiling → UpstreamTimeoutException")
        void responseTimeout() {
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().responseTimeoutMs(300).build());

            assertThatThrownBy(() -> dispatcher.sendBuffered(post(baseUrl + "/slow", "{}", Map.of())))
                    .isInstanceOf(UpstreamTimeoutException.class)
                    .hasMessageContaining("300ms");
        }

        @Test
        @DisplayName("malformed target URL → UpstreamConnectException")
        void invalidUrl() {
            UpstreamDispatcher dispatcher = new UpstreamDispatcher(config().build());

            assertThatThrownBy(() -> dispatcher.sendBuffered(post("http://bad host/x", "{}", Map.of())))
                    .isInstanceOf(UpstreamConnectException.class);
        }
    }

    @Nested
    @DisplayName("client setup")
    class ClientSetup {

        @Test
        void usesHttp11AndNoRedirects() {
            HttpClient client = new UpstreamDispatcher(config().build()).httpClient();
            assertThat(client.version()).isEqualTo(HttpClient.Version.HTTP_1_1);
            assertThat(client.followRedirects()).isEqualTo(HttpClient.Redirect.NEVER);
            assertThat(client.proxy()).isEmpty();
        }

        @Test
        void forwardProxyIsConfigured() {
            HttpClient client = new UpstreamDispatcher(config().proxyUrl("http://127.0.0.1:7890").build()).httpClient();
            assertThat(client.proxy()).isPresent();
        }

        @Test
        void proxySelectorParsesHostAndPort() {
            List<Proxy> proxies =
                    UpstreamDispatcher.proxySelector("http://127.0.0.1:7890").select(URI.create("https://zenmux.ai"));
            assertThat(proxies).hasSize(1);
            InetSocketAddress address = (InetSocketAddress) proxies.get(0).address();
            assertThat(address.getHostString()).isEqualTo("127.0.0.1");
            assertThat(address.getPort()).isEqualTo(7890);
        }

        @Test
        void proxySelectorDefaultsPortByScheme() {
            InetSocketAddress address = (InetSocketAddress) UpstreamDispatcher.proxySelector("http://proxy.local")
                    .select(URI.create("https://zenmux.ai"))
                    .get(0)
                    .address();
            assertThat(address.getPort()).isEqualTo(80);
        }

        @Test
        void proxyUrlWithoutHostIsRejected() {
            assertThatThrownBy(() -> UpstreamDispatcher.proxySelector("not-a-url"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
