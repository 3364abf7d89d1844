package io.llmrelay.standalone.proxy;

import io.llmrelay.core.model.HttpHeaders;
import io.llmrelay.core.model.OutboundRequest;
import io.llmrelay.standalone.config.RelayConfig;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based upstream dispatcher.
 *
 * <p>
 * Sends an {@link OutboundRequest} and either hands back the open response
 * ({@link #open}) or reads it fully and releases the connection
 * ({@link #sendBuffered}). Uses HTTP/1.1, never follows redirects and routes
 * through the configured forward proxy when {@code upstream.proxy-url} is
 * set.
 *
 * <p>
 * This class is thread-safe: one instance and its {@link HttpClient} are
 * shared by every exchange.
 */
public final class UpstreamDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamDispatcher.class);

    /** Hop-by-hop headers per RFC 7230 §6.1, never mirrored to the caller. */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "transfer-encoding", "keep-alive", "proxy-authenticate", "proxy-authorization", "te",
            "trailer", "upgrade");

    /** Framing headers that no longer describe a fully read, re-framed body. */
    private static final Set<String> FRAMING_HEADERS = Set.of("content-encoding", "content-length");

    /** Headers the JDK client sets itself and rejects when set manually. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host",
            "upgrade");

    private final HttpClient httpClient;
    private final Duration responseTimeout;
    private final ConnectionListener listener;

    /**
     * Creates a dispatcher for the given configuration.
     *
     * @param config relay configuration (timeouts, forward proxy)
     */
    public UpstreamDispatcher(RelayConfig config) {
        this(config, ConnectionListener.NOOP);
    }

    /**
     * Creates a dispatcher that reports connection lifecycle events.
     *
     * @param config   relay configuration (timeouts, forward proxy)
     * @param listener receives opened/closed events for every connection
     */
    public UpstreamDispatcher(RelayConfig config, ConnectionListener listener) {
        this.listener = listener != null ? listener : ConnectionListener.NOOP;
        this.responseTimeout =
                config.responseTimeoutMs() > 0 ? Duration.ofMillis(config.responseTimeoutMs()) : null;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER);
        if (config.proxyUrl() != null) {
            builder.proxy(proxySelector(config.proxyUrl()));
        }
        this.httpClient = builder.build();

        LOG.debug("UpstreamDispatcher initialized: proxy={}, connectTimeoutMs={}, responseTimeoutMs={}",
                config.proxyUrl() != null ? config.proxyUrl() : "none",
                config.connectTimeoutMs(),
                config.responseTimeoutMs());
    }

    /**
     * Sends the request and returns the open connection as soon as response
     * headers are available. The caller owns the returned connection.
     *
     * @param request the rewritten request
     * @return the open connection; never {@code null}
     * @throws UpstreamConnectException if the connection or the send fails
     * @throws UpstreamTimeoutException if response headers do not arrive within
     *                                  the configured ceiling
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public UpstreamConnection open(OutboundRequest request) throws UpstreamException, InterruptedException {
        HttpRequest httpRequest = buildRequest(request);

        LOG.debug("Dispatching {} {}", request.method(), request.targetUrl());

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("Connect timeout to " + request.targetUrl(), e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("No response headers from " + request.targetUrl()
                    + (responseTimeout != null ? " within " + responseTimeout.toMillis() + "ms" : ""), e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + request.targetUrl(), e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to connect to " + request.targetUrl() + ": " + describe(e), e);
        }

        LOG.debug("Upstream responded: {} {} -> {}", request.method(), request.targetUrl(), response.statusCode());

        return new UpstreamConnection(
                request.targetUrl(),
                response.statusCode(),
                HttpHeaders.ofMulti(response.headers().map()),
                response.body(),
                listener);
    }

    /**
     * Sends the request, reads the complete response body and closes the
     * connection before returning.
     *
     * @param request the rewritten request
     * @return status, mirrored headers and body bytes
     * @throws UpstreamConnectException if the connection, send or body read fails
     * @throws UpstreamTimeoutException if response headers do not arrive in time
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public UpstreamResponse sendBuffered(OutboundRequest request) throws UpstreamException, InterruptedException {
        try (UpstreamConnection connection = open(request)) {
            byte[] body;
            try {
                body = connection.body().readAllBytes();
            } catch (IOException e) {
                throw new UpstreamConnectException(
                        "Failed to read response from " + request.targetUrl() + ": " + describe(e), e);
            }
            return new UpstreamResponse(connection.status(), mirroredHeaders(connection.headers()), body);
        }
    }

    /**
     * Drops hop-by-hop and framing headers from an upstream response so the
     * rest can be copied to the caller.
     */
    static HttpHeaders mirroredHeaders(HttpHeaders upstream) {
        return upstream.without(name -> HOP_BY_HOP_HEADERS.contains(name) || FRAMING_HEADERS.contains(name));
    }

    /**
     * Returns the underlying {@link HttpClient}; package-private for testing.
     */
    HttpClient httpClient() {
        return httpClient;
    }

    private HttpRequest buildRequest(OutboundRequest request) throws UpstreamConnectException {
        URI target;
        try {
            target = URI.create(request.targetUrl());
        } catch (IllegalArgumentException e) {
            throw new UpstreamConnectException("Invalid upstream URL " + request.targetUrl(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target)
                .method(
                        request.method(),
                        request.body().isEmpty()
                                ? HttpRequest.BodyPublishers.noBody()
                                : HttpRequest.BodyPublishers.ofByteArray(request.body().content()));
        if (responseTimeout != null) {
            builder.timeout(responseTimeout);
        }

        for (Map.Entry<String, List<String>> entry : request.headers().toMultiValueMap().entrySet()) {
            String name = entry.getKey();
            if (RESTRICTED_HEADERS.contains(name) || HOP_BY_HOP_HEADERS.contains(name)) {
                continue;
            }
            for (String value : entry.getValue()) {
                builder.header(name, value);
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new UpstreamConnectException("Cannot build request to " + request.targetUrl() + ": " + describe(e), e);
        }
    }

    /**
     * Builds a {@link ProxySelector} for a forward proxy URL such as
     * {@code http://127.0.0.1:7890}.
     *
     * @throws IllegalArgumentException if the URL has no host
     */
    static ProxySelector proxySelector(String proxyUrl) {
        URI uri = URI.create(proxyUrl.trim());
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("Invalid upstream proxy URL (no host): " + proxyUrl);
        }
        int port = uri.getPort();
        if (port < 0) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return ProxySelector.of(new InetSocketAddress(host, port));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
