package io.llmrelay.standalone.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.llmrelay.core.dialect.RequestRewriter;
import io.llmrelay.core.model.InboundRequest;
import io.llmrelay.core.model.MediaType;
import io.llmrelay.core.model.OutboundRequest;
import io.llmrelay.core.model.RequestDocument;
import io.llmrelay.core.model.TransformResult;
import io.llmrelay.standalone.adapter.StandaloneAdapter;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main relay handler.
 *
 * <p>
 * Orchestrates one exchange:
 * <ol>
 * <li>Assign the request id (echoed or generated) and put it in the MDC</li>
 * <li>Wrap the inbound request (via {@link StandaloneAdapter})</li>
 * <li>Classify it (via {@link RouteMatcher})</li>
 * <li>Rewrite it (via {@link RequestRewriter})</li>
 * <li>Dispatch on {@link TransformResult}: answer locally on {@code ERROR},
 * otherwise send upstream (via {@link UpstreamDispatcher})</li>
 * <li>Relay the open stream (via {@link StreamRelay}) or write the buffered
 * response</li>
 * </ol>
 *
 * <p>
 * Failure mapping:
 * <ul>
 * <li>unmapped Anthropic model: configured status (default {@code 400}),
 * {@code {"error": ...}}</li>
 * <li>upstream unreachable: {@code 502}, {@code Connection Error: ...} on
 * dialect routes, {@code Proxy Error: ...} on pass-through</li>
 * <li>no response headers within the configured ceiling: same bodies with
 * {@code 504}</li>
 * <li>thread interrupted while waiting on upstream: same bodies with
 * {@code 502}, interrupt flag restored</li>
 * </ul>
 *
 * <p>
 * This class is thread-safe: all state is local to each
 * {@link #handle(Context)} invocation.
 */
public final class ProxyHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyHandler.class);

    static final String REQUEST_ID_HEADER = "x-request-id";
    static final String MDC_REQUEST_ID = "requestId";

    private static final String CONNECTION_ERROR_PREFIX = "Connection Error: ";
    private static final String PROXY_ERROR_PREFIX = "Proxy Error: ";

    private final StandaloneAdapter adapter;
    private final RouteMatcher routeMatcher;
    private final RequestRewriter rewriter;
    private final UpstreamDispatcher dispatcher;
    private final StreamRelay streamRelay;
    private final ObjectMapper mapper;

    /**
     * Creates a handler.
     *
     * @param adapter      wraps Javalin requests
     * @param routeMatcher selects the pipeline
     * @param rewriter     builds the outbound request
     * @param dispatcher   sends it upstream
     * @param streamRelay  copies streamed responses
     * @param mapper       parses outbound bodies for log labels
     */
    public ProxyHandler(
            StandaloneAdapter adapter,
            RouteMatcher routeMatcher,
            RequestRewriter rewriter,
            UpstreamDispatcher dispatcher,
            StreamRelay streamRelay,
            ObjectMapper mapper) {
        this.adapter = adapter;
        this.routeMatcher = routeMatcher;
        this.rewriter = rewriter;
        this.dispatcher = dispatcher;
        this.streamRelay = streamRelay;
        this.mapper = mapper;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        // --- Step 0: X-Request-ID extraction/generation ---
        String requestId = ctx.header(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);

        try {
            // --- Step 1: Wrap the inbound request ---
            InboundRequest request = adapter.wrapRequest(ctx);

            // --- Step 2: Classify and rewrite ---
            switch (routeMatcher.match(request.method(), request.path())) {
                case CHAT_COMPLETIONS -> relayDialect(ctx, rewriter.rewriteChatCompletions(request));
                case MESSAGES -> relayDialect(ctx, rewriter.rewriteMessages(request));
                case PASSTHROUGH -> relayPassthrough(ctx, rewriter.rewritePassthrough(request));
            }
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /**
     * Dialect pipelines: local rejection, streamed relay or buffered return.
     */
    private void relayDialect(Context ctx, TransformResult result) throws Exception {
        // --- Step 3: Dispatch on TransformResult ---
        if (result.isError()) {
            writeErrorResponse(ctx, result);
            return;
        }
        OutboundRequest outbound = result.request();

        // --- Step 4: Send upstream ---
        if (outbound.streaming()) {
            UpstreamConnection connection;
            try {
                connection = dispatcher.open(outbound);
            } catch (UpstreamTimeoutException e) {
                logUpstreamFailure(outbound, e);
                writeTextError(ctx, 504, CONNECTION_ERROR_PREFIX + e.getMessage());
                return;
            } catch (UpstreamConnectException e) {
                logUpstreamFailure(outbound, e);
                writeTextError(ctx, 502, CONNECTION_ERROR_PREFIX + e.getMessage());
                return;
            } catch (InterruptedException e) {
                abandonInterrupted(ctx, outbound, CONNECTION_ERROR_PREFIX);
                return;
            }
            // --- Step 5a: Relay the stream ---
            streamToCaller(ctx, connection, modelLabel(outbound));
            return;
        }

        UpstreamResponse response;
        try {
            response = dispatcher.sendBuffered(outbound);
        } catch (UpstreamTimeoutException e) {
            logUpstreamFailure(outbound, e);
            writeTextError(ctx, 504, CONNECTION_ERROR_PREFIX + e.getMessage());
            return;
        } catch (UpstreamConnectException e) {
            logUpstreamFailure(outbound, e);
            writeTextError(ctx, 502, CONNECTION_ERROR_PREFIX + e.getMessage());
            return;
        } catch (InterruptedException e) {
            abandonInterrupted(ctx, outbound, CONNECTION_ERROR_PREFIX);
            return;
        }
        // --- Step 5b: Write the buffered response ---
        writeBufferedResponse(ctx, response);
    }

    /** Pass-through: always buffered, failures reported as proxy errors. */
    private void relayPassthrough(Context ctx, TransformResult result) throws Exception {
        OutboundRequest outbound = result.request();
        UpstreamResponse response;
        try {
            response = dispatcher.sendBuffered(outbound);
        } catch (UpstreamTimeoutException e) {
            logUpstreamFailure(outbound, e);
            writeTextError(ctx, 504, PROXY_ERROR_PREFIX + e.getMessage());
            return;
        } catch (UpstreamConnectException e) {
            logUpstreamFailure(outbound, e);
            writeTextError(ctx, 502, PROXY_ERROR_PREFIX + e.getMessage());
            return;
        } catch (InterruptedException e) {
            abandonInterrupted(ctx, outbound, PROXY_ERROR_PREFIX);
            return;
        }
        writeBufferedResponse(ctx, response);
    }

    /**
     * Commits status and {@code text/event-stream} and hands the connection to
     * the relay, which closes it.
     */
    private void streamToCaller(Context ctx, UpstreamConnection connection, String label) throws IOException {
        HttpServletResponse res = ctx.res();
        ChunkSink sink;
        try {
            res.setStatus(connection.status());
            res.setContentType(MediaType.EVENT_STREAM.value());
            sink = new OutputStreamChunkSink(res.getOutputStream());
        } catch (IOException | RuntimeException e) {
            connection.close();
            throw e;
        }
        RelaySession session = streamRelay.relay(connection, sink, label);
        LOG.debug("Relay finished: {}", session);
    }

    /**
     * Mirrors status, headers and body of a buffered upstream response. The
     * relay's own {@code x-request-id} wins over an upstream one.
     */
    private static void writeBufferedResponse(Context ctx, UpstreamResponse response) {
        HttpServletResponse res = ctx.res();
        ctx.status(response.statusCode());
        for (Map.Entry<String, List<String>> entry : response.headers().toMultiValueMap().entrySet()) {
            String name = entry.getKey();
            if (REQUEST_ID_HEADER.equals(name)) {
                continue;
            }
            List<String> values = entry.getValue();
            res.setHeader(name, values.get(0));
            for (int i = 1; i < values.size(); i++) {
                res.addHeader(name, values.get(i));
            }
        }
        ctx.result(response.body());
    }

    /**
     * Writes a {@link TransformResult#ERROR} response to the client.
     *
     * @param ctx    the Javalin context
     * @param result the error result
     */
    private static void writeErrorResponse(Context ctx, TransformResult result) {
        ctx.status(result.errorStatusCode());
        ctx.contentType(result.errorResponse().mediaType().value());
        ctx.result(result.errorResponse().content());

        LOG.warn("Request rejected: status={}, body={}", result.errorStatusCode(), result.errorResponse().asString());
    }

    private static void writeTextError(Context ctx, int statusCode, String text) {
        ctx.status(statusCode);
        ctx.contentType(MediaType.TEXT.value());
        ctx.result(text);
    }

    private static void logUpstreamFailure(OutboundRequest outbound, UpstreamException e) {
        LOG.error("Upstream request failed: {} {} | type: {} | detail: {}",
                outbound.method(), outbound.targetUrl(), e.getClass().getSimpleName(), e.getMessage(), e);
    }

    /** Restores the interrupt flag and answers 502 for an exchange cut short while waiting on upstream. */
    private static void abandonInterrupted(Context ctx, OutboundRequest outbound, String errorPrefix) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while waiting for upstream: {} {}", outbound.method(), outbound.targetUrl());
        writeTextError(ctx, 502, errorPrefix + "interrupted while waiting for " + outbound.targetUrl());
    }

    private String modelLabel(OutboundRequest outbound) {
        return RequestDocument.parse(outbound.body().content(), mapper).model().orElse("unknown");
    }
}
