package io.llmrelay.core.model;

import java.util.Objects;

/**
 * A fully rewritten request ready to be sent upstream.
 *
 * <p>
 * Produced exactly once per accepted inbound request and consumed exactly
 * once by the upstream dispatcher.
 *
 * @param method    the HTTP method
 * @param targetUrl absolute upstream URL, including the query string where
 *                  one is forwarded
 * @param headers   sanitized (and possibly credential-stamped) headers
 * @param body      the body to send; empty for bodyless requests
 * @param streaming {@code true} to hand the open response stream to the
 *                  relay, {@code false} to buffer the full response
 */
public record OutboundRequest(
        String method, String targetUrl, HttpHeaders headers, MessageBody body, boolean streaming) {

    public OutboundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(targetUrl, "targetUrl must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
    }
}
