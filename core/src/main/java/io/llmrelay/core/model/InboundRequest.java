package io.llmrelay.core.model;

import java.util.Objects;

/**
 * A request as received from the local API client.
 *
 * <p>
 * Built once per exchange by a {@link io.llmrelay.core.spi.GatewayAdapter}
 * and read once by the rewriting pipeline.
 *
 * @param method      the HTTP method (uppercase)
 * @param path        the request path, always starting with {@code /}
 * @param queryString the raw query string without leading {@code ?}, or
 *                    {@code null}; kept verbatim so repeated keys and their
 *                    order survive forwarding
 * @param headers     case-insensitive request headers
 * @param body        the raw request body
 */
public record InboundRequest(String method, String path, String queryString, HttpHeaders headers, MessageBody body) {

    public InboundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : MessageBody.empty();
    }
}
