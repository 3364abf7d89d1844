package io.llmrelay.core.dialect;

import io.llmrelay.core.model.Dialect;
import io.llmrelay.core.model.HttpHeaders;
import java.util.Set;

/**
 * Strips connection-specific headers from an inbound request and optionally
 * stamps the configured upstream credential.
 *
 * <p>
 * Dropped headers:
 * <ul>
 * <li>{@code host}, {@code content-length}, {@code connection},
 * {@code accept-encoding}: invalid once the request is re-targeted or its
 * body re-serialized, or negotiated by the outbound client itself</li>
 * <li>the remaining RFC 7230 §6.1 hop-by-hop headers</li>
 * <li>{@code expect}: the JDK client manages it and rejects a manual value</li>
 * </ul>
 *
 * <p>
 * Pure and thread-safe.
 */
public final class HeaderSanitizer {

    static final Set<String> DROPPED_HEADERS = Set.of(
            "host",
            "content-length",
            "connection",
            "accept-encoding",
            "keep-alive",
            "transfer-encoding",
            "te",
            "trailer",
            "upgrade",
            "proxy-authenticate",
            "proxy-authorization",
            "expect");

    static final String AUTHORIZATION = "authorization";
    static final String X_API_KEY = "x-api-key";

    private final String apiKey;

    /**
     * @param apiKey fixed upstream credential; {@code null} or blank to forward
     *               the caller's own credential headers unchanged
     */
    public HeaderSanitizer(String apiKey) {
        this.apiKey = apiKey != null && !apiKey.isBlank() ? apiKey.strip() : null;
    }

    /**
     * Sanitizes headers for a pass-through forward: only the bearer credential
     * is stamped.
     */
    public HttpHeaders sanitize(HttpHeaders inbound) {
        return stamp(strip(inbound), false);
    }

    /**
     * Sanitizes headers for a dialect request. The Anthropic dialect
     * additionally receives the credential as {@code x-api-key}.
     */
    public HttpHeaders sanitize(HttpHeaders inbound, Dialect dialect) {
        return stamp(strip(inbound), dialect == Dialect.ANTHROPIC_MESSAGES);
    }

    /** True if a fixed credential is configured. */
    public boolean stampsCredential() {
        return apiKey != null;
    }

    private static HttpHeaders strip(HttpHeaders inbound) {
        return inbound.without(DROPPED_HEADERS::contains);
    }

    private HttpHeaders stamp(HttpHeaders headers, boolean withApiKeyHeader) {
        if (apiKey == null) {
            return headers;
        }
        HttpHeaders stamped = headers.with(AUTHORIZATION, "Bearer " + apiKey);
        return withApiKeyHeader ? stamped.with(X_API_KEY, apiKey) : stamped;
    }
}
