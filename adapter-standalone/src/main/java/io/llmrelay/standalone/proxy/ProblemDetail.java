package io.llmrelay.standalone.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds RFC 9457 Problem Details bodies for errors raised by the relay's own
 * HTTP layer (unsupported method, unexpected handler failure).
 *
 * <p>
 * Upstream failures and model rejections are not reported this way; they keep
 * the plain-text and {@code {"error": ...}} bodies API clients of the two
 * dialects already understand.
 *
 * <pre>{@code
 * {
 * "type": "urn:llm-relay:proxy:method-not-allowed",
 * "title": "Method Not Allowed",
 * "status": 405,
 * "detail": "HTTP method PATCH is not supported",
 * "instance": "/v1/models"
 * }
 * }</pre>
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_METHOD_NOT_ALLOWED = "urn:llm-relay:proxy:method-not-allowed";
    static final String URN_INTERNAL_ERROR = "urn:llm-relay:proxy:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /**
     * Unsupported HTTP method.
     *
     * @param detail       human-readable description
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode methodNotAllowed(String detail, String instancePath) {
        return build(URN_METHOD_NOT_ALLOWED, "Method Not Allowed", 405, detail, instancePath);
    }

    /**
     * Unexpected failure inside a handler.
     *
     * @param detail       human-readable description
     * @param instancePath the request path
     * @return RFC 9457 JSON
     */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
