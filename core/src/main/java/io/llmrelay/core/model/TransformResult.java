package io.llmrelay.core.model;

import java.util.Objects;

/**
 * Outcome of rewriting an inbound request. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code request} holds the outbound request to
 * dispatch.
 * <li>{@link Type#ERROR}: the request is rejected locally;
 * {@code errorResponse} holds the body and {@code errorStatusCode} the HTTP
 * status. Nothing is sent upstream.
 * </ul>
 */
public final class TransformResult {

    /** The type of transform outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final OutboundRequest request;
    private final MessageBody errorResponse;
    private final Integer errorStatusCode;

    private TransformResult(Type type, OutboundRequest request, MessageBody errorResponse, Integer errorStatusCode) {
        this.type = type;
        this.request = request;
        this.errorResponse = errorResponse;
        this.errorStatusCode = errorStatusCode;
    }

    /** Creates a SUCCESS result carrying the outbound request. */
    public static TransformResult success(OutboundRequest request) {
        Objects.requireNonNull(request, "request must not be null for SUCCESS");
        return new TransformResult(Type.SUCCESS, request, null, null);
    }

    /** Creates an ERROR result with an error response body and HTTP status code. */
    public static TransformResult error(MessageBody errorResponse, int errorStatusCode) {
        Objects.requireNonNull(errorResponse, "errorResponse must not be null for ERROR");
        return new TransformResult(Type.ERROR, null, errorResponse, errorStatusCode);
    }

    /** Returns the outbound request. Only valid when {@code type() == SUCCESS}. */
    public OutboundRequest request() {
        return request;
    }

    /** Returns the error response body. Only valid when {@code type() == ERROR}. */
    public MessageBody errorResponse() {
        return errorResponse;
    }

    /** Returns the error HTTP status code. Only valid when {@code type() == ERROR}. */
    public Integer errorStatusCode() {
        return errorStatusCode;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "TransformResult[SUCCESS, " + request.method() + " " + request.targetUrl() + "]";
            case ERROR -> "TransformResult[ERROR, status=" + errorStatusCode + "]";
        };
    }
}
