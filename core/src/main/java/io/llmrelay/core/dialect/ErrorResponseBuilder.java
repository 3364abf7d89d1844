package io.llmrelay.core.dialect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.llmrelay.core.error.RelayException;
import io.llmrelay.core.model.MessageBody;
import io.llmrelay.core.model.TransformResult;

/**
 * Builds the local rejection response for a {@link RelayException}:
 * {@code {"error": "<detail>"}} with HTTP 400 by default.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ErrorResponseBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 400;

    private final int status;

    /** Creates a builder answering with HTTP 400. */
    public ErrorResponseBuilder() {
        this(DEFAULT_STATUS);
    }

    /** @param status the HTTP status code of rejection responses */
    public ErrorResponseBuilder(int status) {
        this.status = status;
    }

    /** Builds the JSON error body for {@code exception}. */
    public MessageBody buildBody(RelayException exception) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("error", exception.detail());
        return MessageBody.json(node.toString());
    }

    /** Wraps {@link #buildBody} into an ERROR {@link TransformResult}. */
    public TransformResult toResult(RelayException exception) {
        return TransformResult.error(buildBody(exception), status);
    }
}
