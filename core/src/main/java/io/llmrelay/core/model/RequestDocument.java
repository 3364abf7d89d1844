package io.llmrelay.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured body of a dialect request.
 *
 * <p>
 * The fields the relay rewrites ({@code model}, {@code stream},
 * {@code stream_options}, {@code tools}) have typed accessors; every other
 * field is carried opaquely and re-serialized untouched. Instances are
 * immutable: the {@code with*} methods return modified copies.
 */
public final class RequestDocument {

    private static final Logger LOG = LoggerFactory.getLogger(RequestDocument.class);

    public static final String MODEL = "model";
    public static final String STREAM = "stream";
    public static final String STREAM_OPTIONS = "stream_options";
    public static final String TOOLS = "tools";

    private final ObjectNode root;

    private RequestDocument(ObjectNode root) {
        this.root = root;
    }

    /**
     * Parses a request body. Anything that is not a JSON object (malformed
     * JSON, an array, a scalar, an empty body) yields the empty document.
     *
     * @param body   raw body bytes
     * @param mapper the mapper to parse with
     * @return the parsed document, never {@code null}
     */
    public static RequestDocument parse(byte[] body, ObjectMapper mapper) {
        if (body == null || body.length == 0) {
            return empty();
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node instanceof ObjectNode object) {
                return new RequestDocument(object);
            }
            LOG.warn("Request body is not a JSON object ({}), using empty document",
                    node == null ? "empty" : node.getNodeType());
        } catch (Exception e) {
            LOG.warn("Request body is not valid JSON ({}: {}), using empty document",
                    e.getClass().getSimpleName(), e.getMessage());
        }
        return empty();
    }

    /** Wraps a deep copy of {@code node}. */
    public static RequestDocument of(ObjectNode node) {
        return new RequestDocument(Objects.requireNonNull(node, "node").deepCopy());
    }

    /** Returns a document with no fields. */
    public static RequestDocument empty() {
        return new RequestDocument(JsonNodeFactory.instance.objectNode());
    }

    /** The {@code model} field, if present and textual. */
    public Optional<String> model() {
        JsonNode model = root.get(MODEL);
        return model != null && model.isTextual() ? Optional.of(model.asText()) : Optional.empty();
    }

    /**
     * Raw rendering of the {@code model} field for diagnostics: the text value,
     * the JSON form of a non-text value, or {@code "null"} when absent.
     */
    public String modelForDisplay() {
        JsonNode model = root.get(MODEL);
        if (model == null || model.isNull()) {
            return "null";
        }
        return model.isTextual() ? model.asText() : model.toString();
    }

    /** {@code true} only when {@code stream} is the JSON boolean {@code true}. */
    public boolean streamRequested() {
        JsonNode stream = root.get(STREAM);
        return stream != null && stream.isBoolean() && stream.booleanValue();
    }

    /** True if a top-level field named {@code field} exists (even if null). */
    public boolean has(String field) {
        return root.has(field);
    }

    /**
     * A copy of the {@code tools} list. A missing or non-array value is
     * treated as an empty list.
     */
    public ArrayNode tools() {
        JsonNode tools = root.get(TOOLS);
        return tools instanceof ArrayNode array ? array.deepCopy() : JsonNodeFactory.instance.arrayNode();
    }

    /** Returns a copy with {@code model} set to {@code model}. */
    public RequestDocument withModel(String model) {
        ObjectNode copy = root.deepCopy();
        copy.put(MODEL, model);
        return new RequestDocument(copy);
    }

    /** Returns a copy with {@code field} set to {@code value} (deep-copied). */
    public RequestDocument with(String field, JsonNode value) {
        ObjectNode copy = root.deepCopy();
        copy.set(field, value.deepCopy());
        return new RequestDocument(copy);
    }

    /** A deep copy of the underlying JSON object. */
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    /**
     * Serializes this document.
     *
     * @throws IllegalStateException if Jackson cannot serialize the tree
     */
    public byte[] toBytes(ObjectMapper mapper) {
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request document", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestDocument that)) return false;
        return root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "RequestDocument" + root;
    }
}
