package io.llmrelay.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Request or response payload as raw bytes tagged with a {@link MediaType}.
 *
 * <p>
 * Pass-through bodies keep the caller's bytes untouched; dialect bodies hold
 * the re-serialized JSON document; local rejections hold the generated error
 * JSON. Equality compares the bytes, not the array reference.
 */
public record MessageBody(byte[] content, MediaType mediaType) {

    private static final byte[] NO_BYTES = new byte[0];
    private static final MessageBody EMPTY = new MessageBody(NO_BYTES, MediaType.NONE);

    public MessageBody {
        content = content != null ? content : NO_BYTES;
        Objects.requireNonNull(mediaType, "mediaType (use MediaType.NONE when there is none)");
    }

    /** A JSON body. */
    public static MessageBody json(byte[] content) {
        return new MessageBody(content, MediaType.JSON);
    }

    /** A JSON body, UTF-8 encoded. */
    public static MessageBody json(String content) {
        return json(content != null ? content.getBytes(StandardCharsets.UTF_8) : null);
    }

    /** A body of the given type. */
    public static MessageBody of(byte[] content, MediaType mediaType) {
        return new MessageBody(content, mediaType);
    }

    /** The shared empty body of {@link MediaType#NONE}. */
    public static MessageBody empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    /** Decodes the bytes as UTF-8; meant for logging and tests. */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageBody that)) return false;
        return mediaType == that.mediaType && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mediaType, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "MessageBody[" + mediaType + ", " + content.length + " bytes]";
    }
}
