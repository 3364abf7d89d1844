package io.llmrelay.core.model;

import java.util.Locale;

/**
 * The handful of content types the relay needs to tell apart: JSON request
 * and error bodies, event-stream responses, plain-text failure messages and
 * everything else.
 */
public enum MediaType {
    JSON("application/json"),
    EVENT_STREAM("text/event-stream"),
    TEXT("text/plain"),
    /** Any other declared type. */
    BINARY("application/octet-stream"),
    /** No {@code Content-Type} at all. */
    NONE(null);

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    /** The MIME type, {@code null} for {@link #NONE}. */
    public String value() {
        return value;
    }

    /**
     * Classifies a {@code Content-Type} header value. Parameters such as
     * {@code charset} are ignored and {@code +json} suffixes (RFC 6838) count
     * as JSON.
     *
     * @param contentType the header value, may be {@code null}
     * @return {@link #NONE} when absent, {@link #BINARY} when unrecognized
     */
    public static MediaType fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return NONE;
        }
        int semicolon = contentType.indexOf(';');
        String mime = (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType)
                .strip()
                .toLowerCase(Locale.ROOT);
        switch (mime) {
            case "application/json":
                return JSON;
            case "text/event-stream":
                return EVENT_STREAM;
            case "text/plain":
                return TEXT;
            default:
                return mime.endsWith("+json") ? JSON : BINARY;
        }
    }
}
