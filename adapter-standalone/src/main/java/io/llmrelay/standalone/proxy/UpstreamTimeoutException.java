package io.llmrelay.standalone.proxy;

/**
 * Thrown when upstream response headers do not arrive within
 * {@code upstream.response-timeout-ms}. Callers answer with a
 * {@code 504 Gateway Timeout}.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying timeout exception
     */
    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
