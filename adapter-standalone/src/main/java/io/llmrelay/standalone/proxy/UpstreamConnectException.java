package io.llmrelay.standalone.proxy;

/**
 * Thrown when the upstream service cannot be reached or the request cannot be
 * sent.
 *
 * <p>
 * Wraps low-level network exceptions ({@code ConnectException}, DNS
 * resolution failures, proxy failures) so that callers can answer with a
 * {@code 502 Bad Gateway}.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying network exception
     */
    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
