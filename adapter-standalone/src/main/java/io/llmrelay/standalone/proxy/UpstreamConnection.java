package io.llmrelay.standalone.proxy;

import io.llmrelay.core.model.HttpHeaders;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An open upstream response: status, headers and the unread body stream.
 *
 * <p>
 * Whoever holds the connection owns it and must close it, normally with
 * try-with-resources. {@link #close()} is idempotent; the underlying stream
 * is released and the listener notified on the first call only.
 */
public final class UpstreamConnection implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamConnection.class);

    private final String target;
    private final int status;
    private final HttpHeaders headers;
    private final InputStream body;
    private final ConnectionListener listener;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    UpstreamConnection(String target, int status, HttpHeaders headers, InputStream body, ConnectionListener listener) {
        this.target = Objects.requireNonNull(target, "target");
        this.status = status;
        this.headers = headers != null ? headers : HttpHeaders.empty();
        this.body = Objects.requireNonNull(body, "body");
        this.listener = listener != null ? listener : ConnectionListener.NOOP;
        this.listener.opened(this);
    }

    /** The upstream URL this connection was opened against. */
    public String target() {
        return target;
    }

    public int status() {
        return status;
    }

    /** Raw upstream response headers (lowercase names). */
    public HttpHeaders headers() {
        return headers;
    }

    /** The response body; reading it after {@link #close()} fails. */
    public InputStream body() {
        return body;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            LOG.debug("Error while closing upstream body for {}: {} ({})",
                    target, e.getMessage(), e.getClass().getSimpleName());
        } finally {
            listener.closed(this);
        }
    }

    @Override
    public String toString() {
        return "UpstreamConnection[" + status + " " + target + (closed.get() ? ", closed" : "") + "]";
    }
}
