package io.llmrelay.standalone.proxy;

/**
 * Observes the lifecycle of upstream connections. Every
 * {@link #opened(UpstreamConnection)} is followed by exactly one
 * {@link #closed(UpstreamConnection)} for the same connection.
 */
public interface ConnectionListener {

    /** Listener that ignores every event. */
    ConnectionListener NOOP = new ConnectionListener() {
        @Override
        public void opened(UpstreamConnection connection) {}

        @Override
        public void closed(UpstreamConnection connection) {}
    };

    /** Called once response headers are available and the body is open. */
    void opened(UpstreamConnection connection);

    /** Called once when the connection is released. */
    void closed(UpstreamConnection connection);
}
