package io.llmrelay.standalone.proxy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies an open upstream stream to the caller chunk by chunk.
 *
 * <p>
 * Each chunk read from upstream is written and flushed unchanged, in order.
 * The relay takes ownership of the connection: it is closed on every exit
 * path (end of stream, upstream read failure, caller disconnect).
 *
 * <ul>
 * <li>Upstream read failure: one extra chunk carrying the error text is
 * written, then the connection is closed.</li>
 * <li>Caller write failure: reading stops at once and the connection is
 * closed. Nothing more is written.</li>
 * </ul>
 *
 * <p>
 * Thread-safe: all state is local to each {@link #relay} call.
 */
public final class StreamRelay {

    private static final Logger LOG = LoggerFactory.getLogger(StreamRelay.class);

    static final int CHUNK_SIZE = 8192;

    /**
     * Relays {@code connection} into {@code sink} and closes the connection.
     *
     * @param connection the open upstream connection; owned by this call
     * @param sink       where chunks go
     * @param label      model name (or other label) for the completion log
     * @return the finished session
     */
    public RelaySession relay(UpstreamConnection connection, ChunkSink sink, String label) {
        RelaySession session = RelaySession.start(label);
        try (UpstreamConnection owned = connection) {
            InputStream in = owned.body();
            byte[] buffer = new byte[CHUNK_SIZE];
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    LOG.error("Stream interrupted: {} after {} chunks | type: {} | detail: {}",
                            session.label(), session.chunkCount(), e.getClass().getSimpleName(), e.getMessage());
                    writeErrorChunk(sink, e);
                    session.finish(RelaySession.Outcome.UPSTREAM_FAILED);
                    return session;
                }
                if (read < 0) {
                    break;
                }
                if (read == 0) {
                    continue;
                }
                try {
                    sink.write(buffer, 0, read);
                } catch (IOException e) {
                    LOG.warn("Client disconnected during streaming: {} after {} chunks ({}: {})",
                            session.label(), session.chunkCount(), e.getClass().getSimpleName(), e.getMessage());
                    session.finish(RelaySession.Outcome.CLIENT_DISCONNECTED);
                    return session;
                }
                session.recordChunk(read);
            }
        }
        session.finish(RelaySession.Outcome.COMPLETED);
        LOG.info("Stream complete: {} | chunks: {} | {} bytes | {}ms",
                session.label(), session.chunkCount(), session.totalBytes(), session.durationMs());
        return session;
    }

    private static void writeErrorChunk(ChunkSink sink, IOException failure) {
        String text = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        byte[] chunk = text.getBytes(StandardCharsets.UTF_8);
        try {
            sink.write(chunk, 0, chunk.length);
        } catch (IOException e) {
            LOG.debug("Could not deliver error chunk, caller already gone: {} ({})",
                    e.getMessage(), e.getClass().getSimpleName());
        }
    }
}
