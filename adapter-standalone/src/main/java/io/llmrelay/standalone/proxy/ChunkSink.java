package io.llmrelay.standalone.proxy;

import java.io.IOException;

/**
 * Destination of relayed stream chunks. Each call must push the chunk to the
 * caller before returning (write and flush).
 */
@FunctionalInterface
public interface ChunkSink {

    /**
     * Writes {@code length} bytes of {@code buffer} starting at {@code offset}
     * and flushes them.
     *
     * @throws IOException if the caller has gone away
     */
    void write(byte[] buffer, int offset, int length) throws IOException;
}
