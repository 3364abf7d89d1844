package io.llmrelay.standalone.proxy;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/** {@link ChunkSink} over a response output stream; flushes after every chunk. */
public final class OutputStreamChunkSink implements ChunkSink {

    private final OutputStream out;

    public OutputStreamChunkSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        out.write(buffer, offset, length);
        out.flush();
    }
}
