package io.llmrelay.standalone.proxy;

/**
 * Progress of one streamed exchange: start time, chunk count and total
 * bytes. Used only for logging. Confined to the exchange's request thread.
 */
public final class RelaySession {

    /** How a relay ended. */
    public enum Outcome {
        /** Still copying. */
        ACTIVE,
        /** Upstream reached end of stream. */
        COMPLETED,
        /** Upstream read failed; an error chunk was appended. */
        UPSTREAM_FAILED,
        /** Writing to the caller failed. */
        CLIENT_DISCONNECTED
    }

    private final String label;
    private final long startNanos;
    private long chunkCount;
    private long totalBytes;
    private long endNanos;
    private Outcome outcome = Outcome.ACTIVE;

    private RelaySession(String label, long startNanos) {
        this.label = label;
        this.startNanos = startNanos;
    }

    /** Starts a session now. */
    public static RelaySession start(String label) {
        return new RelaySession(label != null ? label : "unknown", System.nanoTime());
    }

    void recordChunk(int bytes) {
        chunkCount++;
        totalBytes += bytes;
    }

    void finish(Outcome result) {
        if (outcome == Outcome.ACTIVE) {
            outcome = result;
            endNanos = System.nanoTime();
        }
    }

    /** The label shown in logs, usually the model name. */
    public String label() {
        return label;
    }

    public long chunkCount() {
        return chunkCount;
    }

    public long totalBytes() {
        return totalBytes;
    }

    public Outcome outcome() {
        return outcome;
    }

    /** Elapsed milliseconds, up to now while active. */
    public long durationMs() {
        long end = outcome == Outcome.ACTIVE ? System.nanoTime() : endNanos;
        return (end - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return "RelaySession[" + label + ", " + outcome + ", chunks=" + chunkCount + ", bytes=" + totalBytes + "]";
    }
}
