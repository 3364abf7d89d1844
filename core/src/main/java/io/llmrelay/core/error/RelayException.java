package io.llmrelay.core.error;

import io.llmrelay.core.model.Dialect;

/**
 * Abstract base for request-rewriting failures. Never thrown directly: use a
 * concrete subclass such as {@link ModelNotMappedException}.
 */
public abstract class RelayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Dialect dialect;

    protected RelayException(String message, Dialect dialect) {
        super(message);
        this.dialect = dialect;
    }

    protected RelayException(String message, Throwable cause, Dialect dialect) {
        super(message, cause);
        this.dialect = dialect;
    }

    /** The dialect pipeline that raised the error. */
    public Dialect dialect() {
        return dialect;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
