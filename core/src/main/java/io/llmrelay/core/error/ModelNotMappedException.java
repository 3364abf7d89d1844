package io.llmrelay.core.error;

import io.llmrelay.core.model.Dialect;

/**
 * Thrown when an Anthropic-dialect request names a model that is absent from
 * the model mapping table (or names no model at all). The request is
 * rejected locally; nothing is sent upstream.
 */
public final class ModelNotMappedException extends RelayException {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final String tableName;

    /**
     * @param modelId   the offending identifier as the caller sent it
     *                  ({@code "null"} when absent)
     * @param tableName the name of the table that was consulted
     */
    public ModelNotMappedException(String modelId, String tableName) {
        super("Model '" + modelId + "' not found in " + tableName, Dialect.ANTHROPIC_MESSAGES);
        this.modelId = modelId;
        this.tableName = tableName;
    }

    public String modelId() {
        return modelId;
    }

    public String tableName() {
        return tableName;
    }
}
