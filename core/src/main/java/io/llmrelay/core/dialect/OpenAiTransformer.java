package io.llmrelay.core.dialect;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.llmrelay.core.model.RequestDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Body rewriting for the OpenAI-style Chat Completions dialect.
 *
 * <p>
 * A streaming request that does not already carry {@code stream_options}
 * gets {@code {"include_usage": true}} so the upstream reports token usage in
 * its final event. Every other field passes through. Never fails.
 */
public final class OpenAiTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(OpenAiTransformer.class);

    /**
     * @param document the parsed request body
     * @return the rewritten body (the same instance when nothing changed)
     */
    public RequestDocument apply(RequestDocument document) {
        if (!document.streamRequested() || document.has(RequestDocument.STREAM_OPTIONS)) {
            return document;
        }
        ObjectNode streamOptions = JsonNodeFactory.instance.objectNode();
        streamOptions.put("include_usage", true);
        LOG.info("Injected usage reporting into streaming request: model={}", document.modelForDisplay());
        return document.with(RequestDocument.STREAM_OPTIONS, streamOptions);
    }
}
