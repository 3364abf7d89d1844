package io.llmrelay.core.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.llmrelay.core.error.ModelNotMappedException;
import io.llmrelay.core.model.ModelMappingTable;
import io.llmrelay.core.model.RequestDocument;
import io.llmrelay.core.model.ToolInjection;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Body rewriting for the Anthropic-style Messages dialect.
 *
 * <p>
 * Two steps, in order:
 * <ol>
 * <li>Replace {@code model} with its upstream identifier from the
 * {@link ModelMappingTable}. A missing or unmapped model raises
 * {@link ModelNotMappedException}. This step must run once per request: the
 * mapped identifier is normally not itself a key of the table.</li>
 * <li>If tool injection is active, append the configured tool unless the
 * {@code tools} list already holds an entry of the same {@code type}. This
 * step is idempotent.</li>
 * </ol>
 *
 * <p>
 * Thread-safe; holds only immutable configuration.
 */
public final class AnthropicTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(AnthropicTransformer.class);

    private final ModelMappingTable modelMap;
    private final ToolInjection toolInjection;

    public AnthropicTransformer(ModelMappingTable modelMap, ToolInjection toolInjection) {
        this.modelMap = Objects.requireNonNull(modelMap, "modelMap");
        this.toolInjection = toolInjection != null ? toolInjection : ToolInjection.DISABLED;
    }

    /**
     * Applies model mapping and tool injection.
     *
     * @param document the parsed request body
     * @return the rewritten body
     * @throws ModelNotMappedException if {@code model} is absent or unmapped
     */
    public RequestDocument apply(RequestDocument document) {
        return injectTool(mapModel(document));
    }

    /**
     * Replaces {@code model} with its mapped upstream identifier.
     *
     * @throws ModelNotMappedException if {@code model} is absent or unmapped
     */
    public RequestDocument mapModel(RequestDocument document) {
        String callerModel = document.model().orElse(null);
        String upstreamModel = modelMap.resolve(callerModel)
                .orElseThrow(() -> new ModelNotMappedException(document.modelForDisplay(), modelMap.name()));
        LOG.info("Model mapped: {} -> {}", callerModel, upstreamModel);
        return document.withModel(upstreamModel);
    }

    /** Appends the configured tool unless one of its type is already listed. */
    public RequestDocument injectTool(RequestDocument document) {
        if (!toolInjection.active()) {
            return document;
        }
        String toolType = toolInjection.toolType();
        ArrayNode tools = document.tools();
        for (JsonNode existing : tools) {
            if (toolType.equals(existing.path("type").asText(null))) {
                LOG.debug("Tool of type {} already present, not injecting", toolType);
                return document;
            }
        }
        tools.add(toolInjection.tool().deepCopy());
        LOG.info("Injected tool: type={}", toolType);
        return document.with(RequestDocument.TOOLS, tools);
    }

    public ModelMappingTable modelMap() {
        return modelMap;
    }
}
