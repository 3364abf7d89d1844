package io.llmrelay.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Tool definition appended to Anthropic requests when web-search
 * augmentation is on.
 *
 * @param enabled whether augmentation is on
 * @param tool    the tool object to append; must carry a {@code type} field
 *                when {@code enabled}
 */
public record ToolInjection(boolean enabled, ObjectNode tool) {

    /** Augmentation off. */
    public static final ToolInjection DISABLED = new ToolInjection(false, null);

    public ToolInjection {
        if (enabled && (tool == null || !tool.hasNonNull("type"))) {
            throw new IllegalArgumentException("an enabled tool injection needs a tool object with a 'type' field");
        }
        tool = tool != null ? tool.deepCopy() : null;
    }

    /** True when there is something to inject. */
    public boolean active() {
        return enabled && tool != null;
    }

    /** The tool's {@code type}, or {@code null} when inactive. */
    public String toolType() {
        return tool != null && tool.hasNonNull("type") ? tool.get("type").asText() : null;
    }
}
