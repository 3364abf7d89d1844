package io.llmrelay.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed lookup from caller-facing model identifiers to upstream model
 * identifiers.
 *
 * <p>
 * Immutable. The {@code name} is reported to callers when a lookup misses,
 * so it should match the configuration key the table was loaded from.
 *
 * @param name    the table's name, e.g. {@code ANTHROPIC_MODEL_MAP}
 * @param entries caller model id → upstream model id
 */
public record ModelMappingTable(String name, Map<String, String> entries) {

    /** Conventional name of the Anthropic dialect table. */
    public static final String ANTHROPIC_MODEL_MAP = "ANTHROPIC_MODEL_MAP";

    public ModelMappingTable {
        Objects.requireNonNull(name, "name must not be null");
        entries = entries != null ? Map.copyOf(entries) : Map.of();
    }

    /**
     * Looks up the upstream identifier for {@code callerModel}.
     *
     * @return the mapped id, or empty when {@code callerModel} is null or
     *         unmapped
     */
    public Optional<String> resolve(String callerModel) {
        if (callerModel == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(callerModel));
    }

    public int size() {
        return entries.size();
    }
}
