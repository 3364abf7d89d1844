package io.llmrelay.core.model;

/** Upstream request/response shapes the relay rewrites. */
public enum Dialect {
    /** OpenAI-style Chat Completions ({@code /chat/completions}). */
    OPENAI_CHAT,

    /** Anthropic-style Messages ({@code /messages}). */
    ANTHROPIC_MESSAGES
}
