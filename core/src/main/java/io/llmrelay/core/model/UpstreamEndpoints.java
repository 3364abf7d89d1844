package io.llmrelay.core.model;

import java.util.Objects;

/**
 * Upstream base URLs and the pass-through path rule.
 *
 * @param openAiBaseUrl          base for {@code /chat/completions} and for
 *                               every pass-through forward
 * @param anthropicBaseUrl       base for {@code /messages}
 * @param passthroughStripPrefix path prefix (e.g. {@code v1/}) removed from
 *                               pass-through paths when the OpenAI base URL
 *                               already ends with the same segment; blank
 *                               disables stripping
 */
public record UpstreamEndpoints(String openAiBaseUrl, String anthropicBaseUrl, String passthroughStripPrefix) {

    public UpstreamEndpoints {
        openAiBaseUrl = trimTrailingSlash(Objects.requireNonNull(openAiBaseUrl, "openAiBaseUrl"));
        anthropicBaseUrl = trimTrailingSlash(Objects.requireNonNull(anthropicBaseUrl, "anthropicBaseUrl"));
        passthroughStripPrefix = passthroughStripPrefix != null ? passthroughStripPrefix.strip() : "";
    }

    /** {@code <openai base>/chat/completions}. */
    public String chatCompletionsUrl() {
        return openAiBaseUrl + "/chat/completions";
    }

    /** {@code <anthropic base>/messages}. */
    public String messagesUrl() {
        return anthropicBaseUrl + "/messages";
    }

    /**
     * Resolves a pass-through target against the OpenAI base URL.
     *
     * <p>
     * The leading {@code /} of {@code path} is dropped. If the base URL ends
     * with {@code /v1} and the path starts with {@code v1/} (for the default
     * prefix), that prefix is removed so {@code /v1/models} does not become
     * {@code .../v1/v1/models}. Other prefixes are left alone.
     *
     * @param path        inbound path, with or without leading {@code /}
     * @param queryString raw query string without {@code ?}, may be null
     * @return the absolute target URL
     */
    public String passthroughUrl(String path, String queryString) {
        String cleanPath = path.startsWith("/") ? path.substring(1) : path;
        if (!passthroughStripPrefix.isEmpty()) {
            String segment = passthroughStripPrefix.endsWith("/")
                    ? passthroughStripPrefix.substring(0, passthroughStripPrefix.length() - 1)
                    : passthroughStripPrefix;
            if (openAiBaseUrl.endsWith("/" + segment) && cleanPath.startsWith(passthroughStripPrefix)) {
                cleanPath = cleanPath.substring(passthroughStripPrefix.length());
            }
        }
        String url = openAiBaseUrl + "/" + cleanPath;
        return queryString == null || queryString.isEmpty() ? url : url + "?" + queryString;
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
