package io.llmrelay.standalone.config;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.llmrelay.core.model.ModelMappingTable;
import io.llmrelay.core.model.ToolInjection;
import io.llmrelay.core.model.UpstreamEndpoints;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of the relay. Built once at startup and passed
 * explicitly to every component; never mutated afterwards.
 *
 * <p>
 * Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param proxyHost              bind address of the HTTP server
 * @param proxyPort              listen port of the HTTP server
 * @param maxBodyBytes           largest accepted inbound body in bytes;
 *                               {@code 0} accepts any size
 * @param openAiBaseUrl          upstream base URL of the OpenAI dialect and of
 *                               pass-through forwards
 * @param anthropicBaseUrl       upstream base URL of the Anthropic dialect
 * @param proxyUrl               forward proxy for upstream traffic, or
 *                               {@code null} for direct connections
 * @param apiKey                 fixed upstream credential, or {@code null} to
 *                               forward the caller's
 * @param connectTimeoutMs       upstream TCP connect timeout in ms
 * @param responseTimeoutMs      ceiling on waiting for upstream response
 *                               headers in ms; {@code 0} waits forever
 * @param chatCompletionsPaths   inbound paths served by the OpenAI dialect
 * @param messagesPaths          inbound paths served by the Anthropic dialect
 * @param passthroughStripPrefix pass-through path prefix stripping rule
 * @param modelMap               Anthropic caller model → upstream model
 * @param unmappedModelStatus    HTTP status of the local rejection of an
 *                               unmapped Anthropic model
 * @param webSearchEnabled       append the web-search tool to Anthropic
 *                               requests
 * @param webSearchTool          the tool object to append
 * @param healthEnabled          serve the liveness endpoint
 * @param healthPath             liveness endpoint path
 * @param loggingFormat          json or text
 * @param loggingLevel           root log level
 */
public record RelayConfig(
        String proxyHost,
        int proxyPort,
        long maxBodyBytes,
        String openAiBaseUrl,
        String anthropicBaseUrl,
        String proxyUrl,
        String apiKey,
        int connectTimeoutMs,
        int responseTimeoutMs,
        List<String> chatCompletionsPaths,
        List<String> messagesPaths,
        String passthroughStripPrefix,
        Map<String, String> modelMap,
        int unmappedModelStatus,
        boolean webSearchEnabled,
        ObjectNode webSearchTool,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    /** Built-in Anthropic model table, used when none is configured. */
    public static final Map<String, String> DEFAULT_MODEL_MAP = defaultModelMap();

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** The upstream endpoints derived from this configuration. */
    public UpstreamEndpoints endpoints() {
        return new UpstreamEndpoints(openAiBaseUrl, anthropicBaseUrl, passthroughStripPrefix);
    }

    /** The Anthropic model table, named after its environment variable. */
    public ModelMappingTable modelMappingTable() {
        return new ModelMappingTable(ModelMappingTable.ANTHROPIC_MODEL_MAP, modelMap);
    }

    /** The Anthropic tool injection settings. */
    public ToolInjection toolInjection() {
        return webSearchEnabled ? new ToolInjection(true, webSearchTool) : ToolInjection.DISABLED;
    }

    /** The default web-search tool definition. */
    public static ObjectNode defaultWebSearchTool() {
        ObjectNode tool = JsonNodeFactory.instance.objectNode();
        tool.put("type", "web_search_20250305");
        tool.put("name", "web_search");
        tool.put("max_uses", 5);
        return tool;
    }

    private static Map<String, String> defaultModelMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("claude-opus-4-1-20250805", "anthropic/claude-opus-4.1");
        map.put("claude-opus-4-20250514", "anthropic/claude-opus-4");
        map.put("claude-sonnet-4-20250514", "anthropic/claude-sonnet-4");
        map.put("claude-3-7-sonnet-20250219", "anthropic/claude-3.7-sonnet");
        map.put("claude-3-5-haiku-20241022", "anthropic/claude-3.5-haiku");
        return Map.copyOf(map);
    }

    /** Builder for {@link RelayConfig}. */
    public static final class Builder {
        private String proxyHost = "0.0.0.0";
        private int proxyPort = 11731;
        private long maxBodyBytes = 0;
        private String openAiBaseUrl = "https://zenmux.ai/api/v1";
        private String anthropicBaseUrl = "https://zenmux.ai/api/anthropic/v1";
        private String proxyUrl;
        private String apiKey;
        private int connectTimeoutMs = 10_000;
        private int responseTimeoutMs = 0;
        private List<String> chatCompletionsPaths = List.of("/v1/chat/completions", "/chat/completions");
        private List<String> messagesPaths = List.of("/v1/messages", "/messages");
        private String passthroughStripPrefix = "v1/";
        private Map<String, String> modelMap = DEFAULT_MODEL_MAP;
        private int unmappedModelStatus = 400;
        private boolean webSearchEnabled = false;
        private ObjectNode webSearchTool = defaultWebSearchTool();
        private boolean healthEnabled = true;
        private String healthPath = "/_relay/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder maxBodyBytes(long maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder openAiBaseUrl(String openAiBaseUrl) {
            this.openAiBaseUrl = openAiBaseUrl;
            return this;
        }

        public Builder anthropicBaseUrl(String anthropicBaseUrl) {
            this.anthropicBaseUrl = anthropicBaseUrl;
            return this;
        }

        public Builder proxyUrl(String proxyUrl) {
            this.proxyUrl = proxyUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder responseTimeoutMs(int responseTimeoutMs) {
            this.responseTimeoutMs = responseTimeoutMs;
            return this;
        }

        public Builder chatCompletionsPaths(List<String> chatCompletionsPaths) {
            this.chatCompletionsPaths = chatCompletionsPaths;
            return this;
        }

        public Builder messagesPaths(List<String> messagesPaths) {
            this.messagesPaths = messagesPaths;
            return this;
        }

        public Builder passthroughStripPrefix(String passthroughStripPrefix) {
            this.passthroughStripPrefix = passthroughStripPrefix;
            return this;
        }

        public Builder modelMap(Map<String, String> modelMap) {
            this.modelMap = modelMap;
            return this;
        }

        public Builder unmappedModelStatus(int unmappedModelStatus) {
            this.unmappedModelStatus = unmappedModelStatus;
            return this;
        }

        public Builder webSearchEnabled(boolean webSearchEnabled) {
            this.webSearchEnabled = webSearchEnabled;
            return this;
        }

        public Builder webSearchTool(ObjectNode webSearchTool) {
            this.webSearchTool = webSearchTool;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link RelayConfig}. Blank optional strings become
         * {@code null}; collections are copied.
         */
        public RelayConfig build() {
            return new RelayConfig(
                    proxyHost,
                    proxyPort,
                    maxBodyBytes,
                    openAiBaseUrl,
                    anthropicBaseUrl,
                    blankToNull(proxyUrl),
                    blankToNull(apiKey),
                    connectTimeoutMs,
                    responseTimeoutMs,
                    List.copyOf(chatCompletionsPaths),
                    List.copyOf(messagesPaths),
                    passthroughStripPrefix,
                    Map.copyOf(modelMap),
                    unmappedModelStatus,
                    webSearchEnabled,
                    webSearchTool != null ? webSearchTool.deepCopy() : null,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.strip();
        }
    }
}
