package io.llmrelay.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link RelayConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code llm-relay.yaml} from the current directory if it
 * exists, otherwise starts from the built-in defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path,
 * which must exist</li>
 * </ul>
 *
 * <p>
 * Missing YAML keys receive the defaults of {@link RelayConfig.Builder}. Every
 * scalar key can be overridden via an environment variable; env vars take
 * precedence over YAML values. An env var is "set" if and only if it is
 * defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    static final String DEFAULT_CONFIG_FILE = "llm-relay.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves and loads the configuration selected by the command line,
     * applying overrides from {@link System#getenv}.
     *
     * @param args command-line arguments
     * @return the loaded configuration
     * @throws ConfigLoadException if an explicit file is missing or any source
     *                             is invalid
     */
    public static RelayConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Resolves and loads the configuration selected by the command line.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup function
     * @return the loaded configuration
     */
    public static RelayConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = resolveConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Loads a {@link RelayConfig} from the given YAML file, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return a fully constructed {@link RelayConfig} with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static RelayConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link RelayConfig} from the given YAML file, applying
     * environment variable overrides from the supplied lookup function.
     *
     * <p>
     * The {@code envLookup} function maps environment variable names to their
     * values. Returning {@code null} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return a fully constructed {@link RelayConfig} with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static RelayConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : MissingNode.getInstance(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the path given with {@code --config}, or {@code null} if absent
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    /**
     * Maps a parsed YAML tree to a {@link RelayConfig} via the builder, then
     * overlays environment variable overrides.
     */
    static RelayConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RelayConfig.Builder builder = RelayConfig.builder();

        // --- YAML mapping ---
        // An empty or "~" value parses as a null node and counts as absent.

        JsonNode proxy = root.path("proxy");
        if (proxy.hasNonNull("host")) builder.proxyHost(proxy.get("host").asText());
        if (proxy.hasNonNull("port")) builder.proxyPort(proxy.get("port").asInt());
        if (proxy.hasNonNull("max-body-bytes")) builder.maxBodyBytes(proxy.get("max-body-bytes").asLong());

        JsonNode upstream = root.path("upstream");
        if (upstream.hasNonNull("openai-base-url"))
            builder.openAiBaseUrl(upstream.get("openai-base-url").asText());
        if (upstream.hasNonNull("anthropic-base-url"))
            builder.anthropicBaseUrl(upstream.get("anthropic-base-url").asText());
        if (upstream.hasNonNull("proxy-url")) builder.proxyUrl(upstream.get("proxy-url").asText());
        if (upstream.hasNonNull("api-key")) builder.apiKey(upstream.get("api-key").asText());
        if (upstream.hasNonNull("connect-timeout-ms"))
            builder.connectTimeoutMs(upstream.get("connect-timeout-ms").asInt());
        if (upstream.hasNonNull("response-timeout-ms"))
            builder.responseTimeoutMs(upstream.get("response-timeout-ms").asInt());

        JsonNode routes = root.path("routes");
        if (routes.hasNonNull("chat-completions"))
            builder.chatCompletionsPaths(stringList(routes.get("chat-completions"), "routes.chat-completions"));
        if (routes.hasNonNull("messages")) builder.messagesPaths(stringList(routes.get("messages"), "routes.messages"));
        if (routes.hasNonNull("passthrough-strip-prefix"))
            builder.passthroughStripPrefix(routes.get("passthrough-strip-prefix").asText());

        JsonNode anthropic = root.path("anthropic");
        if (anthropic.hasNonNull("model-map"))
            builder.modelMap(stringMap(anthropic.get("model-map"), "anthropic.model-map"));
        if (anthropic.hasNonNull("unmapped-model-status"))
            builder.unmappedModelStatus(anthropic.get("unmapped-model-status").asInt());
        JsonNode webSearch = anthropic.path("web-search");
        if (webSearch.hasNonNull("enabled")) builder.webSearchEnabled(webSearch.get("enabled").asBoolean());
        if (webSearch.hasNonNull("tool"))
            builder.webSearchTool(toolObject(webSearch.get("tool"), "anthropic.web-search.tool"));

        JsonNode health = root.path("health");
        if (health.hasNonNull("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.hasNonNull("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        RelayConfig config = builder.build();
        if (config.unmappedModelStatus() < 400 || config.unmappedModelStatus() > 599) {
            throw new ConfigLoadException("anthropic.unmapped-model-status must be an HTTP error status (400-599), got "
                    + config.unmappedModelStatus());
        }
        return config;
    }

    /**
     * Applies environment variable overrides to the builder.
     *
     * <p>
     * An env var is "set" if {@code envLookup.apply(name)} returns a non-null,
     * non-empty (after trim) string. Otherwise the YAML/default value stands.
     */
    private static void applyEnvOverrides(RelayConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "PROXY_HOST", builder::proxyHost);
        envString(envLookup, "OPENAI_BASE_URL", builder::openAiBaseUrl);
        envString(envLookup, "ANTHROPIC_BASE_URL", builder::anthropicBaseUrl);
        envString(envLookup, "UPSTREAM_PROXY_URL", builder::proxyUrl);
        envString(envLookup, "UPSTREAM_API_KEY", builder::apiKey);
        envString(envLookup, "PASSTHROUGH_STRIP_PREFIX", builder::passthroughStripPrefix);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "PROXY_PORT", builder::proxyPort);
        envLong(envLookup, "PROXY_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "UPSTREAM_CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "UPSTREAM_RESPONSE_TIMEOUT_MS", builder::responseTimeoutMs);
        envInt(envLookup, "UNMAPPED_MODEL_STATUS", builder::unmappedModelStatus);

        envBool(envLookup, "WEB_SEARCH_ENABLED", builder::webSearchEnabled);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);

        // JSON-valued variables
        if (isSet(envLookup, "ANTHROPIC_MODEL_MAP")) {
            builder.modelMap(stringMap(envJson(envLookup, "ANTHROPIC_MODEL_MAP"), "ANTHROPIC_MODEL_MAP"));
        }
        if (isSet(envLookup, "WEB_SEARCH_TOOL")) {
            builder.webSearchTool(toolObject(envJson(envLookup, "WEB_SEARCH_TOOL"), "WEB_SEARCH_TOOL"));
        }
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    /** Applies a long env var override if set. */
    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    /** Parses a JSON-valued env var. */
    private static JsonNode envJson(Function<String, String> envLookup, String envVar) {
        try {
            return JSON_MAPPER.readTree(envLookup.apply(envVar).trim());
        } catch (IOException e) {
            throw new ConfigLoadException(envVar + " is not valid JSON", e);
        }
    }

    // --- Shape helpers ---

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of paths");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node, String key) {
        if (!node.isObject()) {
            throw new ConfigLoadException(key + " must be an object of model id to upstream model id");
        }
        Map<String, String> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!entry.getValue().isTextual()) {
                throw new ConfigLoadException(key + "." + entry.getKey() + " must be a string");
            }
            values.put(entry.getKey(), entry.getValue().asText());
        });
        return values;
    }

    private static ObjectNode toolObject(JsonNode node, String key) {
        if (!(node instanceof ObjectNode object) || !object.hasNonNull("type")) {
            throw new ConfigLoadException(key + " must be an object with a 'type' field");
        }
        return object;
    }
}
