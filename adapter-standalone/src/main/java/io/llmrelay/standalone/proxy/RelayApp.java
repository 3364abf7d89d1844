package io.llmrelay.standalone.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.llmrelay.core.dialect.AnthropicTransformer;
import io.llmrelay.core.dialect.ErrorResponseBuilder;
import io.llmrelay.core.dialect.HeaderSanitizer;
import io.llmrelay.core.dialect.OpenAiTransformer;
import io.llmrelay.core.dialect.RequestRewriter;
import io.llmrelay.standalone.adapter.StandaloneAdapter;
import io.llmrelay.standalone.config.ConfigLoader;
import io.llmrelay.standalone.config.RelayConfig;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the relay startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure logging</li>
 * <li>Build the rewriting pipeline (sanitizer, dialect transformers, model
 * table, endpoints)</li>
 * <li>Initialize the shared upstream HTTP client</li>
 * <li>Start the Javalin HTTP server</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.llmrelay.standalone.StandaloneMain}
 * to allow clean integration testing without going through {@code main()}.
 */
public final class RelayApp {

    private static final Logger LOG = LoggerFactory.getLogger(RelayApp.class);

    /** HTTP methods accepted by the relay; anything else is answered with 405. */
    static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "OPTIONS", "HEAD");

    private static final List<HandlerType> ROUTED_METHODS = List.of(
            HandlerType.GET, HandlerType.POST, HandlerType.PUT, HandlerType.DELETE, HandlerType.OPTIONS,
            HandlerType.HEAD);

    private final Javalin app;
    private final RelayConfig config;

    private RelayApp(Javalin app, RelayConfig config) {
        this.app = app;
        this.config = config;
    }

    /**
     * Loads the configuration selected by {@code args}, configures logging and
     * starts the relay.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/llm-relay.yaml})
     * @return a running relay
     */
    public static RelayApp start(String[] args) {
        // 1. Load configuration
        RelayConfig config = ConfigLoader.load(args);

        // 2. Configure Logback based on logging.format + logging.level
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        return start(config);
    }

    /**
     * Starts the relay for an already loaded configuration.
     *
     * @param config the relay configuration
     * @return a running relay
     */
    public static RelayApp start(RelayConfig config) {
        return start(config, ConnectionListener.NOOP);
    }

    /**
     * Starts the relay, reporting upstream connection lifecycle events to
     * {@code listener}.
     *
     * @param config   the relay configuration
     * @param listener receives opened/closed events for every upstream
     *                 connection
     * @return a running relay
     */
    public static RelayApp start(RelayConfig config, ConnectionListener listener) {
        long startTime = System.nanoTime();

        // 3. Build the rewriting pipeline
        ObjectMapper mapper = new ObjectMapper();
        AnthropicTransformer anthropic =
                new AnthropicTransformer(config.modelMappingTable(), config.toolInjection());
        RequestRewriter rewriter = new RequestRewriter(
                new HeaderSanitizer(config.apiKey()),
                new OpenAiTransformer(),
                anthropic,
                config.endpoints(),
                new ErrorResponseBuilder(config.unmappedModelStatus()),
                mapper);
        LOG.info("Model map loaded: {} entries, web search injection {}",
                anthropic.modelMap().size(), config.webSearchEnabled() ? "enabled" : "disabled");

        // 4. Initialize the upstream HTTP client
        UpstreamDispatcher dispatcher = new UpstreamDispatcher(config, listener);
        ProxyHandler proxyHandler = new ProxyHandler(
                new StandaloneAdapter(),
                new RouteMatcher(config.chatCompletionsPaths(), config.messagesPaths()),
                rewriter,
                dispatcher,
                new StreamRelay(),
                mapper);

        // 5. Start Javalin HTTP server
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            // Javalin rejects bodies over 1 MB by default
            javalinConfig.http.maxRequestSize = config.maxBodyBytes() > 0 ? config.maxBodyBytes() : Long.MAX_VALUE;
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }

        app.before(ctx -> {
            String method = ctx.method().name();
            if (!ALLOWED_METHODS.contains(method)) {
                ctx.status(405);
                ctx.contentType("application/problem+json");
                ctx.result(ProblemDetail.methodNotAllowed("HTTP method " + method + " is not supported", ctx.path())
                        .toString());
                ctx.skipRemainingHandlers();
            }
        });
        for (HandlerType method : ROUTED_METHODS) {
            app.addHttpHandler(method, "/", proxyHandler);
            app.addHttpHandler(method, "/<path>", proxyHandler);
        }

        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}: {} ({})",
                    ctx.method().name(), ctx.path(), e.getMessage(), e.getClass().getSimpleName(), e);
            ctx.status(500);
            ctx.contentType("application/problem+json");
            ctx.result(ProblemDetail.internalError(e.getClass().getSimpleName() + ": " + e.getMessage(), ctx.path())
                    .toString());
        });

        app.start(config.proxyHost(), config.proxyPort());
        int actualPort = app.port();

        // Log structured startup summary
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "llm-relay started: listen={}:{}, maxBodyBytes={}, openai={}, anthropic={}, proxy={}, credential={},"
                        + " startupMs={}",
                config.proxyHost(),
                actualPort,
                config.maxBodyBytes() > 0 ? config.maxBodyBytes() : "unlimited",
                config.openAiBaseUrl(),
                config.anthropicBaseUrl(),
                config.proxyUrl() != null ? config.proxyUrl() : "none",
                config.apiKey() != null ? "configured" : "caller-supplied",
                elapsedMs);

        return new RelayApp(app, config);
    }

    /** Returns the port the relay is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the relay configuration. */
    public RelayConfig config() {
        return config;
    }

    /** Stops the Javalin server. */
    public void stop() {
        if (app != null) {
            app.stop();
        }
        LOG.info("llm-relay stopped");
    }
}
