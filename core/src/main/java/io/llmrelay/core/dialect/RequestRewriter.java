package io.llmrelay.core.dialect;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmrelay.core.error.ModelNotMappedException;
import io.llmrelay.core.model.Dialect;
import io.llmrelay.core.model.HttpHeaders;
import io.llmrelay.core.model.InboundRequest;
import io.llmrelay.core.model.MediaType;
import io.llmrelay.core.model.MessageBody;
import io.llmrelay.core.model.OutboundRequest;
import io.llmrelay.core.model.RequestDocument;
import io.llmrelay.core.model.TransformResult;
import io.llmrelay.core.model.UpstreamEndpoints;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link InboundRequest} into the single {@link OutboundRequest} to
 * dispatch, or into a local rejection.
 *
 * <p>
 * Dispatch table:
 * <ul>
 * <li>{@link #rewriteChatCompletions}: sanitize headers, parse the body
 * (unparseable → empty document), inject usage reporting, always stream</li>
 * <li>{@link #rewriteMessages}: sanitize headers (with {@code x-api-key}),
 * map the model, inject the tool; stream when the body asks for it;
 * {@code ERROR} with the configured status on an unmapped model</li>
 * <li>{@link #rewritePassthrough}: sanitize headers, keep method, query and
 * body bytes, re-target the path; always buffered</li>
 * </ul>
 *
 * <p>
 * Thread-safe: all collaborators are immutable.
 */
public final class RequestRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(RequestRewriter.class);
    private static final String CONTENT_TYPE = "content-type";

    private final HeaderSanitizer sanitizer;
    private final OpenAiTransformer openAi;
    private final AnthropicTransformer anthropic;
    private final UpstreamEndpoints endpoints;
    private final ErrorResponseBuilder errorResponseBuilder;
    private final ObjectMapper mapper;

    /** Creates a rewriter that rejects unmapped models with HTTP 400. */
    public RequestRewriter(
            HeaderSanitizer sanitizer,
            OpenAiTransformer openAi,
            AnthropicTransformer anthropic,
            UpstreamEndpoints endpoints,
            ObjectMapper mapper) {
        this(sanitizer, openAi, anthropic, endpoints, new ErrorResponseBuilder(), mapper);
    }

    public RequestRewriter(
            HeaderSanitizer sanitizer,
            OpenAiTransformer openAi,
            AnthropicTransformer anthropic,
            UpstreamEndpoints endpoints,
            ErrorResponseBuilder errorResponseBuilder,
            ObjectMapper mapper) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.openAi = Objects.requireNonNull(openAi, "openAi");
        this.anthropic = Objects.requireNonNull(anthropic, "anthropic");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.errorResponseBuilder = Objects.requireNonNull(errorResponseBuilder, "errorResponseBuilder");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Rewrites an OpenAI-dialect request. Always {@code SUCCESS}, always streaming. */
    public TransformResult rewriteChatCompletions(InboundRequest request) {
        RequestDocument document = openAi.apply(RequestDocument.parse(request.body().content(), mapper));
        LOG.info("[Chat] request -> {}", document.model().orElse("unknown"));
        return TransformResult.success(new OutboundRequest(
                "POST",
                endpoints.chatCompletionsUrl(),
                jsonHeaders(sanitizer.sanitize(request.headers(), Dialect.OPENAI_CHAT)),
                MessageBody.json(document.toBytes(mapper)),
                true));
    }

    /**
     * Rewrites an Anthropic-dialect request.
     *
     * @return {@code SUCCESS} with the outbound request, or {@code ERROR} (JSON
     *         body, 400 unless configured otherwise) when the model is not
     *         mapped
     */
    public TransformResult rewriteMessages(InboundRequest request) {
        RequestDocument parsed = RequestDocument.parse(request.body().content(), mapper);
        RequestDocument document;
        try {
            document = anthropic.apply(parsed);
        } catch (ModelNotMappedException e) {
            LOG.warn("Rejected {} request: {} ({})", e.dialect(), e.getMessage(), e.getClass().getSimpleName());
            return errorResponseBuilder.toResult(e);
        }
        boolean streaming = document.streamRequested();
        LOG.info("[Messages] request -> {} (stream={})", document.model().orElse("unknown"), streaming);
        return TransformResult.success(new OutboundRequest(
                "POST",
                endpoints.messagesUrl(),
                jsonHeaders(sanitizer.sanitize(request.headers(), Dialect.ANTHROPIC_MESSAGES)),
                MessageBody.json(document.toBytes(mapper)),
                streaming));
    }

    /** Rewrites any other request as a buffered pass-through forward. */
    public TransformResult rewritePassthrough(InboundRequest request) {
        String targetUrl = endpoints.passthroughUrl(request.path(), request.queryString());
        LOG.info("[Proxy] {} {} -> {}", request.method(), request.path(), targetUrl);
        return TransformResult.success(new OutboundRequest(
                request.method(), targetUrl, sanitizer.sanitize(request.headers()), request.body(), false));
    }

    public UpstreamEndpoints endpoints() {
        return endpoints;
    }

    private static HttpHeaders jsonHeaders(HttpHeaders headers) {
        return headers.contains(CONTENT_TYPE) ? headers : headers.with(CONTENT_TYPE, MediaType.JSON.value());
    }
}
