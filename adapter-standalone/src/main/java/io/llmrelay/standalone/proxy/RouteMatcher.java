package io.llmrelay.standalone.proxy;

import java.util.List;
import java.util.Set;

/**
 * Classifies an inbound request into one of the relay's three pipelines.
 *
 * <p>
 * Dialect routes match on exact path and {@code POST} only; any other
 * request (including a {@code GET} on a dialect path) is a pass-through.
 */
public final class RouteMatcher {

    /** The pipeline that handles a request. */
    public enum RouteKind {
        CHAT_COMPLETIONS,
        MESSAGES,
        PASSTHROUGH
    }

    private final Set<String> chatCompletionsPaths;
    private final Set<String> messagesPaths;

    public RouteMatcher(List<String> chatCompletionsPaths, List<String> messagesPaths) {
        this.chatCompletionsPaths = Set.copyOf(chatCompletionsPaths);
        this.messagesPaths = Set.copyOf(messagesPaths);
    }

    /**
     * @param method the HTTP method (any case)
     * @param path   the request path
     * @return the matching pipeline, never {@code null}
     */
    public RouteKind match(String method, String path) {
        if (!"POST".equalsIgnoreCase(method)) {
            return RouteKind.PASSTHROUGH;
        }
        if (chatCompletionsPaths.contains(path)) {
            return RouteKind.CHAT_COMPLETIONS;
        }
        if (messagesPaths.contains(path)) {
            return RouteKind.MESSAGES;
        }
        return RouteKind.PASSTHROUGH;
    }
}
