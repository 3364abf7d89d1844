package io.llmrelay.core.spi;

import io.llmrelay.core.model.InboundRequest;

/**
 * Bridges a serving layer's native request type into the core
 * {@link InboundRequest}.
 *
 * <p>
 * Implementations MUST:
 * <ul>
 * <li>copy the body bytes as received, without parsing them</li>
 * <li>preserve every header value; names are normalized by
 * {@link io.llmrelay.core.model.HttpHeaders}</li>
 * <li>pass the raw query string through verbatim</li>
 * </ul>
 *
 * @param <R> the native request type
 */
public interface GatewayAdapter<R> {

    /**
     * Wraps a native request. The returned value is a copy; later changes to
     * {@code nativeRequest} do not affect it.
     *
     * @param nativeRequest the serving layer's request
     * @return the wrapped request
     */
    InboundRequest wrapRequest(R nativeRequest);
}
