package io.llmrelay.standalone.proxy;

import io.llmrelay.core.model.HttpHeaders;
import java.util.Arrays;

/**
 * Fully read upstream response.
 *
 * <p>
 * Returned by {@link UpstreamDispatcher#sendBuffered} after the connection
 * has been closed. Header names are lowercase; framing, encoding and
 * hop-by-hop headers have already been removed.
 *
 * @param statusCode the HTTP status code from upstream
 * @param headers    the headers to mirror to the caller
 * @param body       the complete response body (empty for 204 and HEAD)
 */
public record UpstreamResponse(int statusCode, HttpHeaders headers, byte[] body) {

    public UpstreamResponse {
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : new byte[0];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpstreamResponse that)) return false;
        return statusCode == that.statusCode && headers.equals(that.headers) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * statusCode + headers.hashCode()) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "UpstreamResponse[" + statusCode + ", " + headers + ", " + body.length + " bytes]";
    }
}
