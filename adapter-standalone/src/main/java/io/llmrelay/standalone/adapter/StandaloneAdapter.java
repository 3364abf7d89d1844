package io.llmrelay.standalone.adapter;

import io.javalin.http.Context;
import io.llmrelay.core.model.HttpHeaders;
import io.llmrelay.core.model.InboundRequest;
import io.llmrelay.core.model.MediaType;
import io.llmrelay.core.model.MessageBody;
import io.llmrelay.core.spi.GatewayAdapter;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone relay gateway adapter.
 *
 * <p>
 * Implements {@link GatewayAdapter} for Javalin's {@link Context}. The body
 * is copied as raw bytes and never parsed here; every header value is kept,
 * names are normalized to lowercase, and the query string is passed through
 * verbatim.
 *
 * <p>
 * This class is thread-safe: all state is local to each method invocation.
 */
public final class StandaloneAdapter implements GatewayAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneAdapter.class);

    @Override
    public InboundRequest wrapRequest(Context ctx) {
        HttpHeaders headers = buildHeaders(ctx);
        byte[] content = ctx.bodyAsBytes();
        MessageBody body = content == null || content.length == 0
                ? MessageBody.empty()
                : MessageBody.of(content, MediaType.fromContentType(headers.first("content-type")));

        String method = ctx.method().name();
        String path = ctx.path();
        String queryString = ctx.queryString();

        LOG.debug("wrapRequest: {} {} (body={} bytes, headers={})", method, path, body.content().length, headers.names().size());

        return new InboundRequest(method, path, queryString, headers, body);
    }

    /**
     * Reads every header value from the servlet request. Multiple lines for the
     * same name, in any case, end up under one lowercase key.
     */
    static HttpHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        Enumeration<String> headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                Enumeration<String> values = ctx.req().getHeaders(name);
                List<String> valueList =
                        headersAll.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>());
                if (values != null) {
                    while (values.hasMoreElements()) {
                        valueList.add(values.nextElement());
                    }
                }
            }
        }
        return HttpHeaders.ofMulti(headersAll);
    }
}
