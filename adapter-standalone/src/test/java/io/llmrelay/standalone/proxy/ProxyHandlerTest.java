package io.llmrelay.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.llmrelay.core.dialect.AnthropicTransformer;
import io.llmrelay.core.dialect.HeaderSanitizer;
import io.llmrelay.core.dialect.OpenAiTransformer;
import io.llmrelay.core.dialect.RequestRewriter;
import io.llmrelay.standalone.adapter.StandaloneAdapter;
import io.llmrelay.standalone.config.RelayConfig;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Tests for {@link ProxyHandler} paths that a live upstream cannot trigger
 * reliably, using a mocked {@link UpstreamDispatcher} and Javalin
 * {@link Context}.
 */
@DisplayName("ProxyHandler: interrupted upstream wait")
class ProxyHandlerTest {

    private UpstreamDispatcher dispatcher;
    private ProxyHandler handler;

    @BeforeEach
    void setUp() {
        RelayConfig config = RelayConfig.builder().build();
        ObjectMapper mapper = new ObjectMapper();
        RequestRewriter rewriter = new RequestRewriter(
                new HeaderSanitizer(null),
                new OpenAiTransformer(),
                new AnthropicTransformer(config.modelMappingTable(), config.toolInjection()),
                config.endpoints(),
                mapper);
        dispatcher = mock(UpstreamDispatcher.class);
        handler = new ProxyHandler(
                new StandaloneAdapter(),
                new RouteMatcher(config.chatCompletionsPaths(), config.messagesPaths()),
                rewriter,
                dispatcher,
                new StreamRelay(),
                mapper);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("streaming dialect request → 502 Connection Error, interrupt flag restored")
    void streamingOpenInterrupted() throws Exception {
        when(dispatcher.open(any())).thenThrow(new InterruptedException());
        Context ctx = mockContext(HandlerType.POST, "/v1/chat/completions", "{\"model\":\"gpt-4o\",\"stream\":true}");

        handler.handle(ctx);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(ctx).status(502);
        assertThat(resultText(ctx)).startsWith("Connection Error: ");
    }

    @Test
    @DisplayName("buffered dialect request → 502 Connection Error, interrupt flag restored")
    void bufferedSendInterrupted() throws Exception {
        when(dispatcher.sendBuffered(any())).thenThrow(new InterruptedException());
        Context ctx = mockContext(
                HandlerType.POST, "/v1/messages", "{\"model\":\"claude-sonnet-4-20250514\",\"stream\":false}");

        handler.handle(ctx);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(ctx).status(502);
        assertThat(resultText(ctx)).startsWith("Connection Error: ");
    }

    @Test
    @DisplayName("pass-through request → 502 Proxy Error, interrupt flag restored")
    void passthroughInterrupted() throws Exception {
        when(dispatcher.sendBuffered(any())).thenThrow(new InterruptedException());
        Context ctx = mockContext(HandlerType.GET, "/v1/models", "");

        handler.handle(ctx);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        verify(ctx).status(502);
        assertThat(resultText(ctx)).startsWith("Proxy Error: ").contains("/models");
    }

    private static String resultText(Context ctx) {
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(ctx).result(body.capture());
        return body.getValue();
    }

    private static Context mockContext(HandlerType method, String path, String body) {
        Context ctx = mock(Context.class);
        HttpServletRequest req = mock(HttpServletRequest.class);

        when(ctx.method()).thenReturn(method);
        when(ctx.path()).thenReturn(path);
        when(ctx.bodyAsBytes()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        when(ctx.req()).thenReturn(req);
        when(req.getHeaderNames()).thenReturn(Collections.emptyEnumeration());
        return ctx;
    }
}
