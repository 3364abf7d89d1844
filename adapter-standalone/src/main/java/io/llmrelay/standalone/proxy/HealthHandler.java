package io.llmrelay.standalone.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness probe handler.
 *
 * <p>
 * Returns a fixed {@code 200 OK} with {@code {"status": "UP"}} while the JVM
 * and HTTP server are running. Registered as a dedicated Javalin route, so it
 * takes precedence over the pass-through wildcard and is never forwarded.
 */
public final class HealthHandler implements Handler {

    private static final String HEALTH_RESPONSE = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(HEALTH_RESPONSE);
    }
}
