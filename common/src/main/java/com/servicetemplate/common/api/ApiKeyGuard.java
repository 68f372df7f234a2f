package com.servicetemplate.common.api;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.servicetemplate.common.metrics.ServiceMetrics;

import io.javalin.http.Handler;
import io.javalin.http.HttpStatus;

/**
 * Wraps handlers so they only run when the request carries the configured API key.
 */
public class ApiKeyGuard {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyGuard.class);

    public static final String HEADER = "X-API-KEY";

    private final String apiKey;
    private final ServiceMetrics metrics;

    public ApiKeyGuard(String apiKey, ServiceMetrics metrics) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public Handler withApiKey(Handler handler) {
        return ctx -> {
            String provided = ctx.header(HEADER);
            if (provided == null || !provided.equals(apiKey)) {
                metrics.unauthorizedRequest();
                logger.warn("Rejected request to {} from {}: invalid API key", ctx.path(), ctx.ip());
                ctx.status(HttpStatus.UNAUTHORIZED).contentType("text/plain").result("Invalid API Key");
                return;
            }
            handler.handle(ctx);
        };
    }
}
