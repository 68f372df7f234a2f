package com.servicetemplate.common.api;

import java.io.IOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetemplate.common.config.ServiceConfig;
import com.servicetemplate.common.metrics.ServiceMetrics;
import com.servicetemplate.common.scheduler.JobScheduler;
import com.servicetemplate.common.util.MaskedJson;
import com.servicetemplate.common.util.ReleaseNotes;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HttpStatus;
import io.javalin.json.JavalinJackson;

/**
 * HTTP surface shared by every service: liveness and readiness probes, config and job
 * introspection, and a separate Prometheus endpoint on the metrics port.
 */
public class ApiServer {

    private static final Logger logger = LoggerFactory.getLogger(ApiServer.class);

    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final ServiceConfig config;
    private final ServiceMetrics metrics;
    private final JobScheduler scheduler;
    private final BooleanSupplier readiness;
    private final Supplier<String> brokerState;
    private final ApiKeyGuard guard;
    private final long startedAt = System.currentTimeMillis();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private Javalin app;
    private Javalin metricsApp;
    private Thread shutdownHook;

    public ApiServer(ServiceConfig config, ServiceMetrics metrics, JobScheduler scheduler) {
        this(config, metrics, scheduler, () -> true, () -> "DISABLED");
    }

    public ApiServer(ServiceConfig config, ServiceMetrics metrics, JobScheduler scheduler,
                     BooleanSupplier readiness, Supplier<String> brokerState) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.readiness = Objects.requireNonNull(readiness, "readiness");
        this.brokerState = Objects.requireNonNull(brokerState, "brokerState");
        this.guard = new ApiKeyGuard(config.getApiKey(), metrics);
    }

    public ApiKeyGuard guard() {
        return guard;
    }

    public Handler withApiKey(Handler handler) {
        return guard.withApiKey(handler);
    }

    /**
     * Starts both servers. Entries in {@code overrides} replace or extend the default GET routes.
     */
    public synchronized void start(Map<String, Handler> overrides) {
        if (app != null) {
            throw new IllegalStateException("API server already started");
        }

        Map<String, Handler> routes = defaultRoutes();
        if (overrides != null) {
            overrides.forEach((path, handler) -> {
                if (routes.containsKey(path)) {
                    logger.debug("Overriding route {}", path);
                }
                routes.put(path, handler);
            });
        }

        app = Javalin.create(cfg -> {
            cfg.showJavalinBanner = false;
            cfg.http.defaultContentType = "application/json";
            cfg.http.prefer405over404 = true;
            cfg.jsonMapper(new JavalinJackson(new ObjectMapper()));
        });
        app.error(HttpStatus.METHOD_NOT_ALLOWED, ctx -> {
            metrics.error();
            ctx.contentType("application/json").result("{\"error\": \"Only GET method is allowed\"}");
        });
        routes.forEach(app::get);
        app.start(config.getPort());

        metricsApp = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        metricsApp.get("/metrics", this::metrics);
        metricsApp.start(config.getMetricsPort());

        shutdownHook = new Thread(this::stop, "api-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        logger.info("{} API listening on port {} (metrics on {})", config.getServiceName(), app.port(), metricsApp.port());
    }

    Map<String, Handler> defaultRoutes() {
        Map<String, Handler> routes = new LinkedHashMap<>();
        routes.put("/ping", this::ping);
        routes.put("/config", guard.withApiKey(this::config));
        routes.put("/releasenotes", this::releaseNotes);
        routes.put("/metrics", this::metrics);
        routes.put("/health", ctx -> ctx.json(Map.of("status", "ok")));
        routes.put("/liveness", ctx -> ctx.json(Map.of("status", "alive")));
        routes.put("/readiness", this::readiness);
        routes.put("/status", this::status);
        routes.put("/runningjobs", guard.withApiKey(ctx -> ctx.json(scheduler.jobsInfo())));
        routes.put("/scheduledjobs", guard.withApiKey(ctx -> ctx.json(scheduler.scheduledJobs())));
        return routes;
    }

    private void ping(Context ctx) {
        metrics.ping();
        String message = ctx.queryParam("message");
        if (message == null || message.isEmpty()) {
            message = "No message provided";
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", config.getServiceName());
        body.put("version", config.getVersion());
        body.put("timestamp", OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        body.put("status", "ok");
        body.put("message", message);
        ctx.json(body);
    }

    private void config(Context ctx) {
        metrics.configRequest();
        ctx.contentType("application/json").result(MaskedJson.toJson(config));
    }

    private void releaseNotes(Context ctx) {
        try {
            ctx.contentType("text/plain").result(ReleaseNotes.read());
        } catch (IOException e) {
            metrics.error();
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(Map.of("error", "Failed to read release notes"));
        }
    }

    private void metrics(Context ctx) {
        ctx.contentType(PROMETHEUS_CONTENT_TYPE).result(metrics.scrape());
    }

    private void readiness(Context ctx) {
        if (readiness.getAsBoolean()) {
            ctx.json(Map.of("status", "ready"));
        } else {
            ctx.status(HttpStatus.SERVICE_UNAVAILABLE).json(Map.of("status", "not ready"));
        }
    }

    private void status(Context ctx) {
        metrics.statusRequest();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", config.getServiceName());
        body.put("version", config.getVersion());
        body.put("status", "running");
        body.put("uptime", Duration.ofMillis(System.currentTimeMillis() - startedAt).toSeconds() + "s");
        body.put("broker", brokerState.get());
        ctx.json(body);
    }

    /** Actual port of the main server, useful when configured with port 0. */
    public int port() {
        return app == null ? -1 : app.port();
    }

    public int metricsPort() {
        return metricsApp == null ? -1 : metricsApp.port();
    }

    /**
     * Blocks until {@link #stop()} has run.
     */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public synchronized void stop() {
        if (stopped.getCount() == 0) return;
        logger.info("Shutting down {} API...", config.getServiceName());
        if (app != null) app.stop();
        if (metricsApp != null) metricsApp.stop();
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down");
            }
        }
        stopped.countDown();
        logger.info("{} API stopped", config.getServiceName());
    }
}
