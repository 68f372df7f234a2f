package com.servicetemplate.common.metrics;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * Prometheus metrics common to every service, named with the service name as prefix.
 */
public class ServiceMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ServiceMetrics.class);

    private final String prefix;
    private final Clock clock;
    private final PrometheusMeterRegistry registry;

    private final AtomicLong lastHeartbeat = new AtomicLong();
    private final AtomicLong serviceStartTime = new AtomicLong();

    private final Counter heartbeatCount;
    private final Counter errors;
    private final Counter pings;
    private final Counter unauthorizedRequests;
    private final Counter configRequests;
    private final Counter statusRequests;

    public ServiceMetrics(String serviceName) {
        this(serviceName, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), Clock.systemUTC());
    }

    public ServiceMetrics(String serviceName, PrometheusMeterRegistry registry, Clock clock) {
        this.prefix = sanitize(serviceName);
        this.registry = registry;
        this.clock = clock;

        this.heartbeatCount = counter("_heartbeat_count", "The total number of executed heartbeats");
        Gauge.builder(prefix + "_heartbeat_message", lastHeartbeat, AtomicLong::get)
                .description("The last heartbeat received")
                .register(registry);
        Gauge.builder(prefix + "_service_start_time", serviceStartTime, AtomicLong::get)
                .description("The last time the service was started")
                .register(registry);
        this.errors = counter("_error_count", "The total number of errors");
        this.pings = counter("_ping_count", "Number of pings requested");
        this.unauthorizedRequests = counter("_unauthorized_requests_count", "The total number of unauthorized requests");
        this.configRequests = counter("_config_requests_count", "The total number of configuration requests");
        this.statusRequests = counter("_status_requests_count", "The total number of status requests");

        serviceStartTime.set(clock.instant().getEpochSecond());
        logger.debug("Metrics initialized for service {}", serviceName);
    }

    private Counter counter(String suffix, String help) {
        return Counter.builder(prefix + suffix)
                .description(help)
                .register(registry);
    }

    /** Prometheus names allow letters, digits and underscores only. */
    static String sanitize(String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            return "service";
        }
        String cleaned = serviceName.replaceAll("[^a-zA-Z0-9_]", "_");
        return Character.isDigit(cleaned.charAt(0)) ? "_" + cleaned : cleaned;
    }

    public void heartbeat() {
        heartbeatCount.increment();
        lastHeartbeat.set(clock.instant().getEpochSecond());
    }

    public void error() {
        errors.increment();
    }

    public void ping() {
        pings.increment();
    }

    public void unauthorizedRequest() {
        unauthorizedRequests.increment();
    }

    public void configRequest() {
        configRequests.increment();
    }

    public void statusRequest() {
        statusRequests.increment();
    }

    public String getPrefix() {
        return prefix;
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    /** Current metrics in the Prometheus text exposition format. */
    public String scrape() {
        return registry.scrape();
    }
}
