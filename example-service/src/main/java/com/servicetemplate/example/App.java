package com.servicetemplate.example;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.servicetemplate.common.api.ApiServer;
import com.servicetemplate.common.broker.BrokerClient;
import com.servicetemplate.common.broker.BrokerException;
import com.servicetemplate.common.broker.ConsumerWorker;
import com.servicetemplate.common.broker.MessageArchiver;
import com.servicetemplate.common.broker.QueueSpec;
import com.servicetemplate.common.config.BrokerSettings;
import com.servicetemplate.common.config.ConfigException;
import com.servicetemplate.common.logging.LogLevels;
import com.servicetemplate.common.metrics.ServiceMetrics;
import com.servicetemplate.common.scheduler.CronJob;
import com.servicetemplate.common.scheduler.JobScheduler;

import io.javalin.http.Handler;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ExampleConfig config;
        try {
            config = ExampleConfig.load();
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(1);
            return;
        }
        LogLevels.apply(config.getLogLevel());
        logger.info("Main Started");

        ServiceMetrics metrics = new ServiceMetrics(config.getServiceName());

        JobScheduler scheduler = new JobScheduler(config.getHeartbeatCron(), config.isHeartbeatDebug(), metrics);
        scheduler.start(List.of(new CronJob("Custom Scheduled Job", "*/1 * * * *",
                () -> logger.debug("Custom Scheduled Job executed"), List.of("custom", "scheduled"))));

        BrokerClient broker = null;
        ConsumerWorker worker = null;
        BrokerSettings mq = config.getBroker();
        if (mq.isEnabled()) {
            broker = new BrokerClient(
                    mq.toBrokerConfig(QueueSpec.builder(config.getAuditQueue()).autoDelete(true).build()),
                    mq.toRetryPolicy());
            try {
                broker.provisionTopology();
                MessageArchiver archiver = mq.getArchiveDir().isBlank()
                        ? null
                        : new MessageArchiver(Path.of(mq.getArchiveDir()));
                worker = new ConsumerWorker(broker, mq.getQueue(), new OrderHandler(), archiver);
                worker.start();
            } catch (BrokerException e) {
                logger.error("Failed to initialize the message broker: {}", e.getMessage(), e);
                broker.close();
                scheduler.close();
                System.exit(1);
                return;
            }
        }

        BrokerClient brokerRef = broker;
        ApiServer api = new ApiServer(config, metrics, scheduler,
                () -> brokerRef == null || brokerRef.isHealthy(),
                () -> brokerRef == null ? "DISABLED" : brokerRef.getState().name());

        Map<String, Handler> overrides = Map.of(
                "/ping2", ctx -> {
                    logger.info("Custom Ping Without API KEY Handler called");
                    ctx.json(Map.of("message", "Custom Ping Handler Without API Key is working!"));
                },
                "/ping3", api.withApiKey(ctx -> {
                    logger.info("Custom Ping with API KEY Handler called");
                    ctx.json(Map.of("message", "Custom Ping Handler WITH API Key is working!"));
                }));
        api.start(overrides);
        logger.info("Successfully started the service: {}", config.getServiceName());

        List<AutoCloseable> closeables = new ArrayList<>();
        if (worker != null) closeables.add(worker);
        if (broker != null) closeables.add(broker);
        closeables.add(scheduler);

        api.awaitShutdown();
        for (AutoCloseable closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.warn("Error during shutdown: {}", e.getMessage());
            }
        }
        logger.info("Service shutdown complete");
    }
}
