package com.servicetemplate.common.config;

import com.google.gson.annotations.SerializedName;
import com.servicetemplate.common.util.Sensitive;

/**
 * Base configuration shared by every service.
 * Services needing more settings extend this class and read their keys from {@link #source()}.
 */
public class ServiceConfig {

    @SerializedName("VERSION")
    private final String version;

    @SerializedName("LOG_LEVEL")
    private final String logLevel;

    @SerializedName("SERVICE_NAME")
    private final String serviceName;

    @Sensitive
    @SerializedName("API_KEY")
    private final String apiKey;

    @SerializedName("SERVER_PORT")
    private final int port;

    @SerializedName("METRICS_PORT")
    private final int metricsPort;

    @SerializedName("HEARTBEAT_CRON")
    private final String heartbeatCron;

    @SerializedName("HEARTBEAT_DEBUG")
    private final boolean heartbeatDebug;

    @SerializedName("MQ")
    private final BrokerSettings broker;

    private final transient ConfigSource source;

    protected ServiceConfig(ConfigSource source) {
        this.source = source;
        this.version = source.get("version", "0.0.0");
        this.logLevel = source.get("log.level", "DEBUG");
        this.serviceName = source.get("service.name", "servicetemplate");
        this.apiKey = source.get("api.key", "");
        this.port = source.getInt("server.port", 8080);
        this.metricsPort = source.getInt("metrics.port", 9090);
        this.heartbeatCron = source.get("heartbeat.cron", "*/1 * * * *");
        this.heartbeatDebug = source.getBoolean("heartbeat.debug", false);
        this.broker = new BrokerSettings(source);
    }

    /**
     * Loads and validates the configuration from the default sources.
     */
    public static ServiceConfig load() {
        return from(ConfigSource.load());
    }

    public static ServiceConfig from(ConfigSource source) {
        ServiceConfig config = new ServiceConfig(source);
        config.validate();
        return config;
    }

    /**
     * Checks required settings. Subclasses calling this from their own factory should call super.
     */
    protected void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException("API_KEY is required");
        }
        broker.validate();
    }

    public String getVersion() {
        return version;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getApiKey() {
        return apiKey;
    }

    public int getPort() {
        return port;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public String getHeartbeatCron() {
        return heartbeatCron;
    }

    public boolean isHeartbeatDebug() {
        return heartbeatDebug;
    }

    public BrokerSettings getBroker() {
        return broker;
    }

    /** The source this configuration was read from, for service-specific keys. */
    public ConfigSource source() {
        return source;
    }
}
