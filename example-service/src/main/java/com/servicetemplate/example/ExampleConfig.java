package com.servicetemplate.example;

import com.google.gson.annotations.SerializedName;
import com.servicetemplate.common.config.ConfigSource;
import com.servicetemplate.common.config.ServiceConfig;

/**
 * Service configuration with the example's own settings on top of the shared ones.
 */
public class ExampleConfig extends ServiceConfig {

    @SerializedName("TEST")
    private final String test;

    @SerializedName("AUDIT_QUEUE")
    private final String auditQueue;

    protected ExampleConfig(ConfigSource source) {
        super(source);
        this.test = source.get("test", "");
        this.auditQueue = source.get("audit.queue", "audit");
    }

    public static ExampleConfig load() {
        return from(ConfigSource.load());
    }

    public static ExampleConfig from(ConfigSource source) {
        ExampleConfig config = new ExampleConfig(source);
        config.validate();
        return config;
    }

    public String getTest() {
        return test;
    }

    public String getAuditQueue() {
        return auditQueue;
    }
}
