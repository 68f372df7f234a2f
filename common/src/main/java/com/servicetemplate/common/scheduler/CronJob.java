package com.servicetemplate.common.scheduler;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named task run on a cron schedule.
 * Accepts five-field (minute resolution) or six-field (with seconds) expressions.
 */
public class CronJob {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("cron_expr")
    private final String cronExpression;

    @JsonIgnore
    private final Runnable task;

    @JsonProperty("tags")
    private final List<String> tags;

    public CronJob(String name, String cronExpression, Runnable task, List<String> tags) {
        this.name = Objects.requireNonNull(name, "name");
        this.cronExpression = Objects.requireNonNull(cronExpression, "cronExpression");
        this.task = Objects.requireNonNull(task, "task");
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public String getName() {
        return name;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public Runnable getTask() {
        return task;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "CronJob{name='" + name + "', cronExpression='" + cronExpression + "', tags=" + tags + '}';
    }
}
