package com.servicetemplate.common.scheduler;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A running job and when it fires next ({@code yyyy-MM-dd HH:mm:ss}).
 */
public record JobInfo(
        @JsonProperty("name") String name,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("next_run") String nextRun) {
}
