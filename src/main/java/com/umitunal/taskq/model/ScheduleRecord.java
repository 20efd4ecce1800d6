package com.umitunal.taskq.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored form of a persistent schedule. The handler itself is not stored; it is rebuilt on load
 * from {@code jobName} and {@code jobData}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScheduleRecord {
    private final String name;
    private final String cron;
    private final String zone;
    private final boolean enabled;
    private final Long nextRun;
    private final Long lastRun;
    private final long runCount;
    private final String jobName;
    private final Map<String, Object> jobData;

    @JsonCreator
    public ScheduleRecord(@JsonProperty("name") String name,
                          @JsonProperty("cron") String cron,
                          @JsonProperty("zone") String zone,
                          @JsonProperty("enabled") boolean enabled,
                          @JsonProperty("nextRun") Long nextRun,
                          @JsonProperty("lastRun") Long lastRun,
                          @JsonProperty("runCount") long runCount,
                          @JsonProperty("jobName") String jobName,
                          @JsonProperty("jobData") Map<String, Object> jobData) {
        this.name = name;
        this.cron = cron;
        this.zone = zone;
        this.enabled = enabled;
        this.nextRun = nextRun;
        this.lastRun = lastRun;
        this.runCount = runCount;
        this.jobName = jobName;
        this.jobData = jobData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(jobData))
                : Collections.emptyMap();
    }

    @JsonProperty("name")
    public String getName() { return name; }

    @JsonProperty("cron")
    public String getCron() { return cron; }

    @JsonProperty("zone")
    public String getZone() { return zone; }

    @JsonProperty("enabled")
    public boolean isEnabled() { return enabled; }

    /**
     * Epoch millis, or null when not yet computed.
     */
    @JsonProperty("nextRun")
    public Long getNextRun() { return nextRun; }

    @JsonProperty("lastRun")
    public Long getLastRun() { return lastRun; }

    @JsonProperty("runCount")
    public long getRunCount() { return runCount; }

    @JsonProperty("jobName")
    public String getJobName() { return jobName; }

    @JsonProperty("jobData")
    public Map<String, Object> getJobData() { return jobData; }

    @Override
    public String toString() {
        return String.format("ScheduleRecord{name='%s', cron='%s', zone=%s, enabled=%s, runCount=%d, jobName='%s'}",
                name, cron, zone, enabled, runCount, jobName);
    }
}
