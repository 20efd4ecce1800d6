package com.umitunal.taskq.scheduler;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Point-in-time view of a registered schedule.
 */
public final class Schedule {
    private final String name;
    private final String cron;
    private final ZoneId zone;
    private final boolean enabled;
    private final Instant nextRun;
    private final Instant lastRun;
    private final long runCount;
    private final String lastError;
    private final String jobName;

    Schedule(String name, String cron, ZoneId zone, boolean enabled, Instant nextRun, Instant lastRun,
             long runCount, String lastError, String jobName) {
        this.name = name;
        this.cron = cron;
        this.zone = zone;
        this.enabled = enabled;
        this.nextRun = nextRun;
        this.lastRun = lastRun;
        this.runCount = runCount;
        this.lastError = lastError;
        this.jobName = jobName;
    }

    public String getName() { return name; }
    public String getCron() { return cron; }
    public ZoneId getZone() { return zone; }
    public boolean isEnabled() { return enabled; }
    public Instant getNextRun() { return nextRun; }

    /**
     * Start time of the most recent run, or null if it never ran.
     */
    public Instant getLastRun() { return lastRun; }

    public long getRunCount() { return runCount; }

    /**
     * Message of the most recent run if it failed, otherwise null.
     */
    public String getLastError() { return lastError; }

    /**
     * Job name of a persistent schedule, null for a schedule that lives only in memory.
     */
    public String getJobName() { return jobName; }

    public boolean isPersistent() {
        return jobName != null;
    }

    @Override
    public String toString() {
        return String.format("Schedule{name='%s', cron='%s', zone=%s, enabled=%s, nextRun=%s, runCount=%d}",
                name, cron, zone, enabled, nextRun, runCount);
    }
}
