package com.umitunal.taskq.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-job options accepted by {@link JobQueue#add(String, Object, JobOptions)}.
 * Unset priority and retry values fall back to the queue's configured defaults.
 */
public final class JobOptions {
    private static final JobOptions DEFAULTS = newBuilder().build();

    private final Integer priority;
    private final Integer maxRetries;
    private final Duration delay;
    private final Instant runAt;
    private final String jobId;

    private JobOptions(Builder builder) {
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.delay = builder.delay;
        this.runAt = builder.runAt;
        this.jobId = builder.jobId;
    }

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public Integer getPriority() { return priority; }
    public Integer getMaxRetries() { return maxRetries; }
    public Duration getDelay() { return delay; }
    public Instant getRunAt() { return runAt; }
    public String getJobId() { return jobId; }

    /**
     * Resolve the first dispatch time for a job created at {@code now}.
     */
    public Instant resolveRunAt(Instant now) {
        if (runAt != null) {
            return runAt;
        }
        return delay != null ? now.plus(delay) : now;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Integer priority;
        private Integer maxRetries;
        private Duration delay;
        private Instant runAt;
        private String jobId;

        private Builder() {
        }

        /**
         * Higher values are dispatched first. Must not be negative.
         */
        public Builder withPriority(int priority) {
            if (priority < 0) {
                throw new IllegalArgumentException("priority must not be negative: " + priority);
            }
            this.priority = priority;
            return this;
        }

        /**
         * Number of retries after the first failed attempt. Must not be negative.
         */
        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder withDelay(Duration delay) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative: " + delay);
            }
            this.delay = delay;
            return this;
        }

        public Builder withDelayMillis(long delayMillis) {
            return withDelay(Duration.ofMillis(delayMillis));
        }

        /**
         * Absolute time before which the job is not dispatched.
         */
        public Builder withRunAt(Instant runAt) {
            if (runAt == null) {
                throw new IllegalArgumentException("runAt must not be null");
            }
            this.runAt = runAt;
            return this;
        }

        /**
         * Caller-chosen id. Adding a job whose id already exists does not create a duplicate.
         */
        public Builder withJobId(String jobId) {
            if (jobId == null || jobId.isBlank()) {
                throw new IllegalArgumentException("jobId must not be blank");
            }
            this.jobId = jobId;
            return this;
        }

        public JobOptions build() {
            if (delay != null && runAt != null) {
                throw new IllegalArgumentException("delay and runAt are mutually exclusive");
            }
            return new JobOptions(this);
        }
    }
}
