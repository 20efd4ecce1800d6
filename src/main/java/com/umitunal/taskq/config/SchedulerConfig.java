package com.umitunal.taskq.config;

import com.umitunal.taskq.core.RegistrationPolicy;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Tuning of the cron scheduler.
 */
public class SchedulerConfig {
    public static final Duration MIN_CHECK_INTERVAL = Duration.ofMillis(100);

    private final Duration checkInterval;
    private final ZoneId defaultZone;
    private final RegistrationPolicy scheduleRegistration;
    private final Duration shutdownTimeout;

    private SchedulerConfig(Builder builder) {
        this.checkInterval = builder.checkInterval;
        this.defaultZone = builder.defaultZone;
        this.scheduleRegistration = builder.scheduleRegistration;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public Duration getCheckInterval() { return checkInterval; }
    public ZoneId getDefaultZone() { return defaultZone; }
    public RegistrationPolicy getScheduleRegistration() { return scheduleRegistration; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Duration checkInterval = Duration.ofSeconds(1);
        private ZoneId defaultZone = ZoneOffset.UTC;
        private RegistrationPolicy scheduleRegistration = RegistrationPolicy.REPLACE;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Delay between checks for due schedules.
         * Default: 1 second, minimum 100 ms
         */
        public Builder withCheckInterval(Duration interval) {
            this.checkInterval = interval;
            return this;
        }

        /**
         * Zone used for schedules that do not name one.
         * Default: UTC
         */
        public Builder withDefaultZone(ZoneId zone) {
            this.defaultZone = zone;
            return this;
        }

        /**
         * Default: REPLACE
         */
        public Builder withScheduleRegistration(RegistrationPolicy policy) {
            this.scheduleRegistration = policy;
            return this;
        }

        /**
         * How long stop() waits for the handler of the current check to return.
         * Default: 30 seconds
         */
        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public SchedulerConfig build() {
            if (checkInterval == null || checkInterval.compareTo(MIN_CHECK_INTERVAL) < 0) {
                throw new IllegalArgumentException("checkInterval must be at least 100ms: " + checkInterval);
            }
            if (defaultZone == null) {
                throw new IllegalArgumentException("defaultZone must not be null");
            }
            if (scheduleRegistration == null) {
                throw new IllegalArgumentException("scheduleRegistration must not be null");
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must not be negative: " + shutdownTimeout);
            }
            return new SchedulerConfig(this);
        }
    }
}
