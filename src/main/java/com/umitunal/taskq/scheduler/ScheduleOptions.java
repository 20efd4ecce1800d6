package com.umitunal.taskq.scheduler;

import java.time.ZoneId;

/**
 * Options accepted when registering a schedule.
 */
public final class ScheduleOptions {
    private static final ScheduleOptions DEFAULTS = newBuilder().build();

    private final boolean enabled;
    private final ZoneId zone;

    private ScheduleOptions(Builder builder) {
        this.enabled = builder.enabled;
        this.zone = builder.zone;
    }

    public static ScheduleOptions defaults() {
        return DEFAULTS;
    }

    public boolean isEnabled() { return enabled; }

    /**
     * Zone the cron expression is evaluated in, or null for the scheduler's default zone.
     */
    public ZoneId getZone() { return zone; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private ZoneId zone;

        private Builder() {
        }

        /**
         * Default: true
         */
        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            if (zone == null) {
                throw new IllegalArgumentException("zone must not be null");
            }
            this.zone = zone;
            return this;
        }

        public ScheduleOptions build() {
            return new ScheduleOptions(this);
        }
    }
}
