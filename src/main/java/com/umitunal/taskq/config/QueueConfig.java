package com.umitunal.taskq.config;

import com.umitunal.taskq.core.RegistrationPolicy;
import com.umitunal.taskq.model.RetryBackoff;

import java.time.Duration;

/**
 * Tuning of the job queue engine.
 */
public class QueueConfig {
    public static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(100);

    private final Duration pollInterval;
    private final int maxConcurrency;
    private final int defaultPriority;
    private final int defaultMaxRetries;
    private final RetryBackoff retryBackoff;
    private final Duration shutdownTimeout;
    private final Duration cleanupRetention;
    private final RegistrationPolicy handlerRegistration;

    private QueueConfig(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.maxConcurrency = builder.maxConcurrency;
        this.defaultPriority = builder.defaultPriority;
        this.defaultMaxRetries = builder.defaultMaxRetries;
        this.retryBackoff = builder.retryBackoff;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.cleanupRetention = builder.cleanupRetention;
        this.handlerRegistration = builder.handlerRegistration;
    }

    public static QueueConfig defaults() {
        return newBuilder().build();
    }

    public Duration getPollInterval() { return pollInterval; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public int getDefaultPriority() { return defaultPriority; }
    public int getDefaultMaxRetries() { return defaultMaxRetries; }
    public RetryBackoff getRetryBackoff() { return retryBackoff; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public Duration getCleanupRetention() { return cleanupRetention; }
    public RegistrationPolicy getHandlerRegistration() { return handlerRegistration; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Duration pollInterval = Duration.ofSeconds(1);
        private int maxConcurrency = 5;
        private int defaultPriority = 5;
        private int defaultMaxRetries = 3;
        private RetryBackoff retryBackoff = RetryBackoff.exponential(Duration.ofSeconds(1), Duration.ofMinutes(1));
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration cleanupRetention = Duration.ofDays(7);
        private RegistrationPolicy handlerRegistration = RegistrationPolicy.REPLACE;

        private Builder() {
        }

        /**
         * Delay between polling ticks.
         * Default: 1 second, minimum 100 ms
         */
        public Builder withPollInterval(Duration interval) {
            this.pollInterval = interval;
            return this;
        }

        /**
         * Maximum number of handlers running at once.
         * Default: 5
         */
        public Builder withMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * Default: 5
         */
        public Builder withDefaultPriority(int priority) {
            this.defaultPriority = priority;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withDefaultMaxRetries(int maxRetries) {
            this.defaultMaxRetries = maxRetries;
            return this;
        }

        /**
         * Default: exponential, 1 second doubled per attempt, capped at 1 minute
         */
        public Builder withRetryBackoff(RetryBackoff backoff) {
            this.retryBackoff = backoff;
            return this;
        }

        /**
         * How long stop() waits for in-flight handlers.
         * Default: 30 seconds
         */
        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        /**
         * Age of terminal jobs removed by cleanup() without an explicit cutoff.
         * Default: 7 days
         */
        public Builder withCleanupRetention(Duration retention) {
            this.cleanupRetention = retention;
            return this;
        }

        /**
         * Default: REPLACE
         */
        public Builder withHandlerRegistration(RegistrationPolicy policy) {
            this.handlerRegistration = policy;
            return this;
        }

        public QueueConfig build() {
            if (pollInterval == null || pollInterval.compareTo(MIN_POLL_INTERVAL) < 0) {
                throw new IllegalArgumentException("pollInterval must be at least 100ms: " + pollInterval);
            }
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1: " + maxConcurrency);
            }
            if (defaultPriority < 0) {
                throw new IllegalArgumentException("defaultPriority must not be negative: " + defaultPriority);
            }
            if (defaultMaxRetries < 0) {
                throw new IllegalArgumentException("defaultMaxRetries must not be negative: " + defaultMaxRetries);
            }
            if (retryBackoff == null) {
                throw new IllegalArgumentException("retryBackoff must not be null");
            }
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must not be negative: " + shutdownTimeout);
            }
            if (cleanupRetention == null || cleanupRetention.isNegative()) {
                throw new IllegalArgumentException("cleanupRetention must not be negative: " + cleanupRetention);
            }
            if (handlerRegistration == null) {
                throw new IllegalArgumentException("handlerRegistration must not be null");
            }
            return new QueueConfig(this);
        }
    }
}
