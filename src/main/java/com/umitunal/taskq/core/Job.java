package com.umitunal.taskq.core;

import java.time.Instant;

/**
 * A unit of deferred work tracked by the queue.
 *
 * @param <T> the type of the job payload
 */
public interface Job<T> {

    /**
     * Gets the unique identifier assigned when the job was added.
     */
    String getId();

    /**
     * Gets the name used to look up the handler that processes this job.
     */
    String getName();

    /**
     * Gets the job payload data.
     */
    T getData();

    /**
     * Gets the current lifecycle status.
     */
    Status getStatus();

    /**
     * Gets the dispatch priority. Higher values are dispatched first.
     */
    int getPriority();

    /**
     * Gets the number of additional attempts allowed after the first failure.
     */
    int getMaxRetries();

    /**
     * Gets the number of execution attempts started so far.
     */
    int getAttempts();

    /**
     * Gets the time before which the job must not be dispatched.
     */
    Instant getRunAt();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    /**
     * Gets the time the current or last attempt started, or null if never started.
     */
    Instant getStartedAt();

    /**
     * Gets the time the job reached a terminal status, or null while it is still live.
     */
    Instant getCompletedAt();

    /**
     * Gets the message of the most recent failure, or null if the job never failed.
     */
    String getLastError();

    /**
     * Checks if this job is pending and its run time has been reached.
     */
    default boolean isDue(Instant now) {
        return getStatus() == Status.PENDING && !getRunAt().isAfter(now);
    }

    /**
     * Checks if a failure of the current attempt would be retried.
     */
    default boolean canRetry() {
        return getAttempts() <= getMaxRetries();
    }

    /**
     * Lifecycle status of a job.
     */
    enum Status {
        PENDING,     // Waiting for its run time or a free dispatch slot
        RUNNING,     // Claimed and handed to a handler
        COMPLETED,   // Handler succeeded
        FAILED;      // Retries exhausted

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
