package com.umitunal.taskq.model;

import com.umitunal.taskq.core.Job.Status;

import java.time.Instant;

/**
 * State transitions of a job as pure functions.
 *
 * <pre>
 * PENDING --start--&gt; RUNNING --success--&gt; COMPLETED
 *                            --failure--&gt; PENDING (attempts &lt;= maxRetries, runAt pushed back)
 *                            --failure--&gt; FAILED  (retries exhausted)
 * </pre>
 */
public final class JobLifecycle {

    private JobLifecycle() {
    }

    /**
     * Claim a pending job for execution.
     */
    public static <T> JobRecord<T> start(JobRecord<T> job, Instant now) {
        requireStatus(job, Status.PENDING);
        return job.toBuilder()
                .status(Status.RUNNING)
                .attempts(job.getAttempts() + 1)
                .startedAt(now)
                .updatedAt(now)
                .version(job.getVersion() + 1)
                .build();
    }

    /**
     * Apply the outcome of a running job's attempt.
     */
    public static <T> JobRecord<T> finish(JobRecord<T> job, Outcome outcome, Instant now, RetryBackoff backoff) {
        return outcome.isSuccess() ? complete(job, now) : fail(job, outcome.getMessage(), now, backoff);
    }

    public static <T> JobRecord<T> complete(JobRecord<T> job, Instant now) {
        requireStatus(job, Status.RUNNING);
        return job.toBuilder()
                .status(Status.COMPLETED)
                .completedAt(now)
                .updatedAt(now)
                .version(job.getVersion() + 1)
                .build();
    }

    /**
     * Record a failure. The job goes back to pending with a backed-off run time while it has
     * retries left, otherwise it fails terminally.
     */
    public static <T> JobRecord<T> fail(JobRecord<T> job, String error, Instant now, RetryBackoff backoff) {
        requireStatus(job, Status.RUNNING);
        JobRecord.Builder<T> next = job.toBuilder()
                .lastError(error)
                .updatedAt(now)
                .version(job.getVersion() + 1);

        if (job.canRetry()) {
            return next.status(Status.PENDING)
                    .runAt(now.plus(backoff.delayFor(job.getAttempts())))
                    .build();
        }
        return next.status(Status.FAILED)
                .completedAt(now)
                .build();
    }

    private static void requireStatus(JobRecord<?> job, Status expected) {
        if (job.getStatus() != expected) {
            throw new IllegalStateException(
                    "Job " + job.getId() + " is " + job.getStatus() + ", expected " + expected);
        }
    }
}
