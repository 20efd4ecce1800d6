package com.umitunal.taskq.model;

import com.umitunal.taskq.core.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobLifecycleTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final RetryBackoff BACKOFF = RetryBackoff.exponential(Duration.ofSeconds(1), Duration.ofMinutes(1));

    private static JobRecord<String> pending(int maxRetries) {
        return JobRecord.pending("job-1", "send-email", "payload", 5, maxRetries, T0, T0);
    }

    @Test
    @DisplayName("Should move a pending job to running and count the attempt")
    void testStart() {
        // Given
        JobRecord<String> job = pending(3);

        // When
        JobRecord<String> running = JobLifecycle.start(job, T0.plusSeconds(1));

        // Then
        assertThat(running.getStatus()).isEqualTo(Job.Status.RUNNING);
        assertThat(running.getAttempts()).isEqualTo(1);
        assertThat(running.getStartedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(running.getVersion()).isEqualTo(job.getVersion() + 1);
        assertThat(job.getStatus()).isEqualTo(Job.Status.PENDING);
    }

    @Test
    @DisplayName("Should complete a running job")
    void testComplete() {
        JobRecord<String> running = JobLifecycle.start(pending(3), T0);

        JobRecord<String> done = JobLifecycle.finish(running, Outcome.success(), T0.plusSeconds(2), BACKOFF);

        assertThat(done.getStatus()).isEqualTo(Job.Status.COMPLETED);
        assertThat(done.getCompletedAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(done.getLastError()).isNull();
        assertThat(done.getStatus().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Should put a failed job back to pending with a backed-off run time")
    void testFailWithRetriesLeft() {
        // Given
        JobRecord<String> running = JobLifecycle.start(pending(3), T0);

        // When
        JobRecord<String> retried = JobLifecycle.fail(running, "Connection timeout", T0, BACKOFF);

        // Then
        assertThat(retried.getStatus()).isEqualTo(Job.Status.PENDING);
        assertThat(retried.getLastError()).isEqualTo("Connection timeout");
        assertThat(retried.getRunAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(retried.getCompletedAt()).isNull();
        assertThat(retried.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("A job with maxRetries N fails terminally on attempt N + 1")
    void testRetriesExhausted() {
        // Given
        int maxRetries = 3;
        JobRecord<String> job = pending(maxRetries);
        Instant now = T0;

        // When
        int attempts = 0;
        while (job.getStatus() == Job.Status.PENDING) {
            job = JobLifecycle.fail(JobLifecycle.start(job, now), "boom", now, BACKOFF);
            attempts++;
            now = job.getRunAt();
        }

        // Then
        assertThat(attempts).isEqualTo(maxRetries + 1);
        assertThat(job.getAttempts()).isEqualTo(maxRetries + 1);
        assertThat(job.getStatus()).isEqualTo(Job.Status.FAILED);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(job.getLastError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("A job without retries fails on its first failure")
    void testNoRetries() {
        JobRecord<String> running = JobLifecycle.start(pending(0), T0);

        JobRecord<String> failed = JobLifecycle.finish(running, Outcome.failure("bad input"), T0, BACKOFF);

        assertThat(failed.getStatus()).isEqualTo(Job.Status.FAILED);
    }

    @Test
    @DisplayName("Should reject transitions from the wrong status")
    void testIllegalTransitions() {
        JobRecord<String> job = pending(3);
        JobRecord<String> running = JobLifecycle.start(job, T0);
        JobRecord<String> done = JobLifecycle.complete(running, T0);

        assertThatThrownBy(() -> JobLifecycle.start(running, T0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> JobLifecycle.complete(job, T0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> JobLifecycle.fail(done, "late", T0, BACKOFF)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> JobLifecycle.start(done, T0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Exponential backoff doubles per attempt, never decreases and stops at the cap")
    void testExponentialBackoff() {
        assertThat(BACKOFF.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(BACKOFF.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(BACKOFF.delayFor(5)).isEqualTo(Duration.ofSeconds(32));
        assertThat(BACKOFF.delayFor(6)).isEqualTo(Duration.ofMinutes(1));
        assertThat(BACKOFF.delayFor(100)).isEqualTo(Duration.ofMinutes(1));

        Duration previous = Duration.ZERO;
        for (int attempts = 1; attempts < 70; attempts++) {
            Duration delay = BACKOFF.delayFor(attempts);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            previous = delay;
        }
    }

    @Test
    @DisplayName("Fixed backoff returns the same delay for every attempt")
    void testFixedBackoff() {
        RetryBackoff fixed = RetryBackoff.fixed(Duration.ofMillis(250));

        assertThat(fixed.delayFor(1)).isEqualTo(fixed.delayFor(9)).isEqualTo(Duration.ofMillis(250));
        assertThatThrownBy(() -> RetryBackoff.fixed(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Failure outcome falls back to the exception class name")
    void testOutcomeMessage() {
        assertThat(Outcome.failure(new IllegalStateException("nope")).getMessage()).isEqualTo("nope");
        assertThat(Outcome.failure(new NullPointerException()).getMessage()).isEqualTo("java.lang.NullPointerException");
        assertThat(Outcome.success().isSuccess()).isTrue();
    }
}
