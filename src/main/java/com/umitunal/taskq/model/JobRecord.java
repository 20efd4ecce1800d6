package com.umitunal.taskq.model;

import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.serialization.PayloadCodec;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a job as stored. State changes produce new instances through
 * {@link JobLifecycle} or {@link #toBuilder()}.
 *
 * @param <T> the type of the job payload
 */
public final class JobRecord<T> implements Job<T> {
    private final String id;
    private final String name;
    private final T data;
    private final Status status;
    private final int priority;
    private final int maxRetries;
    private final int attempts;
    private final Instant runAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String lastError;
    private final long version;

    private JobRecord(Builder<T> builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = Objects.requireNonNull(builder.name, "name");
        this.data = builder.data;
        this.status = Objects.requireNonNull(builder.status, "status");
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.attempts = builder.attempts;
        this.runAt = Objects.requireNonNull(builder.runAt, "runAt");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.lastError = builder.lastError;
        this.version = builder.version;
    }

    /**
     * A new pending job that has never been attempted.
     */
    public static <T> JobRecord<T> pending(String id, String name, T data, int priority, int maxRetries,
                                           Instant runAt, Instant createdAt) {
        return JobRecord.<T>newBuilder(id, name)
                .data(data)
                .status(Status.PENDING)
                .priority(priority)
                .maxRetries(maxRetries)
                .runAt(runAt)
                .createdAt(createdAt)
                .build();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public T getData() {
        return data;
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public Instant getRunAt() {
        return runAt;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public Instant getStartedAt() {
        return startedAt;
    }

    @Override
    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    /**
     * Incremented on every state change.
     */
    public long getVersion() {
        return version;
    }

    public JobRecord<T> withUpdatedAt(Instant updatedAt) {
        return toBuilder().updatedAt(updatedAt).build();
    }

    public Builder<T> toBuilder() {
        return new Builder<T>(id, name)
                .data(data)
                .status(status)
                .priority(priority)
                .maxRetries(maxRetries)
                .attempts(attempts)
                .runAt(runAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .lastError(lastError)
                .version(version);
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', name='%s', status=%s, priority=%d, attempt=%d/%d, runAt=%s}",
                id, name, status, priority, attempts, maxRetries + 1, runAt);
    }

    /**
     * Serialize to bytes for storage.
     * Delegates to JobRecordSerializer for the binary layout.
     */
    public byte[] serialize(PayloadCodec<T> codec) {
        return new JobRecordSerializer<>(codec).serialize(this);
    }

    public static <T> JobRecord<T> deserialize(byte[] bytes, PayloadCodec<T> codec) {
        return new JobRecordSerializer<>(codec).deserialize(bytes);
    }

    public static <T> Builder<T> newBuilder(String id, String name) {
        return new Builder<>(id, name);
    }

    public static class Builder<T> {
        private final String id;
        private final String name;
        private T data;
        private Status status = Status.PENDING;
        private int priority;
        private int maxRetries;
        private int attempts;
        private Instant runAt;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private String lastError;
        private long version;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder<T> data(T data) { this.data = data; return this; }
        public Builder<T> status(Status status) { this.status = status; return this; }
        public Builder<T> priority(int priority) { this.priority = priority; return this; }
        public Builder<T> maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder<T> attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder<T> runAt(Instant runAt) { this.runAt = runAt; return this; }
        public Builder<T> createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder<T> updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder<T> startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder<T> completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder<T> lastError(String lastError) { this.lastError = lastError; return this; }
        public Builder<T> version(long version) { this.version = version; return this; }

        public JobRecord<T> build() {
            return new JobRecord<>(this);
        }
    }
}
