package com.umitunal.taskq.core;

/**
 * Criteria for {@link JobQueue#listJobs(JobFilter)}.
 */
public final class JobFilter {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    private final Job.Status status;
    private final String name;
    private final int limit;
    private final int offset;

    private JobFilter(Builder builder) {
        this.status = builder.status;
        this.name = builder.name;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static JobFilter all() {
        return newBuilder().build();
    }

    public static JobFilter byStatus(Job.Status status) {
        return newBuilder().withStatus(status).build();
    }

    public Job.Status getStatus() { return status; }
    public String getName() { return name; }
    public int getLimit() { return limit; }
    public int getOffset() { return offset; }

    public boolean matches(Job<?> job) {
        return (status == null || job.getStatus() == status)
                && (name == null || name.equals(job.getName()));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Job.Status status;
        private String name;
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;

        private Builder() {
        }

        public Builder withStatus(Job.Status status) {
            this.status = status;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withLimit(int limit) {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder withOffset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative: " + offset);
            }
            this.offset = offset;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(this);
        }
    }
}
