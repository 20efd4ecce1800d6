package com.umitunal.taskq.core;

/**
 * Job counts per status.
 */
public class QueueStats {
    private final long pending;
    private final long running;
    private final long completed;
    private final long failed;

    public QueueStats(long pending, long running, long completed, long failed) {
        this.pending = pending;
        this.running = running;
        this.completed = completed;
        this.failed = failed;
    }

    public long getPending() { return pending; }
    public long getRunning() { return running; }
    public long getCompleted() { return completed; }
    public long getFailed() { return failed; }

    public long getTotal() {
        return pending + running + completed + failed;
    }

    public long count(Job.Status status) {
        return switch (status) {
            case PENDING -> pending;
            case RUNNING -> running;
            case COMPLETED -> completed;
            case FAILED -> failed;
        };
    }

    @Override
    public String toString() {
        return String.format(
            "QueueStats{total=%d, pending=%d, running=%d, completed=%d, failed=%d}",
            getTotal(), pending, running, completed, failed
        );
    }
}
