package com.umitunal.taskq.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Producer and administration API of a persistent, priority-ordered job queue.
 *
 * @param <T> the type of job payload
 */
public interface JobQueue<T> extends AutoCloseable {

    /**
     * Add a job with default options.
     *
     * @return the id of the new job
     */
    default String add(String name, T data) throws StoreException {
        return add(name, data, JobOptions.defaults());
    }

    /**
     * Add a job for later execution. Returns as soon as the job is stored.
     *
     * @param name handler name
     * @param data job payload
     * @param options priority, retries and timing
     * @return the id of the job
     */
    String add(String name, T data, JobOptions options) throws StoreException;

    /**
     * Register the handler for jobs of the given name.
     */
    void process(String name, JobHandler<T> handler);

    /**
     * Begin polling for due jobs. Calling it while already running does nothing.
     */
    void start() throws StoreException;

    /**
     * Stop polling. Handlers already executing are allowed to finish.
     */
    void stop();

    boolean isRunning();

    Optional<Job<T>> getJob(String id) throws StoreException;

    List<Job<T>> listJobs(JobFilter filter) throws StoreException;

    QueueStats getStats() throws StoreException;

    /**
     * Remove a job record. Does not cancel an execution in progress.
     */
    void delete(String id) throws StoreException;

    /**
     * Delete terminal jobs completed before the cutoff.
     *
     * @return number of jobs deleted
     */
    long cleanup(Instant olderThan) throws StoreException;

    @Override
    void close();
}
