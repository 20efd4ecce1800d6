package com.umitunal.taskq.core;

/**
 * Work function registered for a job name.
 *
 * @param <T> the type of job payload
 */
@FunctionalInterface
public interface JobHandler<T> {

    /**
     * Process a job. Returning normally marks the attempt successful.
     *
     * @param job the running job, carrying its payload
     * @throws Exception if processing fails; the message is recorded as the job's last error
     */
    void handle(Job<T> job) throws Exception;
}
