package com.umitunal.taskq.scheduler;

import com.umitunal.taskq.core.JobQueue;

import java.util.Map;

/**
 * Rebuilds the handler of a persistent schedule from its stored job name and data.
 */
@FunctionalInterface
public interface ScheduleHandlerFactory {

    ScheduleHandler create(String jobName, Map<String, Object> jobData);

    /**
     * Handlers that add a job named {@code jobName} carrying {@code jobData} to the queue.
     */
    static ScheduleHandlerFactory enqueueing(JobQueue<Map<String, Object>> queue) {
        return (jobName, jobData) -> () -> queue.add(jobName, jobData);
    }
}
