package com.umitunal.taskq.scheduler;

/**
 * Work run each time a schedule fires.
 */
@FunctionalInterface
public interface ScheduleHandler {

    /**
     * @throws Exception to report a failed run; the schedule keeps firing
     */
    void run() throws Exception;
}
