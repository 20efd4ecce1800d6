package com.umitunal.taskq.scheduler;

/**
 * A manually triggered schedule whose handler failed. The run is still counted.
 */
public class ScheduleExecutionException extends Exception {
    private final String scheduleName;

    public ScheduleExecutionException(String scheduleName, Throwable cause) {
        super("Schedule " + scheduleName + " failed: " + cause.getMessage(), cause);
        this.scheduleName = scheduleName;
    }

    public String getScheduleName() {
        return scheduleName;
    }
}
