package com.umitunal.taskq.scheduler;

public class ScheduleNotFoundException extends RuntimeException {

    public ScheduleNotFoundException(String name) {
        super("Schedule not found: " + name);
    }
}
