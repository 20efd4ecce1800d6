package com.umitunal.taskq.cron;

/**
 * A cron expression that cannot be parsed, or that never matches within the search horizon.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {

    public InvalidCronExpressionException(String message) {
        super(message);
    }
}
