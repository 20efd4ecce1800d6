package com.umitunal.taskq.core;

/**
 * Failure of the underlying key-value store. Never retried internally.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
