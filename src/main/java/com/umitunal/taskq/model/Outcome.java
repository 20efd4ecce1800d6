package com.umitunal.taskq.model;

/**
 * Result of one handler invocation.
 */
public final class Outcome {
    private static final Outcome SUCCESS = new Outcome(true, null);

    private final boolean success;
    private final String message;

    private Outcome(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }

    public static Outcome success() {
        return SUCCESS;
    }

    public static Outcome failure(String message) {
        return new Outcome(false, message != null ? message : "unknown error");
    }

    /**
     * Failure described by an exception, falling back to its class name when it has no message.
     */
    public static Outcome failure(Throwable error) {
        String message = error.getMessage();
        return failure(message != null && !message.isBlank() ? message : error.getClass().getName());
    }

    @Override
    public String toString() {
        return success ? "Outcome{success}" : "Outcome{failure='" + message + "'}";
    }
}
