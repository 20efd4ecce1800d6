package com.umitunal.taskq.serialization;

/**
 * Raised when a payload or record cannot be encoded or decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
