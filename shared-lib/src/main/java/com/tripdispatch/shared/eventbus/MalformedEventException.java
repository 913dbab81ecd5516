package com.tripdispatch.shared.eventbus;

/**
 * An event that can never be handled (unparseable JSON, missing payload field).
 * Transports dead-letter it immediately instead of retrying.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
