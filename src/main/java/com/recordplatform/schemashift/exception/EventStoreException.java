package com.recordplatform.schemashift.exception;

/**
 * The schema change event log could not be read or written. Without a durable log no
 * further progress is possible, so callers of a sweep see this propagate.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
