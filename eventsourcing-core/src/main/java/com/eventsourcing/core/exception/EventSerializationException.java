package com.eventsourcing.core.exception;

/**
 * Thrown when an event cannot be converted to or from its stored form.
 */
public class EventSerializationException extends EventSourcingException {

    public static final String ERROR_CODE = "EVENT_SERIALIZATION_FAILED";

    public EventSerializationException(String message) {
        super(ERROR_CODE, message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
