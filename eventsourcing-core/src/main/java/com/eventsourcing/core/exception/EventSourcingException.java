package com.eventsourcing.core.exception;

/**
 * Base exception for all event sourcing errors.
 * Carries a named error code that callers can interpret without parsing messages.
 */
public class EventSourcingException extends RuntimeException {

    private final String errorCode;

    public EventSourcingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EventSourcingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
