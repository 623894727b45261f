package com.eventsourcing.core.exception;

/**
 * Thrown by a decider when a command violates an invariant of the current state.
 * Terminal for that command: no events are emitted and the command is not retried.
 *
 * Domains subclass this with their own named error codes.
 */
public class BusinessRuleException extends EventSourcingException {

    public BusinessRuleException(String errorCode, String message) {
        super(errorCode, message);
    }
}
