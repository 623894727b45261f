package com.eventsourcing.core.model;

/**
 * Request to change the state of an aggregate, subject to validation.
 * Commands are never persisted.
 */
public interface DomainCommand {

    /**
     * Type discriminant, used for logging and metrics tags.
     */
    default String commandType() {
        return getClass().getSimpleName();
    }
}
