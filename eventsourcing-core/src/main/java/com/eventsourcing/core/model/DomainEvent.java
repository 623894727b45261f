package com.eventsourcing.core.model;

/**
 * Immutable record of something that already happened to an aggregate.
 *
 * Event families are modelled as a sealed interface extending this one,
 * with one record per variant. The record's simple name is the type
 * discriminant written to the store; the record itself is the payload.
 *
 * Invariants:
 * - Events are never mutated after creation
 * - Type names are unique within an event family
 */
public interface DomainEvent {

    /**
     * Type discriminant persisted alongside the payload.
     */
    default String eventType() {
        return getClass().getSimpleName();
    }
}
