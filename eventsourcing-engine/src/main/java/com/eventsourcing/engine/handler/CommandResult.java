package com.eventsourcing.engine.handler;

import java.util.List;

/**
 * Outcome of a handled command.
 *
 * @param streamId The stream the events were appended to
 * @param events Events produced by the decision, in append order; empty if nothing changed
 * @param nextExpectedRevision Stream revision after the append, usable as the next exact expectation
 */
public record CommandResult<E>(
    String streamId,
    List<E> events,
    long nextExpectedRevision
) {
    public CommandResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean changed() {
        return !events.isEmpty();
    }
}
