package com.eventsourcing.core.aggregate;

/**
 * Applies one event to a state, producing the next state.
 *
 * Implementations must be pure and total: no I/O, no mutation of the input
 * state, and every event variant handled. An unhandled variant is a
 * programming error and must fail fast with {@link IllegalArgumentException}.
 *
 * @param <S> aggregate state type
 * @param <E> event type
 */
@FunctionalInterface
public interface Evolver<S, E> {

    S evolve(S state, E event);
}
