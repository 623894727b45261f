package com.eventsourcing.core.aggregate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Left fold of an event sequence into aggregate state.
 */
public final class Aggregates {

    private Aggregates() {
    }

    /**
     * Fold events in order, starting from {@code initialState.get()}.
     * Null entries are skipped; every other entry is applied.
     *
     * @param events ordered events of one stream
     * @param evolver pure state transition
     * @param initialState supplier of the state before the first event
     * @return the state after the last event
     */
    public static <S, E> S fold(Iterable<? extends E> events, Evolver<S, E> evolver, Supplier<S> initialState) {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(evolver, "evolver");
        Objects.requireNonNull(initialState, "initialState");

        S state = initialState.get();
        for (E event : events) {
            if (event == null) {
                continue;
            }
            state = evolver.evolve(state, event);
        }
        return state;
    }
}
