package com.eventsourcing.core.aggregate;

import java.util.List;

/**
 * Validates a command against current state and produces the resulting events.
 *
 * Implementations must be pure. On an invariant violation they throw a
 * {@link com.eventsourcing.core.exception.BusinessRuleException} and emit
 * nothing. An empty result is allowed only where a command is documented
 * as a legitimate no-op.
 *
 * @param <C> command type
 * @param <S> aggregate state type
 * @param <E> event type
 */
@FunctionalInterface
public interface Decider<C, S, E> {

    /**
     * @param command the command to decide
     * @param state current state, or null when the aggregate does not exist
     * @return events to append as one batch
     */
    List<E> decide(C command, S state);
}
