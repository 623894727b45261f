package com.eventsourcing.engine.handler;

import com.eventsourcing.core.aggregate.Decider;
import com.eventsourcing.core.aggregate.Evolver;
import com.eventsourcing.core.exception.BusinessRuleException;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.core.model.DomainCommand;
import com.eventsourcing.core.model.DomainEvent;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RetryPolicy;
import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.engine.logging.LoggingContext;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-decide-append cycle for one aggregate type.
 *
 * Each attempt folds the stream into (state, revision), asks the decider for events and
 * appends them expecting exactly that revision ({@code noStream()} for a new aggregate).
 * When another writer got there first the whole cycle is repeated on fresh state, bounded
 * by the {@link RetryPolicy}. Business rule violations are never retried.
 *
 * @param <C> command type
 * @param <S> aggregate state type
 * @param <E> event type
 */
public class CommandHandler<C extends DomainCommand, S, E extends DomainEvent> {

    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    private final StreamStore<E> store;
    private final Evolver<S, E> evolver;
    private final Supplier<S> initialState;
    private final Decider<C, S, E> decider;
    private final RetryPolicy retryPolicy;
    private final EventStoreMetrics metrics;

    public CommandHandler(StreamStore<E> store,
                          Evolver<S, E> evolver,
                          Supplier<S> initialState,
                          Decider<C, S, E> decider,
                          RetryPolicy retryPolicy,
                          EventStoreMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.evolver = Objects.requireNonNull(evolver, "evolver");
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.decider = Objects.requireNonNull(decider, "decider");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Handle a command against the latest state, retrying on concurrent modification.
     *
     * @throws BusinessRuleException if the command is rejected by the decider
     * @throws WrongExpectedRevisionException if conflicts persist past the retry budget
     */
    public CommandResult<E> handle(String streamId, C command) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(command, "command");

        metrics.commandStarted();
        try {
            for (int attempt = 1; ; attempt++) {
                try (LoggingContext ctx = LoggingContext.forCommand(streamId, command.commandType(), attempt)) {
                    try {
                        return execute(streamId, command, null);
                    } catch (WrongExpectedRevisionException e) {
                        if (!retryPolicy.shouldRetry(e) || !retryPolicy.hasMoreAttempts(attempt)) {
                            metrics.commandConflicted(command.commandType());
                            log.warn("Giving up on {} after {} attempts: {}",
                                command.commandType(), attempt, e.getMessage());
                            throw e;
                        }
                        Duration backoff = retryPolicy.computeBackoff(attempt);
                        metrics.commandRetried(command.commandType(), attempt);
                        log.warn("Concurrent modification of {} (actual revision={}), retrying in {}ms",
                            streamId, e.getActualRevision(), backoff.toMillis());
                        pause(backoff, e);
                    }
                }
            }
        } finally {
            metrics.commandFinished();
        }
    }

    /**
     * Handle a command only if the stream is still at the caller's expected revision.
     * A single attempt: a conflict surfaces to the caller, who decides what to do.
     *
     * @throws BusinessRuleException if the command is rejected by the decider
     * @throws WrongExpectedRevisionException if the stream moved past the expected revision
     */
    public CommandResult<E> handle(String streamId, C command, ExpectedRevision expectedRevision) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(expectedRevision, "expectedRevision");

        metrics.commandStarted();
        try (LoggingContext ctx = LoggingContext.forCommand(streamId, command.commandType(), 1)) {
            return execute(streamId, command, expectedRevision);
        } catch (WrongExpectedRevisionException e) {
            metrics.commandConflicted(command.commandType());
            throw e;
        } finally {
            metrics.commandFinished();
        }
    }

    /**
     * Current state of an aggregate with the revision it was read at.
     */
    public Optional<VersionedState<S>> load(String streamId) {
        try (LoggingContext ctx = LoggingContext.forStream(streamId)) {
            return store.loadAggregate(streamId, evolver, initialState);
        }
    }

    private CommandResult<E> execute(String streamId, C command, ExpectedRevision expectedOverride) {
        Optional<VersionedState<S>> loaded = store.loadAggregate(streamId, evolver, initialState);
        long currentRevision = loaded.map(VersionedState::revision).orElse(0L);
        if (expectedOverride != null && !expectedOverride.matches(currentRevision)) {
            // checked before deciding
            throw new WrongExpectedRevisionException(streamId, expectedOverride, currentRevision);
        }
        S state = loaded.map(VersionedState::state).orElse(null);
        ExpectedRevision expected = expectedOverride != null
            ? expectedOverride
            : loaded.map(VersionedState::expectedRevision).orElse(ExpectedRevision.noStream());

        List<E> events;
        try {
            events = decider.decide(command, state);
        } catch (BusinessRuleException e) {
            metrics.commandRejected(command.commandType(), e.getErrorCode());
            log.debug("Rejected {}: {}", command.commandType(), e.getErrorCode());
            throw e;
        }
        if (events == null) {
            events = List.of();
        }

        long nextRevision = store.appendToStream(streamId, events, expected);
        metrics.commandSucceeded(command.commandType());
        log.debug("Handled {} with {} events (revision={})", command.commandType(), events.size(), nextRevision);
        return new CommandResult<>(streamId, events, nextRevision);
    }

    private void pause(Duration backoff, WrongExpectedRevisionException cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off, abandoning retries");
            throw cause;
        }
    }
}
