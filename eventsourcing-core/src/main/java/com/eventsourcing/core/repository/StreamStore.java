package com.eventsourcing.core.repository;

import com.eventsourcing.core.aggregate.Evolver;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.model.VersionedState;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Append-only, per-stream event log with optimistic-concurrency guarded appends.
 *
 * A stream that was never appended to reads as empty: {@link #readStream}
 * returns an empty list and {@link #aggregateStream} returns
 * {@link Optional#empty()}. Stored entries whose payload is missing or
 * unreadable are skipped on read.
 *
 * @param <E> event type stored in this store
 */
public interface StreamStore<E> {

    /**
     * Read all events of a stream in append order.
     *
     * @param streamId The stream id
     * @return Events ordered by revision, empty if the stream does not exist
     */
    List<E> readStream(String streamId);

    /**
     * Read all events of a stream with their stored metadata.
     *
     * @param streamId The stream id
     * @return Recorded events ordered by revision, empty if the stream does not exist
     */
    List<RecordedEvent<E>> readRecordedEvents(String streamId);

    /**
     * Append events as one atomic batch after checking the expected revision.
     * A mismatch writes nothing.
     *
     * @param streamId The stream id
     * @param events Events to append, in order
     * @param expectedRevision Precondition on the current revision
     * @return The new revision (previous revision + number of appended events)
     * @throws com.eventsourcing.core.exception.WrongExpectedRevisionException if the precondition fails
     */
    long appendToStream(String streamId, List<? extends E> events, ExpectedRevision expectedRevision);

    /**
     * Append events unconditionally.
     */
    default long appendToStream(String streamId, List<? extends E> events) {
        return appendToStream(streamId, events, ExpectedRevision.any());
    }

    /**
     * Current revision of a stream.
     *
     * @param streamId The stream id
     * @return Number of stored events, 0 if the stream does not exist
     */
    long streamRevision(String streamId);

    /**
     * Fold a stream into state together with the revision it was folded at.
     *
     * @param streamId The stream id
     * @param evolver Pure state transition
     * @param initialState Supplier of the state before the first event
     * @return The folded state, or empty if the stream does not exist
     */
    <S> Optional<VersionedState<S>> loadAggregate(String streamId, Evolver<S, E> evolver, Supplier<S> initialState);

    /**
     * Fold a stream into state.
     *
     * @return The folded state, or empty if the stream does not exist
     */
    default <S> Optional<S> aggregateStream(String streamId, Evolver<S, E> evolver, Supplier<S> initialState) {
        return loadAggregate(streamId, evolver, initialState).map(VersionedState::state);
    }
}
