package com.eventsourcing.engine.persistence;

import com.eventsourcing.core.aggregate.Evolver;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.core.model.DomainEvent;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of StreamStore.
 * For demonstration and testing purposes.
 *
 * Each stream is an immutable list replaced wholesale on append. Appends to one stream
 * are linearised by {@link ConcurrentHashMap#compute}, so the revision check and the
 * write happen atomically; appends to different streams do not block each other.
 */
public class InMemoryStreamStore<E extends DomainEvent> implements StreamStore<E> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamStore.class);

    private final Map<String, List<RecordedEvent<E>>> streams = new ConcurrentHashMap<>();
    private final Clock clock;
    private final EventStoreMetrics metrics;

    public InMemoryStreamStore() {
        this(Clock.systemUTC(), new EventStoreMetrics());
    }

    public InMemoryStreamStore(Clock clock, EventStoreMetrics metrics) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public List<E> readStream(String streamId) {
        return readRecordedEvents(streamId).stream()
            .map(RecordedEvent::data)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    @Override
    public List<RecordedEvent<E>> readRecordedEvents(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        return streams.getOrDefault(streamId, List.of());
    }

    @Override
    public long appendToStream(String streamId, List<? extends E> events, ExpectedRevision expectedRevision) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(expectedRevision, "expectedRevision");
        for (E event : events) {
            Objects.requireNonNull(event, "events must not contain null");
        }

        long start = System.nanoTime();
        long[] newRevision = new long[1];
        try {
            streams.compute(streamId, (id, current) -> {
                List<RecordedEvent<E>> existing = current == null ? List.of() : current;
                long currentRevision = existing.size();

                if (!expectedRevision.matches(currentRevision)) {
                    throw new WrongExpectedRevisionException(id, expectedRevision, currentRevision);
                }
                if (events.isEmpty()) {
                    newRevision[0] = currentRevision;
                    return current;
                }

                Instant recordedAt = clock.instant();
                List<RecordedEvent<E>> next = new ArrayList<>(existing.size() + events.size());
                next.addAll(existing);
                long revision = currentRevision;
                for (E event : events) {
                    next.add(RecordedEvent.create(id, ++revision, event, recordedAt));
                }
                newRevision[0] = revision;
                return List.copyOf(next);
            });
        } catch (WrongExpectedRevisionException e) {
            metrics.appendConflicted(streamId);
            log.debug("Rejected append to {}: expected {}, actual {}",
                streamId, e.getExpectedRevision(), e.getActualRevision());
            throw e;
        }

        if (!events.isEmpty()) {
            metrics.appendSucceeded(streamId, events.size(), Duration.ofNanos(System.nanoTime() - start));
            log.debug("Appended {} events to {} (revision={})", events.size(), streamId, newRevision[0]);
        }
        return newRevision[0];
    }

    @Override
    public long streamRevision(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        return streams.getOrDefault(streamId, List.of()).size();
    }

    @Override
    public <S> Optional<VersionedState<S>> loadAggregate(String streamId, Evolver<S, E> evolver, Supplier<S> initialState) {
        Objects.requireNonNull(evolver, "evolver");
        Objects.requireNonNull(initialState, "initialState");

        // one snapshot of the list, so state and revision always agree
        List<RecordedEvent<E>> recorded = readRecordedEvents(streamId);
        if (recorded.isEmpty()) {
            return Optional.empty();
        }

        S state = initialState.get();
        for (RecordedEvent<E> event : recorded) {
            if (event.data() == null) {
                continue;
            }
            state = evolver.evolve(state, event.data());
        }
        return Optional.of(new VersionedState<>(state, recorded.size()));
    }

    /**
     * Number of streams holding at least one event.
     */
    public int streamCount() {
        return streams.size();
    }
}
