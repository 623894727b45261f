package com.eventsourcing.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as stored in a stream.
 *
 * Primary Key: (streamId, revision)
 *
 * Invariants:
 * - revision is 1-based and contiguous within a stream
 * - type equals data.eventType() at the time of the append
 */
public record RecordedEvent<E>(
    String streamId,
    long revision,
    UUID eventId,
    String type,
    E data,
    Instant recordedAt
) {
    public static <E extends DomainEvent> RecordedEvent<E> create(String streamId, long revision, E event, Instant recordedAt) {
        return new RecordedEvent<>(
            streamId,
            revision,
            UUID.randomUUID(),
            event.eventType(),
            event,
            recordedAt
        );
    }
}
