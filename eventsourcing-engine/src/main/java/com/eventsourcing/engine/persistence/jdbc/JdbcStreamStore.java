package com.eventsourcing.engine.persistence.jdbc;

import com.eventsourcing.core.aggregate.Evolver;
import com.eventsourcing.core.exception.EventSerializationException;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.core.model.DomainEvent;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import com.eventsourcing.engine.serialization.JacksonEventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed implementation of StreamStore.
 * Provides append-only streams with revision ordering and optimistic concurrency.
 *
 * Appends run in one transaction that first takes a transaction-scoped advisory lock on the
 * stream, then checks the current revision and inserts the batch. The primary key
 * (stream_id, revision) is the last line of defence: a duplicate key means another writer
 * got there first and is reported as a wrong expected revision.
 *
 * Rows whose payload is missing or cannot be read as a known event type are skipped on read
 * with a warning, but still count towards the stream revision.
 */
public class JdbcStreamStore<E extends DomainEvent> implements StreamStore<E> {

    private static final Logger log = LoggerFactory.getLogger(JdbcStreamStore.class);

    private static final String INSERT_SQL = """
        INSERT INTO stream_events (
            stream_id, revision, event_id, event_type, payload, recorded_at
        ) VALUES (?, ?, ?, ?, ?::jsonb, ?)
        """;

    private static final String SELECT_STREAM_SQL = """
        SELECT stream_id, revision, event_id, event_type, payload, recorded_at
        FROM stream_events
        WHERE stream_id = ?
        ORDER BY revision ASC
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JacksonEventSerializer<E> serializer;
    private final EventStoreMetrics metrics;
    private final Clock clock;
    private final RecordedEventRowMapper rowMapper;

    public JdbcStreamStore(JdbcTemplate jdbcTemplate,
                           TransactionTemplate transactionTemplate,
                           JacksonEventSerializer<E> serializer,
                           EventStoreMetrics metrics) {
        this(jdbcTemplate, transactionTemplate, serializer, metrics, Clock.systemUTC());
    }

    public JdbcStreamStore(JdbcTemplate jdbcTemplate,
                           TransactionTemplate transactionTemplate,
                           JacksonEventSerializer<E> serializer,
                           EventStoreMetrics metrics,
                           Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.rowMapper = new RecordedEventRowMapper();
    }

    @Override
    public List<E> readStream(String streamId) {
        List<E> events = new ArrayList<>();
        for (RecordedEvent<E> recorded : readRecordedEvents(streamId)) {
            events.add(recorded.data());
        }
        return events;
    }

    @Override
    public List<RecordedEvent<E>> readRecordedEvents(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        List<RecordedEvent<E>> rows = jdbcTemplate.query(SELECT_STREAM_SQL, rowMapper, streamId);
        List<RecordedEvent<E>> readable = new ArrayList<>(rows.size());
        for (RecordedEvent<E> row : rows) {
            if (row.data() != null) {
                readable.add(row);
            }
        }
        log.debug("Read {} events from {}", readable.size(), streamId);
        return readable;
    }

    @Override
    public long appendToStream(String streamId, List<? extends E> events, ExpectedRevision expectedRevision) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(expectedRevision, "expectedRevision");

        // serialize up front: a payload that cannot be written fails before any SQL runs
        List<PendingRow> pending = new ArrayList<>(events.size());
        for (E event : events) {
            Objects.requireNonNull(event, "events must not contain null");
            pending.add(new PendingRow(UUID.randomUUID(), serializer.typeOf(event), serializer.serialize(event)));
        }

        long start = System.nanoTime();
        Long newRevision;
        try {
            newRevision = transactionTemplate.execute(status -> {
                lockStream(streamId);

                long currentRevision = streamRevision(streamId);
                if (!expectedRevision.matches(currentRevision)) {
                    throw new WrongExpectedRevisionException(streamId, expectedRevision, currentRevision);
                }
                if (pending.isEmpty()) {
                    return currentRevision;
                }

                Timestamp recordedAt = Timestamp.from(clock.instant());
                long firstRevision = currentRevision + 1;
                jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        PendingRow row = pending.get(i);
                        ps.setString(1, streamId);
                        ps.setLong(2, firstRevision + i);
                        ps.setObject(3, row.eventId());
                        ps.setString(4, row.type());
                        ps.setString(5, row.payload());
                        ps.setTimestamp(6, recordedAt);
                    }

                    @Override
                    public int getBatchSize() {
                        return pending.size();
                    }
                });
                return currentRevision + pending.size();
            });
        } catch (WrongExpectedRevisionException e) {
            metrics.appendConflicted(streamId);
            log.debug("Rejected append to {}: expected {}, actual {}",
                streamId, e.getExpectedRevision(), e.getActualRevision());
            throw e;
        } catch (DuplicateKeyException e) {
            metrics.appendConflicted(streamId);
            long actual = streamRevision(streamId);
            log.debug("Concurrent append to {} detected by primary key (actual revision={})", streamId, actual);
            throw new WrongExpectedRevisionException(streamId, expectedRevision, actual);
        }

        long revision = newRevision != null ? newRevision : 0L;
        if (!pending.isEmpty()) {
            metrics.appendSucceeded(streamId, pending.size(), Duration.ofNanos(System.nanoTime() - start));
            log.debug("Appended {} events to {} (revision={})", pending.size(), streamId, revision);
        }
        return revision;
    }

    @Override
    public long streamRevision(String streamId) {
        Objects.requireNonNull(streamId, "streamId");
        String sql = """
            SELECT COALESCE(MAX(revision), 0)
            FROM stream_events
            WHERE stream_id = ?
            """;
        Long revision = jdbcTemplate.queryForObject(sql, Long.class, streamId);
        return revision != null ? revision : 0L;
    }

    @Override
    public <S> Optional<VersionedState<S>> loadAggregate(String streamId, Evolver<S, E> evolver, Supplier<S> initialState) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(evolver, "evolver");
        Objects.requireNonNull(initialState, "initialState");

        // fold row by row; state and revision come from the same result set
        FoldingCallback<S> fold = new FoldingCallback<>(evolver, initialState);
        jdbcTemplate.query(SELECT_STREAM_SQL, fold, streamId);
        return fold.result();
    }

    /**
     * Number of distinct streams in the store.
     */
    public long streamCount() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(DISTINCT stream_id) FROM stream_events", Long.class);
        return count != null ? count : 0L;
    }

    private void lockStream(String streamId) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))",
            (ResultSetExtractor<Void>) rs -> null, streamId);
    }

    private E deserializePayload(String streamId, long revision, String type, String json) {
        if (json == null || json.isBlank()) {
            log.warn("Skipping empty event at {}@{} (type={})", streamId, revision, type);
            return null;
        }
        if (!serializer.supports(type)) {
            log.warn("Skipping event of unknown type {} at {}@{}", type, streamId, revision);
            return null;
        }
        try {
            return serializer.deserialize(type, json);
        } catch (EventSerializationException e) {
            log.warn("Skipping unreadable event at {}@{}: {}", streamId, revision, e.getMessage());
            return null;
        }
    }

    private record PendingRow(UUID eventId, String type, String payload) {
    }

    private class RecordedEventRowMapper implements RowMapper<RecordedEvent<E>> {

        @Override
        public RecordedEvent<E> mapRow(ResultSet rs, int rowNum) throws SQLException {
            String streamId = rs.getString("stream_id");
            long revision = rs.getLong("revision");
            String type = rs.getString("event_type");

            return new RecordedEvent<>(
                streamId,
                revision,
                UUID.fromString(rs.getString("event_id")),
                type,
                deserializePayload(streamId, revision, type, rs.getString("payload")),
                rs.getTimestamp("recorded_at").toInstant()
            );
        }
    }

    private class FoldingCallback<S> implements RowCallbackHandler {

        private final Evolver<S, E> evolver;
        private final Supplier<S> initialState;
        private S state;
        private long revision;
        private boolean found;

        FoldingCallback(Evolver<S, E> evolver, Supplier<S> initialState) {
            this.evolver = evolver;
            this.initialState = initialState;
        }

        @Override
        public void processRow(ResultSet rs) throws SQLException {
            if (!found) {
                state = initialState.get();
                found = true;
            }
            String streamId = rs.getString("stream_id");
            revision = rs.getLong("revision");
            E event = deserializePayload(streamId, revision, rs.getString("event_type"), rs.getString("payload"));
            if (event != null) {
                state = evolver.evolve(state, event);
            }
        }

        Optional<VersionedState<S>> result() {
            return found ? Optional.of(new VersionedState<>(state, revision)) : Optional.empty();
        }
    }
}
