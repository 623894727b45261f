package com.eventsourcing.engine.persistence;

import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import com.eventsourcing.engine.test.Account;
import com.eventsourcing.engine.test.AccountEvent;
import com.eventsourcing.engine.test.AccountEvent.AccountOpened;
import com.eventsourcing.engine.test.AccountEvent.MoneyDeposited;
import com.eventsourcing.engine.test.AccountEvent.MoneyWithdrawn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("In-memory stream store")
class InMemoryStreamStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");

    private InMemoryStreamStore<AccountEvent> store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStreamStore<>(
            Clock.fixed(NOW, ZoneOffset.UTC), new EventStoreMetrics());
    }

    @Test
    @DisplayName("Reading a stream that was never written returns an empty list")
    void testReadMissingStream() {
        assertThat(store.readStream("account-missing")).isEmpty();
        assertThat(store.readRecordedEvents("account-missing")).isEmpty();
        assertThat(store.streamRevision("account-missing")).isZero();
    }

    @Test
    @DisplayName("Appended events are read back in order")
    void testAppendThenRead() {
        List<AccountEvent> events = List.of(
            new AccountOpened("a1", "alice"),
            new MoneyDeposited("a1", new BigDecimal("50")),
            new MoneyWithdrawn("a1", new BigDecimal("20"))
        );

        long revision = store.appendToStream("account-a1", events);

        assertThat(revision).isEqualTo(3);
        assertThat(store.readStream("account-a1")).containsExactlyElementsOf(events);
    }

    @Test
    @DisplayName("Recorded events carry contiguous 1-based revisions and their type")
    void testRecordedEventMetadata() {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")));
        store.appendToStream("account-a1", List.of(new MoneyDeposited("a1", BigDecimal.TEN)));

        List<RecordedEvent<AccountEvent>> recorded = store.readRecordedEvents("account-a1");

        assertThat(recorded).extracting(RecordedEvent::revision).containsExactly(1L, 2L);
        assertThat(recorded).extracting(RecordedEvent::type)
            .containsExactly("AccountOpened", "MoneyDeposited");
        assertThat(recorded).allSatisfy(e -> {
            assertThat(e.streamId()).isEqualTo("account-a1");
            assertThat(e.recordedAt()).isEqualTo(NOW);
            assertThat(e.eventId()).isNotNull();
        });
    }

    @Test
    @DisplayName("noStream succeeds only while the stream is empty")
    void testNoStreamExpectation() {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")), ExpectedRevision.noStream());

        assertThatThrownBy(() -> store.appendToStream(
                "account-a1", List.of(new AccountOpened("a1", "bob")), ExpectedRevision.noStream()))
            .isInstanceOf(WrongExpectedRevisionException.class)
            .satisfies(e -> {
                WrongExpectedRevisionException wer = (WrongExpectedRevisionException) e;
                assertThat(wer.getStreamId()).isEqualTo("account-a1");
                assertThat(wer.getExpectedRevision()).isEqualTo(ExpectedRevision.noStream());
                assertThat(wer.getActualRevision()).isEqualTo(1);
            });

        assertThat(store.readStream("account-a1")).containsExactly(new AccountOpened("a1", "alice"));
    }

    @Test
    @DisplayName("A stale exact revision is rejected and the stream is unchanged")
    void testStaleExactRevision() {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")));
        store.appendToStream("account-a1", List.of(new MoneyDeposited("a1", BigDecimal.ONE)), ExpectedRevision.exactly(1));

        assertThatThrownBy(() -> store.appendToStream(
                "account-a1", List.of(new MoneyDeposited("a1", BigDecimal.TEN)), ExpectedRevision.exactly(1)))
            .isInstanceOf(WrongExpectedRevisionException.class)
            .hasMessageContaining("expected 1, actual 2");

        assertThat(store.streamRevision("account-a1")).isEqualTo(2);
        assertThat(store.readStream("account-a1")).hasSize(2);
    }

    @Test
    @DisplayName("exactly(0) behaves like noStream")
    void testExactlyZero() {
        assertThat(store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")), ExpectedRevision.exactly(0)))
            .isEqualTo(1);

        assertThatThrownBy(() -> store.appendToStream(
                "account-a1", List.of(new AccountOpened("a1", "alice")), ExpectedRevision.exactly(0)))
            .isInstanceOf(WrongExpectedRevisionException.class);
    }

    @Test
    @DisplayName("A failed expectation on a missing stream does not create it")
    void testFailedAppendDoesNotCreateStream() {
        assertThatThrownBy(() -> store.appendToStream(
                "account-a1", List.of(new AccountOpened("a1", "alice")), ExpectedRevision.exactly(3)))
            .isInstanceOf(WrongExpectedRevisionException.class);

        assertThat(store.streamCount()).isZero();
        assertThat(store.aggregateStream("account-a1", Account::evolve, Account::initial)).isEmpty();
    }

    @Test
    @DisplayName("An empty batch writes nothing but still checks the expectation")
    void testEmptyBatch() {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")));

        assertThat(store.appendToStream("account-a1", List.of(), ExpectedRevision.exactly(1))).isEqualTo(1);
        assertThatThrownBy(() -> store.appendToStream("account-a1", List.of(), ExpectedRevision.noStream()))
            .isInstanceOf(WrongExpectedRevisionException.class);
        assertThat(store.appendToStream("account-new", List.of())).isZero();
        assertThat(store.streamCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Aggregating a missing stream returns empty, never the initial state")
    void testAggregateMissingStream() {
        Optional<Account> account = store.aggregateStream("account-none", Account::evolve, Account::initial);

        assertThat(account).isEmpty();
    }

    @Test
    @DisplayName("Loading an aggregate returns state with the revision it was folded at")
    void testLoadAggregate() {
        store.appendToStream("account-a1", List.of(
            new AccountOpened("a1", "alice"),
            new MoneyDeposited("a1", new BigDecimal("100")),
            new MoneyWithdrawn("a1", new BigDecimal("30"))
        ));

        VersionedState<Account> loaded = store.loadAggregate("account-a1", Account::evolve, Account::initial)
            .orElseThrow();

        assertThat(loaded.revision()).isEqualTo(3);
        assertThat(loaded.expectedRevision()).isEqualTo(ExpectedRevision.exactly(3));
        assertThat(loaded.state().owner()).isEqualTo("alice");
        assertThat(loaded.state().balance()).isEqualByComparingTo("70");
    }

    @Test
    @DisplayName("Streams are isolated from each other")
    void testStreamIsolation() {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")));
        store.appendToStream("account-b2", List.of(new AccountOpened("b2", "bob")), ExpectedRevision.noStream());

        assertThat(store.readStream("account-a1")).containsExactly(new AccountOpened("a1", "alice"));
        assertThat(store.readStream("account-b2")).containsExactly(new AccountOpened("b2", "bob"));
    }

    @Test
    @DisplayName("Null events are rejected before anything is written")
    void testNullEventRejected() {
        List<AccountEvent> events = new ArrayList<>();
        events.add(new AccountOpened("a1", "alice"));
        events.add(null);

        assertThatThrownBy(() -> store.appendToStream("account-a1", events))
            .isInstanceOf(NullPointerException.class);
        assertThat(store.readStream("account-a1")).isEmpty();
    }

    @Test
    @DisplayName("Of many concurrent appends at the same revision exactly one wins")
    void testConcurrentAppendsSameRevision() throws Exception {
        store.appendToStream("account-a1", List.of(new AccountOpened("a1", "alice")));

        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < writers; i++) {
                BigDecimal amount = BigDecimal.valueOf(i + 1);
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.appendToStream("account-a1",
                            List.of(new MoneyDeposited("a1", amount)), ExpectedRevision.exactly(1));
                        successes.incrementAndGet();
                    } catch (WrongExpectedRevisionException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(writers - 1);
        assertThat(store.streamRevision("account-a1")).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent unconditional appends never lose or duplicate revisions")
    void testConcurrentAnyAppends() throws Exception {
        int writers = 4;
        int perWriter = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int w = 0; w < writers; w++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perWriter; i++) {
                        store.appendToStream("account-a1", List.of(new MoneyDeposited("a1", BigDecimal.ONE)));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<RecordedEvent<AccountEvent>> recorded = store.readRecordedEvents("account-a1");
        assertThat(recorded).hasSize(writers * perWriter);
        for (int i = 0; i < recorded.size(); i++) {
            assertThat(recorded.get(i).revision()).isEqualTo(i + 1);
        }
    }
}
