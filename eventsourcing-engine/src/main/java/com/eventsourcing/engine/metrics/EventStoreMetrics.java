package com.eventsourcing.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for stream appends and command handling.
 *
 * Metrics exposed:
 * - Append attempts by outcome (success / conflict)
 * - Appended event count
 * - Append latency
 * - Command outcomes (success / rejected / conflict)
 * - Optimistic-concurrency retries
 * - Commands in flight
 *
 * Stream ids are never used as tags; streams are grouped by category, the part of the
 * id before the first '-' (so {@code shopping_cart-42} is in category {@code shopping_cart}).
 *
 * Until {@link #bindTo(MeterRegistry)} is called every recording method is a no-op.
 */
public class EventStoreMetrics implements MeterBinder {

    public static final String APPENDS = "eventsourcing.appends";
    public static final String EVENTS_APPENDED = "eventsourcing.events.appended";
    public static final String APPEND_DURATION = "eventsourcing.append.duration";
    public static final String COMMANDS = "eventsourcing.commands";
    public static final String COMMAND_RETRIES = "eventsourcing.command.retries";
    public static final String COMMANDS_IN_FLIGHT = "eventsourcing.commands.in_flight";

    private volatile MeterRegistry registry;
    private final AtomicInteger commandsInFlight = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(COMMANDS_IN_FLIGHT, commandsInFlight, AtomicInteger::get)
            .description("Commands currently being handled")
            .register(registry);
    }

    // ========== Append Metrics ==========

    public void appendSucceeded(String streamId, int eventCount, Duration duration) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        String category = streamCategory(streamId);

        Counter.builder(APPENDS)
            .tag("category", category)
            .tag("outcome", "success")
            .description("Append attempts")
            .register(r)
            .increment();

        Counter.builder(EVENTS_APPENDED)
            .tag("category", category)
            .description("Total events appended")
            .register(r)
            .increment(eventCount);

        Timer.builder(APPEND_DURATION)
            .tag("category", category)
            .description("Append latency including the revision check")
            .register(r)
            .record(duration);
    }

    public void appendConflicted(String streamId) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(APPENDS)
            .tag("category", streamCategory(streamId))
            .tag("outcome", "conflict")
            .description("Append attempts")
            .register(r)
            .increment();
    }

    // ========== Command Metrics ==========

    public void commandStarted() {
        commandsInFlight.incrementAndGet();
    }

    public void commandFinished() {
        commandsInFlight.updateAndGet(v -> Math.max(0, v - 1));
    }

    public void commandSucceeded(String commandType) {
        commandOutcome(commandType, "success", "none");
    }

    public void commandRejected(String commandType, String errorCode) {
        commandOutcome(commandType, "rejected", errorCode);
    }

    public void commandConflicted(String commandType) {
        commandOutcome(commandType, "conflict", "WrongExpectedRevision");
    }

    public void commandRetried(String commandType, int attemptNumber) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(COMMAND_RETRIES)
            .tag("command", commandType)
            .tag("attempt", String.valueOf(attemptNumber))
            .description("Optimistic-concurrency retries")
            .register(r)
            .increment();
    }

    private void commandOutcome(String commandType, String outcome, String errorCode) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(COMMANDS)
            .tag("command", commandType)
            .tag("outcome", outcome)
            .tag("error_code", errorCode == null ? "unspecified" : errorCode)
            .description("Handled commands by outcome")
            .register(r)
            .increment();
    }

    // ========== Helper Methods ==========

    static String streamCategory(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            return "unspecified";
        }
        int dash = streamId.indexOf('-');
        return dash > 0 ? streamId.substring(0, dash) : streamId;
    }
}
