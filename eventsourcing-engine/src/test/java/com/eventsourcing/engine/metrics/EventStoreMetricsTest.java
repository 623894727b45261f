package com.eventsourcing.engine.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class EventStoreMetricsTest {

    private SimpleMeterRegistry registry;
    private EventStoreMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EventStoreMetrics();
        metrics.bindTo(registry);
    }

    @Test
    void appendSucceeded_shouldCountAppendsEventsAndLatency() {
        metrics.appendSucceeded("shopping_cart-42", 3, Duration.ofMillis(5));
        metrics.appendSucceeded("shopping_cart-43", 2, Duration.ofMillis(7));

        assertThat(registry.get(EventStoreMetrics.APPENDS)
            .tags("category", "shopping_cart", "outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(EventStoreMetrics.EVENTS_APPENDED)
            .tag("category", "shopping_cart").counter().count()).isEqualTo(5.0);
        assertThat(registry.get(EventStoreMetrics.APPEND_DURATION).timer().count()).isEqualTo(2);
    }

    @Test
    void appendConflicted_shouldBeTaggedSeparately() {
        metrics.appendConflicted("shopping_cart-42");

        assertThat(registry.get(EventStoreMetrics.APPENDS)
            .tags("category", "shopping_cart", "outcome", "conflict").counter().count()).isEqualTo(1.0);
    }

    @Test
    void commandOutcomes_shouldBeTaggedByCommandAndOutcome() {
        metrics.commandSucceeded("OpenShoppingCart");
        metrics.commandRejected("ConfirmShoppingCart", "CART_IS_ALREADY_CLOSED");
        metrics.commandConflicted("AddProductItemToShoppingCart");
        metrics.commandRetried("AddProductItemToShoppingCart", 1);

        assertThat(registry.get(EventStoreMetrics.COMMANDS)
            .tags("command", "OpenShoppingCart", "outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(EventStoreMetrics.COMMANDS)
            .tags("command", "ConfirmShoppingCart", "error_code", "CART_IS_ALREADY_CLOSED").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(EventStoreMetrics.COMMANDS)
            .tags("outcome", "conflict").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(EventStoreMetrics.COMMAND_RETRIES).counter().count()).isEqualTo(1.0);
    }

    @Test
    void commandsInFlight_shouldNeverGoNegative() {
        metrics.commandStarted();
        metrics.commandStarted();
        metrics.commandFinished();

        assertThat(registry.get(EventStoreMetrics.COMMANDS_IN_FLIGHT).gauge().value()).isEqualTo(1.0);

        metrics.commandFinished();
        metrics.commandFinished();

        assertThat(registry.get(EventStoreMetrics.COMMANDS_IN_FLIGHT).gauge().value()).isEqualTo(0.0);
    }

    @Test
    void unboundMetrics_shouldBeNoOp() {
        EventStoreMetrics unbound = new EventStoreMetrics();

        assertThatCode(() -> {
            unbound.appendSucceeded("cart-1", 1, Duration.ZERO);
            unbound.appendConflicted("cart-1");
            unbound.commandSucceeded("OpenShoppingCart");
            unbound.commandRetried("OpenShoppingCart", 1);
        }).doesNotThrowAnyException();
    }

    @Test
    void streamCategory_shouldUsePrefixBeforeFirstDash() {
        assertThat(EventStoreMetrics.streamCategory("shopping_cart-7f3a-11ee")).isEqualTo("shopping_cart");
        assertThat(EventStoreMetrics.streamCategory("standalone")).isEqualTo("standalone");
        assertThat(EventStoreMetrics.streamCategory("-leading")).isEqualTo("-leading");
        assertThat(EventStoreMetrics.streamCategory(null)).isEqualTo("unspecified");
    }
}
