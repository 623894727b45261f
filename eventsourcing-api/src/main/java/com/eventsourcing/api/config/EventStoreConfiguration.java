package com.eventsourcing.api.config;

import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.engine.health.EventStoreHealthIndicator;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import com.eventsourcing.engine.persistence.InMemoryStreamStore;
import com.eventsourcing.engine.persistence.jdbc.JdbcStreamStore;
import com.eventsourcing.engine.serialization.JacksonEventSerializer;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent;
import com.eventsourcing.examples.shoppingcart.ShoppingCartService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wires the shopping cart service onto the configured stream store.
 *
 * {@code eventsourcing.store.type=in-memory} (default) keeps streams in the process;
 * {@code jdbc} stores them in PostgreSQL through the Boot-managed data source.
 */
@Configuration
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfiguration.class);

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "shopping-cart-service");
    }

    @Bean
    public EventStoreMetrics eventStoreMetrics() {
        return new EventStoreMetrics();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventsourcing.store", name = "type", havingValue = "in-memory", matchIfMissing = true)
    public StreamStore<ShoppingCartEvent> inMemoryShoppingCartStore(Clock clock, EventStoreMetrics metrics) {
        log.info("Using in-memory stream store");
        return new InMemoryStreamStore<>(clock, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventsourcing.store", name = "type", havingValue = "jdbc")
    public JacksonEventSerializer<ShoppingCartEvent> shoppingCartEventSerializer(ObjectMapper objectMapper) {
        return new JacksonEventSerializer<>(objectMapper, ShoppingCartEvent.class);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventsourcing.store", name = "type", havingValue = "jdbc")
    public StreamStore<ShoppingCartEvent> jdbcShoppingCartStore(JdbcTemplate jdbcTemplate,
                                                                TransactionTemplate transactionTemplate,
                                                                JacksonEventSerializer<ShoppingCartEvent> serializer,
                                                                EventStoreMetrics metrics,
                                                                Clock clock) {
        log.info("Using PostgreSQL stream store");
        return new JdbcStreamStore<>(jdbcTemplate, transactionTemplate, serializer, metrics, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventsourcing.store", name = "type", havingValue = "jdbc")
    public EventStoreHealthIndicator eventStoreHealthIndicator(JdbcTemplate jdbcTemplate) {
        return new EventStoreHealthIndicator(jdbcTemplate);
    }

    @Bean
    public ShoppingCartService shoppingCartService(StreamStore<ShoppingCartEvent> shoppingCartStore,
                                                   EventSourcingProperties properties,
                                                   EventStoreMetrics metrics,
                                                   Clock clock) {
        return new ShoppingCartService(shoppingCartStore, properties.retry().toPolicy(), metrics, clock);
    }
}
