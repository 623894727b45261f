package com.eventsourcing.api.config;

import com.eventsourcing.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code eventsourcing.*} prefix:
 *
 * <pre>
 * eventsourcing:
 *   store:
 *     type: jdbc
 *   retry:
 *     max-attempts: 5
 *     initial-backoff: 10ms
 *     max-backoff: 1s
 *     backoff-multiplier: 2.0
 *     jitter-factor: 0.2
 * </pre>
 *
 * Missing values fall back to the defaults applied in the compact constructors.
 */
@ConfigurationProperties(prefix = "eventsourcing")
public record EventSourcingProperties(Store store, Retry retry) {

    public EventSourcingProperties {
        if (store == null) {
            store = new Store(null);
        }
        if (retry == null) {
            retry = new Retry(0, null, null, null, null);
        }
    }

    /**
     * @param type {@code in-memory} (default) or {@code jdbc}
     */
    public record Store(String type) {

        public static final String IN_MEMORY = "in-memory";
        public static final String JDBC = "jdbc";

        public Store {
            if (type == null || type.isBlank()) {
                type = IN_MEMORY;
            }
            if (!IN_MEMORY.equals(type) && !JDBC.equals(type)) {
                throw new IllegalArgumentException(
                    "eventsourcing.store.type must be '" + IN_MEMORY + "' or '" + JDBC + "', got " + type);
            }
        }
    }

    /**
     * Retry settings for commands sent without an expected revision.
     */
    public record Retry(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Double backoffMultiplier,
        Double jitterFactor
    ) {
        public Retry {
            if (maxAttempts <= 0) {
                maxAttempts = 5;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(10);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(1);
            }
            if (backoffMultiplier == null) {
                backoffMultiplier = 2.0;
            }
            if (jitterFactor == null) {
                jitterFactor = 0.2;
            }
        }

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(backoffMultiplier)
                .jitterFactor(jitterFactor)
                .build();
        }
    }
}
