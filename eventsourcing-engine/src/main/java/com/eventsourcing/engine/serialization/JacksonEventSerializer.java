package com.eventsourcing.engine.serialization;

import com.eventsourcing.core.exception.EventSerializationException;
import com.eventsourcing.core.model.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts events of one sealed family to and from their stored JSON payload.
 *
 * The type name is the record's simple class name, matching
 * {@link DomainEvent#eventType()}; the payload is the record serialized by Jackson.
 * Types are discovered from the sealed interface's permitted subclasses.
 */
public class JacksonEventSerializer<E extends DomainEvent> {

    private final ObjectMapper objectMapper;
    private final Class<E> eventFamily;
    private final Map<String, Class<? extends E>> typesByName;

    public JacksonEventSerializer(ObjectMapper objectMapper, Class<E> eventFamily) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.eventFamily = Objects.requireNonNull(eventFamily, "eventFamily");
        if (!eventFamily.isSealed()) {
            throw new IllegalArgumentException(
                String.format("Event family %s must be a sealed interface", eventFamily.getName()));
        }

        Map<String, Class<? extends E>> types = new LinkedHashMap<>();
        for (Class<?> permitted : eventFamily.getPermittedSubclasses()) {
            Class<? extends E> eventClass = permitted.asSubclass(eventFamily);
            Class<? extends E> previous = types.put(eventClass.getSimpleName(), eventClass);
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                    "Duplicate event type name %s in %s", eventClass.getSimpleName(), eventFamily.getName()));
            }
        }
        this.typesByName = Collections.unmodifiableMap(types);
    }

    /**
     * ObjectMapper used when none is supplied: ISO-8601 timestamps, unknown fields tolerated.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public Set<String> supportedTypes() {
        return typesByName.keySet();
    }

    public boolean supports(String type) {
        return type != null && typesByName.containsKey(type);
    }

    public String typeOf(E event) {
        return event.eventType();
    }

    /**
     * Serialize an event payload to JSON.
     *
     * @throws EventSerializationException if Jackson cannot write the event
     */
    public String serialize(E event) {
        Objects.requireNonNull(event, "event");
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                String.format("Failed to serialize event %s: %s", event.eventType(), e.getOriginalMessage()), e);
        }
    }

    /**
     * Deserialize a stored payload.
     *
     * @param type Stored type name
     * @param json Stored JSON payload
     * @throws EventSerializationException if the type is unknown or the payload does not fit it
     */
    public E deserialize(String type, String json) {
        Class<? extends E> eventClass = typesByName.get(type);
        if (eventClass == null) {
            throw new EventSerializationException(String.format(
                "Unknown event type %s for %s", type, eventFamily.getSimpleName()));
        }
        if (json == null || json.isBlank()) {
            throw new EventSerializationException(String.format("Empty payload for event type %s", type));
        }
        try {
            return objectMapper.readValue(json, eventClass);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                String.format("Failed to deserialize event %s: %s", type, e.getOriginalMessage()), e);
        }
    }
}
