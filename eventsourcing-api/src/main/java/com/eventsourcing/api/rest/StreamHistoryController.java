package com.eventsourcing.api.rest;

import com.eventsourcing.core.exception.StreamNotFoundException;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for reading raw stream history.
 */
@RestController
@RequestMapping("/api/v1/streams/{streamId}/events")
public class StreamHistoryController {

    private final StreamStore<ShoppingCartEvent> streamStore;

    public StreamHistoryController(StreamStore<ShoppingCartEvent> streamStore) {
        this.streamStore = streamStore;
    }

    /**
     * All events of a stream, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<RecordedEventResponse>> getEvents(@PathVariable String streamId) {
        List<RecordedEvent<ShoppingCartEvent>> recorded = streamStore.readRecordedEvents(streamId);
        if (recorded.isEmpty()) {
            throw new StreamNotFoundException(streamId);
        }
        return ResponseEntity.ok(recorded.stream().map(RecordedEventResponse::from).toList());
    }

    public record RecordedEventResponse(
        long revision,
        UUID eventId,
        String type,
        ShoppingCartEvent data,
        Instant recordedAt
    ) {
        static RecordedEventResponse from(RecordedEvent<ShoppingCartEvent> event) {
            return new RecordedEventResponse(
                event.revision(),
                event.eventId(),
                event.type(),
                event.data(),
                event.recordedAt()
            );
        }
    }
}
