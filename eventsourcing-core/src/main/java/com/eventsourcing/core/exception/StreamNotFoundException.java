package com.eventsourcing.core.exception;

/**
 * Thrown when a caller requires a stream (or the aggregate folded from it) to exist.
 */
public class StreamNotFoundException extends EventSourcingException {

    public static final String ERROR_CODE = "STREAM_NOT_FOUND";

    private final String streamId;

    public StreamNotFoundException(String streamId) {
        super(ERROR_CODE, String.format("Stream not found: %s", streamId));
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
