package com.eventsourcing.core.exception;

import com.eventsourcing.core.model.ExpectedRevision;

/**
 * Thrown when an append's expected revision does not match the stream.
 * Nothing was written. Recover by re-reading, re-deciding and appending again.
 */
public class WrongExpectedRevisionException extends EventSourcingException {

    public static final String ERROR_CODE = "WrongExpectedRevision";

    private final String streamId;
    private final ExpectedRevision expectedRevision;
    private final long actualRevision;

    public WrongExpectedRevisionException(String streamId, ExpectedRevision expectedRevision, long actualRevision) {
        super(ERROR_CODE, String.format(
            "Wrong expected revision on stream '%s': expected %s, actual %d",
            streamId, expectedRevision, actualRevision
        ));
        this.streamId = streamId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public String getStreamId() {
        return streamId;
    }

    public ExpectedRevision getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
