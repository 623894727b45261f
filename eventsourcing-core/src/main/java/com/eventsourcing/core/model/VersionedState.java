package com.eventsourcing.core.model;

/**
 * Aggregate state together with the stream revision it was folded at.
 * The revision is what a decision based on this state must expect when appending.
 */
public record VersionedState<S>(S state, long revision) {

    public VersionedState {
        if (revision < 0) {
            throw new IllegalArgumentException("Revision must be >= 0, got " + revision);
        }
    }

    /**
     * Expected revision for appending events decided against this state.
     */
    public ExpectedRevision expectedRevision() {
        return revision == 0L ? ExpectedRevision.noStream() : ExpectedRevision.exactly(revision);
    }
}
