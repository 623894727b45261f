package com.eventsourcing.core.model;

/**
 * Optimistic-concurrency precondition supplied when appending to a stream.
 *
 * The revision of a stream is the number of events stored in it, so an
 * absent stream has revision 0 and {@code exactly(0)} behaves like
 * {@code noStream()}.
 */
public record ExpectedRevision(Kind kind, long revision) {

    public enum Kind {
        /**
         * Append unconditionally.
         */
        ANY,

        /**
         * Append only if the stream is absent or empty.
         */
        NO_STREAM,

        /**
         * Append only if the current revision equals {@link #revision()}.
         */
        EXACT
    }

    private static final ExpectedRevision ANY_REVISION = new ExpectedRevision(Kind.ANY, -1L);
    private static final ExpectedRevision NO_STREAM_REVISION = new ExpectedRevision(Kind.NO_STREAM, 0L);

    public ExpectedRevision {
        if (kind == null) {
            throw new IllegalArgumentException("Expected revision kind cannot be null");
        }
        if (kind == Kind.EXACT && revision < 0) {
            throw new IllegalArgumentException("Expected revision must be >= 0, got " + revision);
        }
    }

    public static ExpectedRevision any() {
        return ANY_REVISION;
    }

    public static ExpectedRevision noStream() {
        return NO_STREAM_REVISION;
    }

    public static ExpectedRevision exactly(long revision) {
        return new ExpectedRevision(Kind.EXACT, revision);
    }

    /**
     * Check whether an append may proceed against the given current revision.
     */
    public boolean matches(long currentRevision) {
        return switch (kind) {
            case ANY -> true;
            case NO_STREAM -> currentRevision == 0L;
            case EXACT -> currentRevision == revision;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ANY -> "any";
            case NO_STREAM -> "no-stream";
            case EXACT -> String.valueOf(revision);
        };
    }
}
