package com.eventsourcing.api.rest;

import com.eventsourcing.core.model.ExpectedRevision;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stream revisions exchanged as weak entity tags, {@code W/"<revision>"}.
 */
final class ETags {

    private static final Pattern REVISION_TAG = Pattern.compile("^(?:W/)?\"(\\d{1,18})\"$");

    private ETags() {
    }

    static String fromRevision(long revision) {
        return "W/\"" + revision + "\"";
    }

    /**
     * Parse an If-Match header into an exact expected revision.
     *
     * @return null when the header is absent, so the command retries against the latest state
     * @throws IllegalArgumentException when the header is not a revision tag
     */
    static ExpectedRevision toExpectedRevision(String ifMatch) {
        if (ifMatch == null || ifMatch.isBlank()) {
            return null;
        }
        Matcher matcher = REVISION_TAG.matcher(ifMatch.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("If-Match must be a revision tag like W/\"3\", got " + ifMatch);
        }
        return ExpectedRevision.exactly(Long.parseLong(matcher.group(1)));
    }
}
