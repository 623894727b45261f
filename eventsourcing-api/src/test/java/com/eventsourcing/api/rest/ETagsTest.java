package com.eventsourcing.api.rest;

import com.eventsourcing.core.model.ExpectedRevision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ETagsTest {

    @Test
    @DisplayName("Revisions are written as weak tags")
    void testFromRevision() {
        assertThat(ETags.fromRevision(7)).isEqualTo("W/\"7\"");
    }

    @Test
    @DisplayName("Weak and strong revision tags both parse to an exact expectation")
    void testParse() {
        assertThat(ETags.toExpectedRevision("W/\"3\"")).isEqualTo(ExpectedRevision.exactly(3));
        assertThat(ETags.toExpectedRevision("\"3\"")).isEqualTo(ExpectedRevision.exactly(3));
        assertThat(ETags.toExpectedRevision(" W/\"0\" ")).isEqualTo(ExpectedRevision.exactly(0));
    }

    @Test
    @DisplayName("A missing header means no expectation")
    void testAbsent() {
        assertThat(ETags.toExpectedRevision(null)).isNull();
        assertThat(ETags.toExpectedRevision("")).isNull();
    }

    @Test
    @DisplayName("Anything else is rejected")
    void testMalformed() {
        for (String header : new String[] {"*", "3", "W/3", "\"abc\"", "\"-1\"", "\"1\", \"2\""}) {
            assertThatThrownBy(() -> ETags.toExpectedRevision(header))
                .as(header)
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
