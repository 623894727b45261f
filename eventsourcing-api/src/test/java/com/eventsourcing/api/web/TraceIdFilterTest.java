package com.eventsourcing.api.web;

import com.eventsourcing.engine.logging.LoggingContext;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Trace ID filter")
class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Propagates the caller's trace ID to the MDC and the response")
    void testPropagatesHeader() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, resp) -> seen.set(LoggingContext.getTraceId());

        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "trace-abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, chain);

        assertThat(seen.get()).isEqualTo("trace-abc-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("trace-abc-123");
    }

    @Test
    @DisplayName("Generates a fresh trace ID per request when none is supplied")
    void testGeneratesTraceId() throws Exception {
        FilterChain chain = (req, resp) -> { };

        MockHttpServletResponse first = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest(), first, chain);
        MockHttpServletResponse second = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest(), second, chain);

        assertThat(first.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isNotBlank();
        assertThat(second.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isNotBlank()
            .isNotEqualTo(first.getHeader(TraceIdFilter.TRACE_ID_HEADER));
    }

    @Test
    @DisplayName("Clears the MDC after the request, even when the chain fails")
    void testClearsAfterRequest() {
        MDC.put(LoggingContext.TRACE_ID, "left-over");
        FilterChain failing = (req, resp) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), failing))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");

        assertThat(LoggingContext.getTraceId()).isNull();
    }
}
