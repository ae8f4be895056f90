package com.chmonitor.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    private String run(MockHttpServletRequest request, MockHttpServletResponse response) throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));
        filter.doFilter(request, response, chain);
        return seen.get();
    }

    @Test
    void reusesCallerSuppliedId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/hosts");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "req-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(run(request, response)).isEqualTo("req-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("req-123");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void replacesUnsafeId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/hosts");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "bad id\nforged log line");
        MockHttpServletResponse response = new MockHttpServletResponse();

        String traceId = run(request, response);

        assertThat(traceId).isNotBlank().doesNotContain(" ");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo(traceId);
    }

    @Test
    void generatesIdWhenMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        String traceId = run(new MockHttpServletRequest("GET", "/v1/hosts"), response);

        assertThat(traceId).hasSize(36);
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo(traceId);
    }
}
