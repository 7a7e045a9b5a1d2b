package com.plantwatch.detector.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void reusesCallerTraceIdForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/anomalies");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "reload-2024.03.01_a");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        AtomicReference<String> seenInContext = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seenInMdc.set(MDC.get(TraceIdFilter.MDC_KEY));
            seenInContext.set(RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null));
        });

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("reload-2024.03.01_a");
        assertThat(seenInMdc.get()).isEqualTo("reload-2024.03.01_a");
        assertThat(seenInContext.get()).isEqualTo("reload-2024.03.01_a");
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
        assertThat(RequestContextHolder.get()).isEmpty();
    }

    @Test
    void replacesTraceIdThatCouldForgeLogLines() {
        String forged = "abc\n2024-03-01 INFO fake entry";

        String resolved = TraceIdFilter.resolveTraceId(forged);

        assertThat(resolved).isNotEqualTo(forged).matches("[0-9a-f-]{36}");
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId(" ")).hasSize(36);
    }

    @Test
    void livenessPollsAreNotTraced() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/healthz");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isNull();
    }
}
