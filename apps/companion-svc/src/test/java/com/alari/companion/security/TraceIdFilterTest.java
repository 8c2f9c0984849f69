package com.alari.companion.security;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    private MockHttpServletResponse run(String suppliedTrace, AtomicReference<String> seenInChain) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/conversations");
        if (suppliedTrace != null) {
            request.addHeader(TraceIdFilter.TRACE_HEADER, suppliedTrace);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInChain.set(RequestContextHolder.currentTraceId());
                assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isEqualTo(seenInChain.get());
            }
        };
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    void wellFormedTraceIsPropagated() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        MockHttpServletResponse response = run("client-42.retry_1", seen);

        assertThat(seen.get()).isEqualTo("client-42.retry_1");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("client-42.retry_1");
    }

    @Test
    void missingTraceIsGenerated() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        MockHttpServletResponse response = run(null, seen);

        assertThat(UUID.fromString(seen.get())).isNotNull();
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo(seen.get());
    }

    @Test
    void unsafeTraceIsReplaced() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        MockHttpServletResponse response = run("abc\r\nlevel=ERROR forged", seen);

        assertThat(seen.get()).doesNotContain("forged");
        assertThat(UUID.fromString(seen.get())).isNotNull();
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo(seen.get());
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).hasSize(36);
    }

    @Test
    void contextIsClearedAfterRequest() throws Exception {
        run("client-42", new AtomicReference<>());

        assertThat(RequestContextHolder.currentTraceId()).isNull();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }
}
