package io.ingestline.api;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter("host/abcdefghij");

    @AfterEach
    void clear() { MDC.clear(); }

    @Test
    void generatesSequentialIdsVisibleInMdcDuringTheRequest() throws Exception {
        var seen = new AtomicReference<String>();
        var first = new MockHttpServletRequest("GET", "/events");
        var second = new MockHttpServletRequest("GET", "/events");

        filter.doFilter(first, new MockHttpServletResponse(), (rq, rs) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)));
        filter.doFilter(second, new MockHttpServletResponse(), (rq, rs) -> {});

        assertThat(seen.get()).isEqualTo("host/abcdefghij-000001");
        assertThat(first.getAttribute(RequestIdFilter.ATTRIBUTE)).isEqualTo("host/abcdefghij-000001");
        assertThat(second.getAttribute(RequestIdFilter.ATTRIBUTE)).isEqualTo("host/abcdefghij-000002");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void keepsInboundRequestId() throws Exception {
        var req = new MockHttpServletRequest("POST", "/events");
        req.addHeader(RequestIdFilter.HEADER, "  upstream-42 ");

        filter.doFilter(req, new MockHttpServletResponse(), (rq, rs) -> {});

        assertThat(req.getAttribute(RequestIdFilter.ATTRIBUTE)).isEqualTo("upstream-42");
    }

    @Test
    void restoresPreviousMdcValue() throws Exception {
        MDC.put(RequestIdFilter.MDC_KEY, "outer");

        filter.doFilter(new MockHttpServletRequest("GET", "/healthz"), new MockHttpServletResponse(), (rq, rs) -> {});

        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isEqualTo("outer");
    }

    @Test
    void defaultPrefixNamesHostAndRandomSuffix() {
        String prefix = RequestIdFilter.defaultPrefix();
        assertThat(prefix).contains("/");
        assertThat(prefix.substring(prefix.lastIndexOf('/') + 1)).hasSize(10);
        assertThat(RequestIdFilter.defaultPrefix()).isNotEqualTo(prefix);
    }
}
