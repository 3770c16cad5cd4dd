package io.ingestline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryFilterTest {

    private final ObjectMapper json = JsonMapper.builder().findAndAddModules().build();
    private final RecoveryFilter filter = new RecoveryFilter(json);

    @Test
    void runtimeFaultBecomesGenericServerError() throws Exception {
        var req = new MockHttpServletRequest("POST", "/events");
        req.setAttribute(RequestIdFilter.ATTRIBUTE, "host/abc-000001");
        var res = new MockHttpServletResponse();
        FilterChain failing = (rq, rs) -> {
            rs.getWriter().write("partial");
            throw new IllegalStateException("store exploded");
        };

        filter.doFilter(req, res, failing);

        assertThat(res.getStatus()).isEqualTo(500);
        var body = json.readTree(res.getContentAsString());
        assertThat(body.get("status").asInt()).isEqualTo(500);
        assertThat(body.get("error").asText()).isEqualTo("Internal Server Error");
        assertThat(body.get("path").asText()).isEqualTo("/events");
        assertThat(res.getContentAsString()).doesNotContain("store exploded").doesNotContain("partial");
    }

    @Test
    void servletExceptionIsContainedToo() throws Exception {
        var res = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/events"), res, (rq, rs) -> {
            throw new ServletException("wrapped", new NullPointerException());
        });

        assertThat(res.getStatus()).isEqualTo(500);
    }

    @Test
    void committedResponseIsLeftAlone() throws Exception {
        var res = new MockHttpServletResponse();
        FilterChain failing = (rq, rs) -> {
            ((HttpServletResponse) rs).setStatus(201);
            rs.getWriter().write("{\"id\":1}");
            rs.flushBuffer();
            throw new IllegalStateException("late failure");
        };

        filter.doFilter(new MockHttpServletRequest("POST", "/events"), res, failing);

        assertThat(res.getStatus()).isEqualTo(201);
        assertThat(res.getContentAsString()).isEqualTo("{\"id\":1}");
    }

    @Test
    void healthyRequestsPassThrough() throws Exception {
        var res = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/healthz"), res, (rq, rs) -> rs.getWriter().write("ok"));

        assertThat(res.getStatus()).isEqualTo(200);
        assertThat(res.getContentAsString()).isEqualTo("ok");
    }
}
