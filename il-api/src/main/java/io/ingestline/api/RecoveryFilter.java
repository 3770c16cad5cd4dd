package io.ingestline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Outermost filter. Anything the rest of the chain throws ends here as a 500;
 * the fault stops at this request.
 */
@Component
@Order(PipelineOrder.RECOVERY)
public class RecoveryFilter implements Filter {
    private static final Logger log = LoggerFactory.getLogger(RecoveryFilter.class);

    private final ObjectMapper json;

    public RecoveryFilter(ObjectMapper json) {
        this.json = json;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            var req = (HttpServletRequest) request;
            var res = (HttpServletResponse) response;
            log.error("Recovered from handler fault requestId={} method={} path={}",
                    req.getAttribute(RequestIdFilter.ATTRIBUTE), req.getMethod(), req.getRequestURI(), e);
            if (res.isCommitted()) {
                log.warn("Response already committed, cannot send error for {}", req.getRequestURI());
                return;
            }
            ErrorResponses.write(json, req, res, HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");
        }
    }
}
