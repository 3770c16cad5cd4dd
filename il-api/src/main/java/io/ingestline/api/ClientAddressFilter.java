package io.ingestline.api;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Resolves the originating client address from proxy headers so that logs show
 * the caller rather than the last hop. Precedence: True-Client-IP, X-Real-IP,
 * first X-Forwarded-For entry, socket address.
 */
@Component
@Order(PipelineOrder.CLIENT_ADDRESS)
public class ClientAddressFilter implements Filter {
    public static final String MDC_KEY = "clientIp";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest req)) {
            chain.doFilter(request, response);
            return;
        }

        String resolved = resolve(req);
        ServletRequest next = resolved.equals(req.getRemoteAddr()) ? req : new ResolvedAddressRequest(req, resolved);

        String prev = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, resolved);
        try {
            chain.doFilter(next, response);
        } finally {
            if (prev == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, prev);
        }
    }

    static String resolve(HttpServletRequest req) {
        String ip = header(req, "True-Client-IP");
        if (ip == null) ip = header(req, "X-Real-IP");
        if (ip == null) {
            String forwarded = header(req, "X-Forwarded-For");
            if (forwarded != null) {
                int comma = forwarded.indexOf(',');
                ip = (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
                if (ip.isEmpty()) ip = null;
            }
        }
        return ip != null ? ip : req.getRemoteAddr();
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static final class ResolvedAddressRequest extends HttpServletRequestWrapper {
        private final String remoteAddr;

        ResolvedAddressRequest(HttpServletRequest request, String remoteAddr) {
            super(request);
            this.remoteAddr = remoteAddr;
        }

        @Override
        public String getRemoteAddr() {
            return remoteAddr;
        }
    }
}
