package io.ingestline.api;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gives every request a correlation id for logging. An inbound
 * {@code X-Request-Id} is kept; otherwise ids are {@code host/random-000001},
 * counting up for the life of the process.
 */
@Component
@Order(PipelineOrder.REQUEST_ID)
public class RequestIdFilter implements Filter {
    public static final String HEADER = "X-Request-Id";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".id";
    public static final String MDC_KEY = "requestId";

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public RequestIdFilter() {
        this(defaultPrefix());
    }

    RequestIdFilter(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String id = null;
        if (request instanceof HttpServletRequest req) {
            String inbound = req.getHeader(HEADER);
            if (inbound != null && !inbound.isBlank()) id = inbound.trim();
        }
        if (id == null) id = nextId();

        request.setAttribute(ATTRIBUTE, id);
        String prev = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, id);
        try {
            chain.doFilter(request, response);
        } finally {
            if (prev == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, prev);
        }
    }

    String nextId() {
        return String.format("%s-%06d", prefix, sequence.incrementAndGet());
    }

    static String defaultPrefix() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        byte[] random = new byte[12];
        new SecureRandom().nextBytes(random);
        String suffix = Base64.getUrlEncoder().withoutPadding().encodeToString(random).substring(0, 10);
        return host + "/" + suffix;
    }
}
