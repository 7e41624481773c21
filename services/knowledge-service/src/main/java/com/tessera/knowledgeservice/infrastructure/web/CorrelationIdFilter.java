package com.tessera.knowledgeservice.infrastructure.web;

import com.tessera.observability.CorrelationContext;
import com.tessera.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates the correlation id of every HTTP request and puts it, with the acting
 * user and client request id, into {@link CorrelationContextHolder} and so into the MDC.
 *
 * <p>Commands submitted during the request inherit this correlation id, so the client can follow
 * its command's events with the value echoed in {@code X-Correlation-ID}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final int MAX_HEADER_LENGTH = 200;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = sanitize(request.getHeader(RequestHeaders.CORRELATION_ID));
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(
                CorrelationContext.of(correlationId)
                        .withUser(sanitize(request.getHeader(RequestHeaders.USER_ID)))
                        .withRequestId(sanitize(request.getHeader(RequestHeaders.REQUEST_ID))));
        response.setHeader(RequestHeaders.CORRELATION_ID, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }

    private static String sanitize(String header) {
        if (header == null || header.isBlank() || header.length() > MAX_HEADER_LENGTH) {
            return null;
        }
        return header.strip();
    }
}
