package org.example.lingua.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags each request with a request id (echoed in the response) and puts it, along
 * with the caller's user id, into the logging MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestCorrelation.normalizeHeader(request.getHeader(RequestCorrelation.REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        String userId = RequestCorrelation.normalizeHeader(request.getHeader(RequestCorrelation.USER_HEADER_NAME));

        request.setAttribute(RequestCorrelation.REQUEST_ID_KEY, requestId);
        response.setHeader(RequestCorrelation.REQUEST_ID_HEADER, requestId);
        MDC.put(RequestCorrelation.REQUEST_ID_KEY, requestId);
        if (userId != null) {
            MDC.put(RequestCorrelation.USER_ID_KEY, userId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.REQUEST_ID_KEY);
            MDC.remove(RequestCorrelation.USER_ID_KEY);
        }
    }
}
