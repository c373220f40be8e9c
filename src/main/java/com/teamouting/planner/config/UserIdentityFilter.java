package com.teamouting.planner.config;

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

/**
 * Copies the acting user ID forwarded by the authenticating gateway (X-User-Id header) into the
 * {@code userId} request attribute read by controllers, and into MDC for logging.
 * Requests without the header pass through unchanged; controllers reject them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class UserIdentityFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_ATTRIBUTE = "userId";
    private static final String MDC_USER_ID = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            userId = userId.trim();
            request.setAttribute(USER_ID_ATTRIBUTE, userId);
            MDC.put(MDC_USER_ID, userId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_USER_ID);
        }
    }
}
