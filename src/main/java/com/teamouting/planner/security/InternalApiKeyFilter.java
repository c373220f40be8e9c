package com.teamouting.planner.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Filter for authenticating service-to-service requests from the room membership service.
 * Validates the X-Api-Key header against the configured internal API key.
 * Only applies to /internal/** endpoints.
 */
@Component
public class InternalApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(InternalApiKeyFilter.class);
    static final String API_KEY_HEADER = "X-Api-Key";
    private static final String INTERNAL_PATH_PREFIX = "/internal/";

    private final String expectedApiKey;

    public InternalApiKeyFilter(@Value("${internal.api-key:}") String expectedApiKey) {
        this.expectedApiKey = expectedApiKey;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(INTERNAL_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String providedApiKey = request.getHeader(API_KEY_HEADER);

        if (providedApiKey == null || providedApiKey.isBlank()) {
            logger.warn("Missing API key for internal endpoint: {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing API key");
            return;
        }

        if (expectedApiKey == null || expectedApiKey.isBlank()) {
            logger.error("internal.api-key is not configured, rejecting {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Internal configuration error");
            return;
        }

        if (!MessageDigest.isEqual(expectedApiKey.getBytes(StandardCharsets.UTF_8),
                providedApiKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Invalid API key for internal endpoint: {}", request.getRequestURI());
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\": \"" + message + "\"}");
    }
}
