package com.weatherline.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Admits weather readings and production events pushed to the ingest endpoints only from
 * suppliers that present the shared ingest key.
 * <p>
 * With no key configured every supplier is admitted, which is how local stacks run.
 */
@Component
public class IngestApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IngestApiKeyAuthFilter.class);

    public static final String INGEST_API_KEY_HEADER = "X-Ingest-Api-Key";
    public static final String INGEST_PATH_PREFIX = "/internal/";

    static final String MISSING_KEY = "Ingest API key required in " + INGEST_API_KEY_HEADER;
    static final String UNKNOWN_KEY = "Ingest API key not recognized";

    private final byte[] expectedKey;
    private final ObjectMapper objectMapper;

    public IngestApiKeyAuthFilter(@Value("${weatherline.ingest.api-key:}") String ingestApiKey,
            ObjectMapper objectMapper) {
        this.expectedKey = ingestApiKey == null || ingestApiKey.isBlank()
                ? null
                : ingestApiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return expectedKey == null || !request.getRequestURI().startsWith(INGEST_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String presented = request.getHeader(INGEST_API_KEY_HEADER);
        if (presented == null || presented.isBlank()) {
            deny(request, response, MISSING_KEY);
            return;
        }
        if (!MessageDigest.isEqual(expectedKey, presented.getBytes(StandardCharsets.UTF_8))) {
            deny(request, response, UNKNOWN_KEY);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private void deny(HttpServletRequest request, HttpServletResponse response, String reason) throws IOException {
        log.warn("[INGEST] Rejected {} {} from {}: {}", request.getMethod(), request.getRequestURI(),
                request.getRemoteAddr(), reason);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of("error", reason));
    }
}
