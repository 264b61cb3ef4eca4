package com.studioflow.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.api.dto.ErrorResponse;
import com.studioflow.orchestrator.service.JobError;
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
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the worker-only endpoints under /internal/ with the shared
 * X-Worker-Token capability.
 *
 * Fails closed: when no token is configured every worker call is refused.
 */
@Component
public class WorkerTokenFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(WorkerTokenFilter.class);

    static final String TOKEN_HEADER    = "X-Worker-Token";
    static final String INTERNAL_ROOT   = "/internal";
    static final String INTERNAL_PREFIX = INTERNAL_ROOT + "/";

    private final byte[]       expected;
    private final ObjectMapper objectMapper;

    public WorkerTokenFilter(@Value("${studioflow.worker.token:}") String token,
                             ObjectMapper objectMapper) {
        this.expected     = token == null || token.isBlank() ? null : token.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        if (expected == null) {
            log.warn("studioflow.worker.token is not set; all /internal/ calls will be refused");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !isWorkerPath(request);
    }

    /**
     * True when either the raw URI or the path handler mapping resolves
     * (URL-decoded, ";" path parameters removed) lies under /internal.
     * Checking only the raw URI would let /internal;x=1/jobs/claim through.
     */
    static boolean isWorkerPath(HttpServletRequest request) {
        return isInternal(request.getRequestURI())
                || isInternal(UrlPathHelper.defaultInstance.getPathWithinApplication(request));
    }

    private static boolean isInternal(String path) {
        return path != null && (path.equals(INTERNAL_ROOT) || path.startsWith(INTERNAL_PREFIX));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        if (expected == null) {
            reject(request, response, "Worker access is not configured");
            return;
        }

        String provided = request.getHeader(TOKEN_HEADER);
        if (provided == null || provided.isBlank()) {
            reject(request, response, "Missing " + TOKEN_HEADER + " header");
            return;
        }

        // constant-time comparison
        if (!MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8))) {
            reject(request, response, "Invalid worker token");
            return;
        }

        chain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String message) throws IOException {
        log.warn("Refused worker call {} {} from {}: {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), message);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of(JobError.UNAUTHORIZED.name(), message));
    }
}
