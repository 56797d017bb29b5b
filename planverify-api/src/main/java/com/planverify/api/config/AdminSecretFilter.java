package com.planverify.api.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards admin endpoints with a shared secret sent in the X-Admin-Secret header.
 *
 * Without a configured secret the admin surface is disabled (503). The comparison runs in
 * constant time.
 */
public class AdminSecretFilter extends OncePerRequestFilter {

    static final String HEADER = "X-Admin-Secret";
    private static final String ADMIN_PATH = "/api/v1/admin/";

    private static final Logger log = LoggerFactory.getLogger(AdminSecretFilter.class);

    private final byte[] secret;

    public AdminSecretFilter(String secret) {
        this.secret = secret == null || secret.isBlank() ? null : secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(ADMIN_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (secret == null) {
            log.warn("Admin request to {} rejected: no admin secret configured", request.getRequestURI());
            reject(response, HttpStatus.SERVICE_UNAVAILABLE, "ADMIN_002", "Admin endpoints are not configured");
            return;
        }

        String provided = request.getHeader(HEADER);
        byte[] providedBytes = provided == null ? new byte[0] : provided.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(secret, providedBytes)) {
            log.warn("Admin request to {} rejected: invalid secret from {}", request.getRequestURI(),
                    ClientAddresses.resolve(request));
            reject(response, HttpStatus.UNAUTHORIZED, "ADMIN_003", "Invalid or missing admin secret");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, HttpStatus status, String code, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"" + code + "\",\"message\":\"" + message + "\"}");
    }
}
