package com.planverify.api.config;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces per-address rate limits and answers 429 when a bucket is empty.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String clientId = ClientAddresses.resolve(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining",
                String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = probe.getNanosToWaitForRefill() / 1_000_000_000;
        log.warn("Rate limit exceeded for {} on {} {}", clientId, request.getMethod(), request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_001\",\"message\":\"Rate limit exceeded. Retry after " + waitForRefill + " seconds.\"}");
        return false;
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        String path = request.getRequestURI();

        if ("POST".equals(request.getMethod())) {
            if (path.matches(".*/api/v1/verify/?$")) {
                return rateLimitConfig.resolveVerificationBucket(clientId);
            }
            if (path.matches(".*/api/v1/verify/[^/]+/vote/?$")) {
                return rateLimitConfig.resolveVoteBucket(clientId);
            }
        }

        return rateLimitConfig.resolveBucket(clientId);
    }
}
