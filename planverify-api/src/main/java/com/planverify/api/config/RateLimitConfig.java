package com.planverify.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client request buckets using Bucket4j.
 *
 * Report submissions and votes have their own hourly buckets; everything else shares the
 * default bucket. Buckets are an HTTP-surface throttle only; duplicate detection lives in
 * the store.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final long verificationsPerHour;
    private final long votesPerHour;
    private final long defaultPerHour;

    public RateLimitConfig(
            @Value("${planverify.rate-limit.verifications-per-hour:10}") long verificationsPerHour,
            @Value("${planverify.rate-limit.votes-per-hour:10}") long votesPerHour,
            @Value("${planverify.rate-limit.default-per-hour:200}") long defaultPerHour) {
        this.verificationsPerHour = verificationsPerHour;
        this.votesPerHour = votesPerHour;
        this.defaultPerHour = defaultPerHour;
    }

    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> hourly(defaultPerHour));
    }

    public Bucket resolveVerificationBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":verify", key -> hourly(verificationsPerHour));
    }

    public Bucket resolveVoteBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":vote", key -> hourly(votesPerHour));
    }

    private Bucket hourly(long capacity) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofHours(1)));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Drops every bucket held for a client address.
     */
    public void clearBucket(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":verify");
        buckets.remove(clientId + ":vote");
    }
}
