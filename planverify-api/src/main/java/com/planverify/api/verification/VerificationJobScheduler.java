package com.planverify.api.verification;

import com.planverify.api.verification.ConfidenceDecayService.DecayRecalculationOptions;
import com.planverify.api.verification.ConfidenceDecayService.DecayRecalculationStats;
import com.planverify.api.verification.ExpirationService.CleanupOptions;
import com.planverify.api.verification.ExpirationService.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Scheduled decay and expiry jobs. Each run stops cleanly once its time budget is spent.
 */
@Component
@ConditionalOnProperty(prefix = "planverify.jobs", name = "enabled", havingValue = "true")
public class VerificationJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(VerificationJobScheduler.class);

    private final ConfidenceDecayService confidenceDecayService;
    private final ExpirationService expirationService;
    private final Clock clock;
    private final Duration maxRuntime;

    public VerificationJobScheduler(
            ConfidenceDecayService confidenceDecayService,
            ExpirationService expirationService,
            Clock clock,
            @Value("${planverify.jobs.max-runtime-minutes:30}") long maxRuntimeMinutes) {
        this.confidenceDecayService = confidenceDecayService;
        this.expirationService = expirationService;
        this.clock = clock;
        this.maxRuntime = Duration.ofMinutes(maxRuntimeMinutes);
    }

    /**
     * Daily at 03:00 by default.
     */
    @Scheduled(cron = "${planverify.jobs.decay-cron:0 0 3 * * *}")
    public void recalculateConfidenceScores() {
        log.info("=== Scheduled Job: Recalculate Confidence Scores ===");
        try {
            DecayRecalculationStats stats = confidenceDecayService.recalculateAllConfidenceScores(
                    new DecayRecalculationOptions(false, null, ConfidenceDecayService.DEFAULT_BATCH_SIZE,
                            (processed, updated) -> log.debug("Recalculated {} records, {} updated", processed, updated),
                            clock.instant().plus(maxRuntime)));
            if (stats.errors() > 0) {
                log.warn("Confidence recalculation finished with {} errors", stats.errors());
            }
        } catch (Exception e) {
            log.error("Error recalculating confidence scores", e);
        }
    }

    /**
     * Daily at 04:00 by default.
     */
    @Scheduled(cron = "${planverify.jobs.cleanup-cron:0 0 4 * * *}")
    public void cleanupExpiredVerifications() {
        log.info("=== Scheduled Job: Cleanup Expired Verifications ===");
        try {
            CleanupResult result = expirationService.cleanupExpiredVerifications(
                    new CleanupOptions(false, ExpirationService.DEFAULT_BATCH_SIZE, clock.instant().plus(maxRuntime)));
            if (result.cancelled()) {
                log.warn("Expired verification cleanup did not finish within {} minutes", maxRuntime.toMinutes());
            }
        } catch (Exception e) {
            log.error("Error cleaning up expired verifications", e);
        }
    }
}
