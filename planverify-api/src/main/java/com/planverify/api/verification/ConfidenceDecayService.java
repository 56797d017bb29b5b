package com.planverify.api.verification;

import com.planverify.api.confidence.ConfidenceCalculator;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceInput;
import com.planverify.core.domain.Provider;
import com.planverify.core.domain.ProviderPlanAcceptance;
import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.ProviderRepository;
import com.planverify.core.repository.VerificationLogRepository;
import com.planverify.core.repository.VoteTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Recomputes stored confidence scores so time decay shows up without waiting for a new report.
 *
 * Records with at least one verification are walked in id order with a cursor. Each changed
 * score is written in its own short transaction, so a cancelled or failed run never leaves a
 * row half-updated.
 */
@Service
public class ConfidenceDecayService {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceDecayService.class);

    static final int DEFAULT_BATCH_SIZE = 100;

    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final ProviderRepository providerRepository;
    private final ConfidenceCalculator confidenceCalculator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ConfidenceDecayService(
            ProviderPlanAcceptanceRepository acceptanceRepository,
            VerificationLogRepository verificationLogRepository,
            ProviderRepository providerRepository,
            ConfidenceCalculator confidenceCalculator,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.acceptanceRepository = acceptanceRepository;
        this.verificationLogRepository = verificationLogRepository;
        this.providerRepository = providerRepository;
        this.confidenceCalculator = confidenceCalculator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public DecayRecalculationStats recalculateAllConfidenceScores(DecayRecalculationOptions options) {
        long started = System.nanoTime();
        int batchSize = options.batchSize() > 0 ? options.batchSize() : DEFAULT_BATCH_SIZE;

        long totalCount = acceptanceRepository.countVerified();
        long effectiveLimit = options.limit() != null ? Math.min(options.limit(), totalCount) : totalCount;

        log.info("Starting confidence recalculation: total={}, limit={}, dryRun={}, batchSize={}",
                totalCount, effectiveLimit, options.dryRun(), batchSize);

        long processed = 0;
        long updated = 0;
        long unchanged = 0;
        long errors = 0;
        boolean cancelled = false;
        long cursor = 0L;

        while (processed < effectiveLimit) {
            if (options.deadline() != null && !clock.instant().isBefore(options.deadline())) {
                cancelled = true;
                log.warn("Confidence recalculation stopped at deadline after {} records", processed);
                break;
            }

            int take = (int) Math.min(batchSize, effectiveLimit - processed);
            List<ProviderPlanAcceptance> batch = acceptanceRepository.findVerifiedAfter(cursor, PageRequest.of(0, take));
            if (batch.isEmpty()) {
                break;
            }

            for (ProviderPlanAcceptance acceptance : batch) {
                try {
                    int newScore = recomputeScore(acceptance, clock.instant());
                    if (newScore != acceptance.getConfidenceScore()) {
                        if (!options.dryRun()) {
                            transactionTemplate.executeWithoutResult(status ->
                                    acceptanceRepository.updateConfidenceScore(acceptance.getId(), newScore, clock.instant()));
                        }
                        updated++;
                    } else {
                        unchanged++;
                    }
                } catch (RuntimeException e) {
                    errors++;
                    log.error("Error recalculating confidence for acceptance record {}", acceptance.getId(), e);
                }
                processed++;
            }

            cursor = batch.get(batch.size() - 1).getId();

            if (options.onProgress() != null) {
                options.onProgress().accept(processed, updated);
            }
        }

        long durationMs = (System.nanoTime() - started) / 1_000_000;
        DecayRecalculationStats stats = new DecayRecalculationStats(processed, updated, unchanged, errors, durationMs, cancelled);
        log.info("Confidence recalculation complete: {} (dryRun={})", stats, options.dryRun());
        return stats;
    }

    private int recomputeScore(ProviderPlanAcceptance acceptance, Instant now) {
        VoteTotals votes = verificationLogRepository.sumVotesForPair(acceptance.getProviderNpi(), acceptance.getPlanId(), false, now);
        if (votes == null) {
            votes = VoteTotals.NONE;
        }
        Optional<Provider> provider = providerRepository.findById(acceptance.getProviderNpi());

        return confidenceCalculator.calculate(new ConfidenceInput(
                acceptance.getVerificationSource() != null ? acceptance.getVerificationSource().name() : null,
                acceptance.getLastVerified(),
                acceptance.getVerificationCount(),
                votes.upvotes(),
                votes.downvotes(),
                provider.map(Provider::getPrimarySpecialty).orElse(null),
                provider.map(Provider::getTaxonomyDescription).orElse(null)
        ), now).score();
    }

    /**
     * @param limit      maximum records to process, or null for all
     * @param onProgress called after each batch with (processed, updated)
     * @param deadline   checked before each batch; null means no deadline
     */
    public record DecayRecalculationOptions(
            boolean dryRun,
            Integer limit,
            int batchSize,
            BiConsumer<Long, Long> onProgress,
            Instant deadline
    ) {
        public static DecayRecalculationOptions defaults() {
            return new DecayRecalculationOptions(false, null, DEFAULT_BATCH_SIZE, null, null);
        }
    }

    public record DecayRecalculationStats(
            long processed,
            long updated,
            long unchanged,
            long errors,
            long durationMs,
            boolean cancelled
    ) {}
}
