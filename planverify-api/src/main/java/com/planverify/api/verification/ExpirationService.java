package com.planverify.api.verification;

import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.VerificationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Removes reports and acceptance records whose TTL has elapsed.
 *
 * Reports go first; their votes are removed by the foreign key cascade. An acceptance record
 * is removed only once no live report for its provider and plan remains. Re-running with
 * nothing expired deletes nothing.
 */
@Service
public class ExpirationService {

    private static final Logger log = LoggerFactory.getLogger(ExpirationService.class);

    static final int DEFAULT_BATCH_SIZE = 1000;

    private final VerificationLogRepository verificationLogRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ExpirationService(
            VerificationLogRepository verificationLogRepository,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.verificationLogRepository = verificationLogRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public CleanupResult cleanupExpiredVerifications(CleanupOptions options) {
        int batchSize = options.batchSize() > 0 ? options.batchSize() : DEFAULT_BATCH_SIZE;
        Instant now = clock.instant();

        long expiredLogs = verificationLogRepository.countExpired(now);
        long expiredAcceptances = acceptanceRepository.countExpiredUnbacked(now);

        log.info("Expired records found: verificationLogs={}, planAcceptances={}, dryRun={}",
                expiredLogs, expiredAcceptances, options.dryRun());

        if (options.dryRun()) {
            return new CleanupResult(true, expiredLogs, expiredAcceptances, 0, 0, false);
        }

        long deletedLogs = 0;
        long deletedAcceptances = 0;
        boolean cancelled = false;

        while (true) {
            if (pastDeadline(options.deadline())) {
                cancelled = true;
                break;
            }
            List<UUID> ids = verificationLogRepository.findExpiredIds(now, PageRequest.of(0, batchSize));
            if (!ids.isEmpty()) {
                transactionTemplate.executeWithoutResult(status -> verificationLogRepository.deleteAllByIdInBatch(ids));
                deletedLogs += ids.size();
            }
            if (ids.size() < batchSize) {
                break;
            }
        }

        while (!cancelled) {
            if (pastDeadline(options.deadline())) {
                cancelled = true;
                break;
            }
            List<Long> ids = acceptanceRepository.findExpiredUnbackedIds(now, PageRequest.of(0, batchSize));
            if (!ids.isEmpty()) {
                transactionTemplate.executeWithoutResult(status -> acceptanceRepository.deleteAllByIdInBatch(ids));
                deletedAcceptances += ids.size();
            }
            if (ids.size() < batchSize) {
                break;
            }
        }

        if (cancelled) {
            log.warn("Expired record cleanup stopped at deadline: deletedLogs={}, deletedAcceptances={}",
                    deletedLogs, deletedAcceptances);
        } else {
            log.info("Expired record cleanup complete: deletedLogs={}, deletedAcceptances={}",
                    deletedLogs, deletedAcceptances);
        }
        return new CleanupResult(false, expiredLogs, expiredAcceptances, deletedLogs, deletedAcceptances, cancelled);
    }

    @Transactional(readOnly = true)
    public ExpirationStats getExpirationStats() {
        Instant now = clock.instant();
        Instant in7Days = now.plus(Duration.ofDays(7));
        Instant in30Days = now.plus(Duration.ofDays(30));

        return new ExpirationStats(
                new TableStats(
                        verificationLogRepository.count(),
                        verificationLogRepository.countByExpiresAtIsNotNull(),
                        verificationLogRepository.countExpired(now),
                        verificationLogRepository.countExpiringBetween(now, in7Days),
                        verificationLogRepository.countExpiringBetween(now, in30Days)),
                new TableStats(
                        acceptanceRepository.count(),
                        acceptanceRepository.countByExpiresAtIsNotNull(),
                        acceptanceRepository.countExpired(now),
                        acceptanceRepository.countExpiringBetween(now, in7Days),
                        acceptanceRepository.countExpiringBetween(now, in30Days))
        );
    }

    private boolean pastDeadline(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public record CleanupOptions(
            boolean dryRun,
            int batchSize,
            Instant deadline
    ) {
        public static CleanupOptions defaults() {
            return new CleanupOptions(false, DEFAULT_BATCH_SIZE, null);
        }
    }

    public record CleanupResult(
            boolean dryRun,
            long expiredVerificationLogs,
            long expiredPlanAcceptances,
            long deletedVerificationLogs,
            long deletedPlanAcceptances,
            boolean cancelled
    ) {}

    public record TableStats(
            long total,
            long withTtl,
            long expired,
            long expiringWithin7Days,
            long expiringWithin30Days
    ) {}

    public record ExpirationStats(
            TableStats verificationLogs,
            TableStats planAcceptances
    ) {}
}
