package com.planverify.api.admin;

import com.planverify.api.verification.ConfidenceDecayService;
import com.planverify.api.verification.ConfidenceDecayService.DecayRecalculationOptions;
import com.planverify.api.verification.ConfidenceDecayService.DecayRecalculationStats;
import com.planverify.api.verification.ExpirationService;
import com.planverify.api.verification.ExpirationService.CleanupOptions;
import com.planverify.api.verification.ExpirationService.CleanupResult;
import com.planverify.api.verification.ExpirationService.ExpirationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Maintenance endpoints for the decay and expiry jobs. Access is checked by AdminSecretFilter.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    static final int MAX_BATCH_SIZE = 10_000;

    private final ExpirationService expirationService;
    private final ConfidenceDecayService confidenceDecayService;

    public AdminController(ExpirationService expirationService, ConfidenceDecayService confidenceDecayService) {
        this.expirationService = expirationService;
        this.confidenceDecayService = confidenceDecayService;
    }

    @PostMapping("/cleanup-expired")
    public ResponseEntity<CleanupResponse> cleanupExpired(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "1000") int batchSize) {
        requireBatchSize(batchSize);
        log.info("Admin cleanup of expired verifications requested (dryRun={}, batchSize={})", dryRun, batchSize);

        CleanupResult result = expirationService.cleanupExpiredVerifications(new CleanupOptions(dryRun, batchSize, null));
        String message = dryRun
                ? "Dry run complete. " + (result.expiredVerificationLogs() + result.expiredPlanAcceptances()) + " records would be deleted."
                : "Cleanup complete. " + (result.deletedVerificationLogs() + result.deletedPlanAcceptances()) + " records deleted.";
        return ResponseEntity.ok(new CleanupResponse(result, message));
    }

    @GetMapping("/expiration-stats")
    public ResponseEntity<ExpirationStats> expirationStats() {
        return ResponseEntity.ok(expirationService.getExpirationStats());
    }

    @PostMapping("/recalculate-confidence")
    public ResponseEntity<RecalculationResponse> recalculateConfidence(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "100") int batchSize) {
        requireBatchSize(batchSize);
        if (limit != null && limit < 1) {
            throw new InvalidAdminRequestException("limit must be positive");
        }
        log.info("Admin confidence recalculation requested (dryRun={}, limit={}, batchSize={})", dryRun, limit, batchSize);

        DecayRecalculationStats stats = confidenceDecayService.recalculateAllConfidenceScores(
                new DecayRecalculationOptions(dryRun, limit, batchSize, null, null));
        String message = (dryRun ? "Dry run complete. " : "Recalculation complete. ")
                + stats.processed() + " records processed, " + stats.updated() + " "
                + (dryRun ? "would be updated." : "updated.");
        return ResponseEntity.ok(new RecalculationResponse(stats, message));
    }

    private void requireBatchSize(int batchSize) {
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new InvalidAdminRequestException("batchSize must be between 1 and " + MAX_BATCH_SIZE);
        }
    }

    @ExceptionHandler(InvalidAdminRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidAdminRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("ADMIN_001", e.getMessage()));
    }

    public record CleanupResponse(
            CleanupResult result,
            String message
    ) {}

    public record RecalculationResponse(
            DecayRecalculationStats stats,
            String message
    ) {}

    public record ErrorResponse(
            String code,
            String message
    ) {}

    public static class InvalidAdminRequestException extends RuntimeException {
        public InvalidAdminRequestException(String message) { super(message); }
    }
}
