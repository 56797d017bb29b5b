package com.planverify.api.verification;

import com.planverify.core.repository.VerificationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Rejects repeat reports for the same provider and plan from one network address or one
 * submitter identity inside the lookback window. Only live reports count.
 */
@Component
public class SybilGuard {

    private static final Logger log = LoggerFactory.getLogger(SybilGuard.class);

    private final VerificationLogRepository verificationLogRepository;
    private final Duration window;

    public SybilGuard(VerificationLogRepository verificationLogRepository,
                      @Value("${planverify.verification.sybil-window-days:30}") long windowDays) {
        this.verificationLogRepository = verificationLogRepository;
        this.window = Duration.ofDays(windowDays);
    }

    /**
     * @throws DuplicateSubmissionException when either the address or the identity already reported this pair
     */
    public void checkDuplicateSubmission(String providerNpi, String planId, String sourceIp,
                                         String submittedBy, Instant now) {
        Instant since = now.minus(window);

        if (sourceIp != null && !sourceIp.isBlank()
                && verificationLogRepository.countRecentBySourceIp(providerNpi, planId, sourceIp, since, now) > 0) {
            log.warn("Rejected duplicate report for provider {} plan {} from address {}", providerNpi, planId, sourceIp);
            throw new DuplicateSubmissionException(
                    "You have already submitted a verification for this provider-plan pair within the last "
                            + window.toDays() + " days");
        }

        if (submittedBy != null && !submittedBy.isBlank()
                && verificationLogRepository.countRecentBySubmitter(providerNpi, planId, submittedBy, since, now) > 0) {
            log.warn("Rejected duplicate report for provider {} plan {} from a known submitter", providerNpi, planId);
            throw new DuplicateSubmissionException(
                    "This email has already submitted a verification for this provider-plan pair within the last "
                            + window.toDays() + " days");
        }
    }

    public static class DuplicateSubmissionException extends RuntimeException {
        public DuplicateSubmissionException(String message) { super(message); }
    }
}
