package com.planverify.api.verification;

import com.planverify.api.confidence.ConfidenceCalculator;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceInput;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceResult;
import com.planverify.api.verification.VerificationService.VerificationView;
import com.planverify.core.domain.Provider;
import com.planverify.core.domain.ProviderPlanAcceptance;
import com.planverify.core.domain.VerificationLog;
import com.planverify.core.domain.VoteDirection;
import com.planverify.core.domain.VoteLog;
import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.ProviderRepository;
import com.planverify.core.repository.VerificationLogRepository;
import com.planverify.core.repository.VoteLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * One vote per report per voter address. Votes move confidence, never the published status.
 */
@Service
public class VoteService {

    private static final Logger log = LoggerFactory.getLogger(VoteService.class);

    private final VerificationLogRepository verificationLogRepository;
    private final VoteLogRepository voteLogRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final ProviderRepository providerRepository;
    private final ConfidenceCalculator confidenceCalculator;
    private final Clock clock;

    public VoteService(
            VerificationLogRepository verificationLogRepository,
            VoteLogRepository voteLogRepository,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            ProviderRepository providerRepository,
            ConfidenceCalculator confidenceCalculator,
            Clock clock) {
        this.verificationLogRepository = verificationLogRepository;
        this.voteLogRepository = voteLogRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.providerRepository = providerRepository;
        this.confidenceCalculator = confidenceCalculator;
        this.clock = clock;
    }

    /**
     * Records or flips a vote and refreshes the linked acceptance record's confidence score.
     *
     * @throws InvalidVoteException if the voter address or direction is missing
     * @throws VerificationNotFoundException if the report does not exist
     * @throws DuplicateVoteException if the address already voted the same way
     * @throws VoteConflictException if the report's counters disagree with its stored votes
     */
    @Transactional
    public VoteResult vote(UUID verificationId, VoteDirection direction, String sourceIp) {
        if (sourceIp == null || sourceIp.isBlank()) {
            throw new InvalidVoteException("Source IP is required for voting");
        }
        if (direction == null) {
            throw new InvalidVoteException("Vote direction is required");
        }
        if (verificationId == null) {
            throw new VerificationNotFoundException("Verification not found");
        }

        // Holds the report row until commit; a racing vote from the same address then sees this one
        VerificationLog verification = verificationLogRepository.lockById(verificationId)
                .orElseThrow(() -> new VerificationNotFoundException("Verification not found: " + verificationId));
        Instant now = clock.instant();

        Optional<VoteLog> existingVote = voteLogRepository.findByVerification_IdAndSourceIp(verificationId, sourceIp);
        boolean voteChanged = false;

        if (existingVote.isPresent()) {
            VoteLog vote = existingVote.get();
            if (vote.getVote() == direction) {
                throw new DuplicateVoteException("You have already voted on this verification");
            }
            vote.flipTo(direction);
            voteLogRepository.save(vote);
            int moved = direction == VoteDirection.UP
                    ? verificationLogRepository.moveVoteFromDownToUp(verificationId)
                    : verificationLogRepository.moveVoteFromUpToDown(verificationId);
            if (moved == 0) {
                log.warn("Report {} has no {} vote to move for a flip to {}",
                        verificationId, direction == VoteDirection.UP ? "down" : "up", direction);
                throw new VoteConflictException("Vote counters are out of step for verification: " + verificationId);
            }
            voteChanged = true;
        } else {
            voteLogRepository.save(VoteLog.create(verification, sourceIp, direction, now));
            if (direction == VoteDirection.UP) {
                verificationLogRepository.incrementUpvotes(verificationId);
            } else {
                verificationLogRepository.incrementDownvotes(verificationId);
            }
        }

        VerificationLog updated = verificationLogRepository.findById(verificationId)
                .orElseThrow(() -> new VerificationNotFoundException("Verification not found after update: " + verificationId));

        refreshAcceptanceConfidence(updated, now);

        return new VoteResult(VerificationView.from(updated), voteChanged);
    }

    private void refreshAcceptanceConfidence(VerificationLog verification, Instant now) {
        if (verification.getAcceptanceId() == null) {
            return;
        }
        Optional<ProviderPlanAcceptance> found = acceptanceRepository.findById(verification.getAcceptanceId());
        if (found.isEmpty()) {
            log.debug("Report {} points at acceptance {} which no longer exists",
                    verification.getId(), verification.getAcceptanceId());
            return;
        }
        ProviderPlanAcceptance acceptance = found.get();
        Optional<Provider> provider = providerRepository.findById(acceptance.getProviderNpi());

        ConfidenceResult result = confidenceCalculator.calculate(new ConfidenceInput(
                acceptance.getVerificationSource() != null ? acceptance.getVerificationSource().name() : null,
                acceptance.getLastVerified(),
                acceptance.getVerificationCount(),
                verification.getUpvotes(),
                verification.getDownvotes(),
                provider.map(Provider::getPrimarySpecialty).orElse(null),
                provider.map(Provider::getTaxonomyDescription).orElse(null)
        ), now);

        if (result.score() != acceptance.getConfidenceScore()) {
            acceptanceRepository.updateConfidenceScore(acceptance.getId(), result.score(), now);
        }
    }

    public record VoteResult(
            VerificationView verification,
            boolean voteChanged
    ) {}

    public static class InvalidVoteException extends RuntimeException {
        public InvalidVoteException(String message) { super(message); }
    }

    public static class VerificationNotFoundException extends RuntimeException {
        public VerificationNotFoundException(String message) { super(message); }
    }

    public static class DuplicateVoteException extends RuntimeException {
        public DuplicateVoteException(String message) { super(message); }
    }

    public static class VoteConflictException extends RuntimeException {
        public VoteConflictException(String message) { super(message); }
    }
}
