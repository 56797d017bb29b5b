package com.planverify.api.verification;

import com.planverify.api.confidence.ConfidenceCalculator;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceInput;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceResult;
import com.planverify.api.confidence.ConfidenceLevel;
import com.planverify.core.domain.*;
import com.planverify.core.repository.InsurancePlanRepository;
import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.ProviderRepository;
import com.planverify.core.repository.VerificationLogRepository;
import com.planverify.core.repository.VoteTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Accepts crowd reports and decides when they are strong enough to change a published
 * acceptance status.
 *
 * A status moves to ACCEPTED or NOT_ACCEPTED only when the pair has at least three live
 * reports, the provisional confidence score is at least 60, and one side outnumbers the
 * other by more than two to one. A new record always starts PENDING.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    static final int MIN_VERIFICATIONS_FOR_CONSENSUS = 3;
    static final int MIN_CONFIDENCE_FOR_STATUS_CHANGE = 60;
    static final int MAX_PAIR_VERIFICATIONS = 50;
    static final int MAX_RECENT_LIMIT = 100;

    private static final Pattern NPI_PATTERN = Pattern.compile("\\d{10}");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final ProviderRepository providerRepository;
    private final InsurancePlanRepository planRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final SybilGuard sybilGuard;
    private final ConfidenceCalculator confidenceCalculator;
    private final Clock clock;
    private final Duration ttl;

    public VerificationService(
            ProviderRepository providerRepository,
            InsurancePlanRepository planRepository,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            VerificationLogRepository verificationLogRepository,
            SybilGuard sybilGuard,
            ConfidenceCalculator confidenceCalculator,
            Clock clock,
            @Value("${planverify.verification.ttl-days:180}") long ttlDays) {
        this.providerRepository = providerRepository;
        this.planRepository = planRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.verificationLogRepository = verificationLogRepository;
        this.sybilGuard = sybilGuard;
        this.confidenceCalculator = confidenceCalculator;
        this.clock = clock;
        this.ttl = Duration.ofDays(ttlDays);
    }

    /**
     * Records a report and applies the consensus gate to the pair's acceptance record.
     *
     * @throws ProviderNotFoundException if the NPI is unknown
     * @throws PlanNotFoundException if the plan is unknown
     * @throws SybilGuard.DuplicateSubmissionException if the address or submitter already reported this pair
     */
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public SubmissionResult submitVerification(SubmitVerificationCommand command) {
        validateCommand(command);
        Instant now = clock.instant();

        Provider provider = providerRepository.findById(command.npi())
                .orElseThrow(() -> new ProviderNotFoundException("Provider not found: " + command.npi()));
        planRepository.findById(command.planId())
                .orElseThrow(() -> new PlanNotFoundException("Plan not found: " + command.planId()));

        sybilGuard.checkDuplicateSubmission(command.npi(), command.planId(), command.sourceIp(),
                command.submittedBy(), now);

        Optional<ProviderPlanAcceptance> existing =
                acceptanceRepository.findByKeyForUpdate(command.npi(), command.planId(), command.locationId());
        AcceptanceSnapshot previousValue = existing.map(AcceptanceSnapshot::of).orElse(null);

        VerificationSource source = command.source() != null ? command.source() : VerificationSource.CROWDSOURCE;
        PlanAcceptancePayload payload = new PlanAcceptancePayload(
                AcceptanceStatus.fromClaim(command.acceptsInsurance()),
                command.acceptsNewPatients(),
                command.phoneReached(),
                command.phoneCorrect(),
                command.scheduledAppointment()
        );

        VerificationLog verification = verificationLogRepository.saveAndFlush(VerificationLog.create(
                new VerificationLog.Submission(
                        command.npi(),
                        command.planId(),
                        command.locationId(),
                        source,
                        payload,
                        command.notes(),
                        command.evidenceUrl(),
                        command.submittedBy(),
                        command.sourceIp(),
                        command.userAgent()),
                previousValue,
                existing.map(ProviderPlanAcceptance::getId).orElse(null),
                now,
                ttl));

        ConsensusCounts counts = countConsensus(command.npi(), command.planId(), command.locationId(), now);
        ConfidenceResult provisional = confidenceCalculator.calculate(new ConfidenceInput(
                source.name(),
                now,
                counts.total(),
                counts.majority(),
                counts.minority(),
                provider.getPrimarySpecialty(),
                provider.getTaxonomyDescription()
        ), now);

        ProviderPlanAcceptance acceptance;
        if (existing.isPresent()) {
            acceptance = existing.get();
            AcceptanceStatus previousStatus = acceptance.getAcceptanceStatus();
            AcceptanceStatus resolved = resolveStatus(previousStatus, counts, provisional.score());
            acceptance.recordVerification(resolved, provisional.score(), source, now, ttl);
            if (resolved != previousStatus) {
                log.info("Acceptance status for provider {} plan {} changed {} -> {} (accepted={}, notAccepted={}, score={})",
                        command.npi(), command.planId(), previousStatus, resolved,
                        counts.accepted(), counts.notAccepted(), provisional.score());
            }
        } else {
            acceptance = ProviderPlanAcceptance.create(command.npi(), command.planId(), command.locationId(),
                    source, provisional.score(), now, ttl);
        }
        acceptance = acceptanceRepository.save(acceptance);
        verification.linkAcceptance(acceptance.getId());

        return new SubmissionResult(VerificationView.from(verification), AcceptanceView.from(acceptance));
    }

    /**
     * Consensus gate. Returns the status the record should carry after a new report.
     */
    static AcceptanceStatus resolveStatus(AcceptanceStatus current, ConsensusCounts counts, int provisionalScore) {
        boolean clearMajority = counts.accepted() > counts.notAccepted() * 2L
                || counts.notAccepted() > counts.accepted() * 2L;
        boolean consensus = counts.total() >= MIN_VERIFICATIONS_FOR_CONSENSUS
                && provisionalScore >= MIN_CONFIDENCE_FOR_STATUS_CHANGE
                && clearMajority;

        if (consensus) {
            return counts.accepted() > counts.notAccepted() ? AcceptanceStatus.ACCEPTED : AcceptanceStatus.NOT_ACCEPTED;
        }
        if (current == null || current == AcceptanceStatus.UNKNOWN) {
            return AcceptanceStatus.PENDING;
        }
        return current;
    }

    private ConsensusCounts countConsensus(String npi, String planId, Long locationId, Instant now) {
        int accepted = 0;
        int notAccepted = 0;
        for (VerificationLog report : verificationLogRepository.findLiveForPair(
                npi, planId, VerificationType.PLAN_ACCEPTANCE, now)) {
            if (!Objects.equals(report.getLocationId(), locationId)) {
                continue;
            }
            AcceptanceStatus claimed = report.claimedStatus();
            if (claimed == AcceptanceStatus.ACCEPTED) {
                accepted++;
            } else if (claimed == AcceptanceStatus.NOT_ACCEPTED) {
                notAccepted++;
            }
        }
        return new ConsensusCounts(accepted, notAccepted);
    }

    /**
     * Acceptance record, recent reports and vote summary for one provider-plan pair.
     * <p>
     * Only the acceptance record is chosen by location. Reports and the summary span every
     * location of the pair, as the Sybil window and expiry backing do. The report list holds the
     * newest {@value #MAX_PAIR_VERIFICATIONS}; the summary counts all of them.
     */
    @Transactional(readOnly = true)
    public PairAggregate getAggregateForPair(String npi, String planId, Long locationId, boolean includeExpired) {
        if (!providerRepository.existsById(npi)) {
            throw new ProviderNotFoundException("Provider not found: " + npi);
        }
        if (!planRepository.existsById(planId)) {
            throw new PlanNotFoundException("Plan not found: " + planId);
        }
        Instant now = clock.instant();

        Optional<ProviderPlanAcceptance> acceptance = acceptanceRepository.findByKey(npi, planId, locationId);
        List<VerificationView> verifications = verificationLogRepository
                .findForPair(npi, planId, includeExpired, now, PageRequest.of(0, MAX_PAIR_VERIFICATIONS))
                .stream()
                .map(VerificationView::from)
                .toList();

        VoteTotals votes = verificationLogRepository.sumVotesForPair(npi, planId, includeExpired, now);
        if (votes == null) {
            votes = VoteTotals.NONE;
        }
        PairSummary summary = new PairSummary(
                verificationLogRepository.countForPair(npi, planId, includeExpired, now),
                votes.upvotes(),
                votes.downvotes()
        );

        return new PairAggregate(
                npi,
                planId,
                acceptance.map(AcceptanceView::from).orElse(null),
                acceptance.map(a -> a.isExpired(now)).orElse(false),
                verifications,
                summary
        );
    }

    @Transactional(readOnly = true)
    public List<VerificationView> getRecentVerifications(int limit, String npi, String planId, boolean includeExpired) {
        int pageSize = Math.max(1, Math.min(limit, MAX_RECENT_LIMIT));
        return verificationLogRepository
                .findRecent(blankToNull(npi), blankToNull(planId), includeExpired, clock.instant(), PageRequest.of(0, pageSize))
                .stream()
                .map(VerificationView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public VerificationStats getVerificationStats() {
        Instant now = clock.instant();
        Map<VerificationType, Long> byType = new EnumMap<>(VerificationType.class);
        for (VerificationType type : VerificationType.values()) {
            byType.put(type, verificationLogRepository.countByVerificationType(type));
        }
        return new VerificationStats(
                verificationLogRepository.count(),
                verificationLogRepository.countByCreatedAtAfter(now.minus(Duration.ofHours(24))),
                verificationLogRepository.countLive(now),
                byType
        );
    }

    private void validateCommand(SubmitVerificationCommand command) {
        if (command == null) throw new InvalidVerificationRequestException("Verification is required");
        if (command.npi() == null || !NPI_PATTERN.matcher(command.npi()).matches()) throw new InvalidVerificationRequestException("NPI must be exactly 10 digits");
        if (command.planId() == null || command.planId().isBlank() || command.planId().length() > 50) throw new InvalidVerificationRequestException("Plan ID must be 1-50 characters");
        if (command.acceptsInsurance() == null) throw new InvalidVerificationRequestException("acceptsInsurance is required");
        if (command.notes() != null && command.notes().length() > 1000) throw new InvalidVerificationRequestException("Notes must be at most 1000 characters");
        if (command.evidenceUrl() != null && (command.evidenceUrl().length() > 500 || !isHttpUrl(command.evidenceUrl()))) throw new InvalidVerificationRequestException("Evidence URL must be an http(s) URL of at most 500 characters");
        if (command.submittedBy() != null && (command.submittedBy().length() > 200 || !EMAIL_PATTERN.matcher(command.submittedBy()).matches())) throw new InvalidVerificationRequestException("submittedBy must be a valid email");
    }

    private static boolean isHttpUrl(String value) {
        try {
            String scheme = URI.create(value).getScheme();
            return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record SubmitVerificationCommand(
            String npi,
            String planId,
            Long locationId,
            Boolean acceptsInsurance,
            Boolean acceptsNewPatients,
            Boolean phoneReached,
            Boolean phoneCorrect,
            Boolean scheduledAppointment,
            String notes,
            String evidenceUrl,
            String submittedBy,
            String sourceIp,
            String userAgent,
            VerificationSource source
    ) {}

    record ConsensusCounts(int accepted, int notAccepted) {
        int total() { return accepted + notAccepted; }
        int majority() { return Math.max(accepted, notAccepted); }
        int minority() { return Math.min(accepted, notAccepted); }
    }

    public record SubmissionResult(
            VerificationView verification,
            AcceptanceView acceptance
    ) {}

    /**
     * Report as exposed outside the service. Submitter address, user agent and identity are never included.
     */
    public record VerificationView(
            UUID id,
            String providerNpi,
            String planId,
            Long locationId,
            Long acceptanceId,
            VerificationType verificationType,
            VerificationSource verificationSource,
            AcceptanceSnapshot previousValue,
            VerificationPayload newValue,
            String notes,
            String evidenceUrl,
            int upvotes,
            int downvotes,
            Instant createdAt,
            Instant expiresAt
    ) {
        public static VerificationView from(VerificationLog log) {
            return new VerificationView(
                    log.getId(),
                    log.getProviderNpi(),
                    log.getPlanId(),
                    log.getLocationId(),
                    log.getAcceptanceId(),
                    log.getVerificationType(),
                    log.getVerificationSource(),
                    log.getPreviousValue(),
                    log.getNewValue(),
                    log.getNotes(),
                    log.getEvidenceUrl(),
                    log.getUpvotes(),
                    log.getDownvotes(),
                    log.getCreatedAt(),
                    log.getExpiresAt()
            );
        }

        public int netVotes() {
            return upvotes - downvotes;
        }
    }

    public record AcceptanceView(
            Long id,
            String providerNpi,
            String planId,
            Long locationId,
            AcceptanceStatus acceptanceStatus,
            int confidenceScore,
            ConfidenceLevel confidenceLevel,
            String confidenceDescription,
            VerificationSource verificationSource,
            Instant lastVerified,
            int verificationCount,
            Instant expiresAt
    ) {
        public static AcceptanceView from(ProviderPlanAcceptance acceptance) {
            ConfidenceLevel level = ConfidenceLevel.of(acceptance.getConfidenceScore(), acceptance.getVerificationCount());
            return new AcceptanceView(
                    acceptance.getId(),
                    acceptance.getProviderNpi(),
                    acceptance.getPlanId(),
                    acceptance.getLocationId(),
                    acceptance.getAcceptanceStatus(),
                    acceptance.getConfidenceScore(),
                    level,
                    level.describe(acceptance.getVerificationCount()),
                    acceptance.getVerificationSource(),
                    acceptance.getLastVerified(),
                    acceptance.getVerificationCount(),
                    acceptance.getExpiresAt()
            );
        }
    }

    public record PairSummary(
            long totalVerifications,
            long totalUpvotes,
            long totalDownvotes
    ) {}

    public record PairAggregate(
            String npi,
            String planId,
            AcceptanceView acceptance,
            boolean acceptanceExpired,
            List<VerificationView> verifications,
            PairSummary summary
    ) {}

    public record VerificationStats(
            long total,
            long recentCount,
            long liveCount,
            Map<VerificationType, Long> byType
    ) {}

    public static class ProviderNotFoundException extends RuntimeException {
        public ProviderNotFoundException(String message) { super(message); }
    }

    public static class PlanNotFoundException extends RuntimeException {
        public PlanNotFoundException(String message) { super(message); }
    }

    public static class InvalidVerificationRequestException extends RuntimeException {
        public InvalidVerificationRequestException(String message) { super(message); }
    }
}
