package com.planverify.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only crowd report about a provider-plan pair.
 *
 * Submitter identity and network address are written once at creation. Vote counters are
 * changed only through the atomic update queries in VerificationLogRepository.
 */
@Entity
@Table(name = "verification_logs", indexes = {
    @Index(name = "idx_vl_pair", columnList = "provider_npi, plan_id"),
    @Index(name = "idx_vl_source_ip", columnList = "source_ip"),
    @Index(name = "idx_vl_submitted_by", columnList = "submitted_by"),
    @Index(name = "idx_vl_created_at", columnList = "created_at"),
    @Index(name = "idx_vl_expires_at", columnList = "expires_at")
})
public class VerificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "provider_npi", nullable = false, length = 10, updatable = false)
    private String providerNpi;

    @NotNull
    @Column(name = "plan_id", nullable = false, length = 50, updatable = false)
    private String planId;

    @Column(name = "location_id", updatable = false)
    private Long locationId;

    @Column(name = "acceptance_id")
    private Long acceptanceId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_type", nullable = false, length = 30, updatable = false)
    private VerificationType verificationType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_source", nullable = false, length = 30, updatable = false)
    private VerificationSource verificationSource;

    @Convert(converter = AcceptanceSnapshotConverter.class)
    @Column(name = "previous_value", columnDefinition = "TEXT", updatable = false)
    private AcceptanceSnapshot previousValue;

    @Convert(converter = VerificationPayloadConverter.class)
    @Column(name = "new_value", columnDefinition = "TEXT", updatable = false)
    private VerificationPayload newValue;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String notes;

    @Column(name = "evidence_url", length = 500, updatable = false)
    private String evidenceUrl;

    @Column(name = "submitted_by", length = 200, updatable = false)
    private String submittedBy;

    @Column(name = "source_ip", length = 50, updatable = false)
    private String sourceIp;

    @Column(name = "user_agent", length = 500, updatable = false)
    private String userAgent;

    @Column(nullable = false)
    private int upvotes;

    @Column(nullable = false)
    private int downvotes;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    protected VerificationLog() {}

    public static VerificationLog create(Submission submission, AcceptanceSnapshot previousValue,
                                         Long acceptanceId, Instant now, Duration ttl) {
        VerificationLog log = new VerificationLog();
        log.providerNpi = submission.providerNpi();
        log.planId = submission.planId();
        log.locationId = submission.locationId();
        log.acceptanceId = acceptanceId;
        log.verificationType = submission.payload().type();
        log.verificationSource = submission.source();
        log.previousValue = previousValue;
        log.newValue = submission.payload();
        log.notes = submission.notes();
        log.evidenceUrl = submission.evidenceUrl();
        log.submittedBy = submission.submittedBy();
        log.sourceIp = submission.sourceIp();
        log.userAgent = submission.userAgent();
        log.upvotes = 0;
        log.downvotes = 0;
        log.createdAt = now;
        log.expiresAt = now.plus(ttl);
        return log;
    }

    /**
     * Links the report to the acceptance record it contributed to.
     */
    public void linkAcceptance(Long acceptanceId) {
        this.acceptanceId = acceptanceId;
    }

    /**
     * Status claimed by this report, or null when the payload carries none.
     */
    public AcceptanceStatus claimedStatus() {
        if (newValue instanceof PlanAcceptancePayload payload) {
            return payload.acceptanceStatus();
        }
        return null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    // Getters
    public UUID getId() { return id; }
    public String getProviderNpi() { return providerNpi; }
    public String getPlanId() { return planId; }
    public Long getLocationId() { return locationId; }
    public Long getAcceptanceId() { return acceptanceId; }
    public VerificationType getVerificationType() { return verificationType; }
    public VerificationSource getVerificationSource() { return verificationSource; }
    public AcceptanceSnapshot getPreviousValue() { return previousValue; }
    public VerificationPayload getNewValue() { return newValue; }
    public String getNotes() { return notes; }
    public String getEvidenceUrl() { return evidenceUrl; }
    public String getSubmittedBy() { return submittedBy; }
    public String getSourceIp() { return sourceIp; }
    public String getUserAgent() { return userAgent; }
    public int getUpvotes() { return upvotes; }
    public int getDownvotes() { return downvotes; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }

    /**
     * Write-once fields of a new report.
     */
    public record Submission(
            String providerNpi,
            String planId,
            Long locationId,
            VerificationSource source,
            VerificationPayload payload,
            String notes,
            String evidenceUrl,
            String submittedBy,
            String sourceIp,
            String userAgent
    ) {}
}
