package com.planverify.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;

/**
 * Published acceptance status of one provider for one plan, optionally scoped to a location.
 *
 * Status leaves PENDING only through the consensus gate applied by the verification service.
 * Verification count never decreases; the record is removed by the expiry job instead.
 */
@Entity
@Table(name = "provider_plan_acceptance", indexes = {
    @Index(name = "idx_ppa_pair", columnList = "provider_npi, plan_id"),
    @Index(name = "idx_ppa_status", columnList = "acceptance_status"),
    @Index(name = "idx_ppa_expires_at", columnList = "expires_at")
})
public class ProviderPlanAcceptance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "provider_npi", nullable = false, length = 10)
    private String providerNpi;

    @NotNull
    @Column(name = "plan_id", nullable = false, length = 50)
    private String planId;

    @Column(name = "location_id")
    private Long locationId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "acceptance_status", nullable = false, length = 20)
    private AcceptanceStatus acceptanceStatus;

    @Min(0)
    @Max(100)
    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_source", length = 30)
    private VerificationSource verificationSource;

    @Column(name = "last_verified")
    private Instant lastVerified;

    @Column(name = "verification_count", nullable = false)
    private int verificationCount;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ProviderPlanAcceptance() {}

    /**
     * Creates the record for a pair's first report. A single report never decides the status.
     */
    public static ProviderPlanAcceptance create(String providerNpi, String planId, Long locationId,
                                                VerificationSource source, int confidenceScore,
                                                Instant now, Duration ttl) {
        ProviderPlanAcceptance acceptance = new ProviderPlanAcceptance();
        acceptance.providerNpi = providerNpi;
        acceptance.planId = planId;
        acceptance.locationId = locationId;
        acceptance.acceptanceStatus = AcceptanceStatus.PENDING;
        acceptance.confidenceScore = confidenceScore;
        acceptance.verificationSource = source;
        acceptance.lastVerified = now;
        acceptance.verificationCount = 1;
        acceptance.expiresAt = now.plus(ttl);
        acceptance.createdAt = now;
        acceptance.updatedAt = now;
        return acceptance;
    }

    /**
     * Applies a new report: refreshes verification time, count and TTL.
     */
    public void recordVerification(AcceptanceStatus resolvedStatus, int confidenceScore,
                                   VerificationSource source, Instant now, Duration ttl) {
        this.acceptanceStatus = resolvedStatus;
        this.confidenceScore = confidenceScore;
        this.verificationSource = source;
        this.lastVerified = now;
        this.verificationCount++;
        this.expiresAt = now.plus(ttl);
        this.updatedAt = now;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    // Getters
    public Long getId() { return id; }
    public String getProviderNpi() { return providerNpi; }
    public String getPlanId() { return planId; }
    public Long getLocationId() { return locationId; }
    public AcceptanceStatus getAcceptanceStatus() { return acceptanceStatus; }
    public int getConfidenceScore() { return confidenceScore; }
    public VerificationSource getVerificationSource() { return verificationSource; }
    public Instant getLastVerified() { return lastVerified; }
    public int getVerificationCount() { return verificationCount; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
