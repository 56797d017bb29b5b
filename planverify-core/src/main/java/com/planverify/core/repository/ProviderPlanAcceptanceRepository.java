package com.planverify.core.repository;

import com.planverify.core.domain.ProviderPlanAcceptance;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for provider-plan acceptance records.
 *
 * A record is identified by (provider NPI, plan id, location id) where an absent location
 * is its own key, distinct from every concrete location.
 */
@Repository
public interface ProviderPlanAcceptanceRepository extends JpaRepository<ProviderPlanAcceptance, Long> {

    Optional<ProviderPlanAcceptance> findByProviderNpiAndPlanIdAndLocationId(
            String providerNpi, String planId, Long locationId);

    Optional<ProviderPlanAcceptance> findByProviderNpiAndPlanIdAndLocationIdIsNull(
            String providerNpi, String planId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ProviderPlanAcceptance a WHERE a.providerNpi = :npi AND a.planId = :planId AND a.locationId = :locationId")
    Optional<ProviderPlanAcceptance> lockByKey(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("locationId") Long locationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ProviderPlanAcceptance a WHERE a.providerNpi = :npi AND a.planId = :planId AND a.locationId IS NULL")
    Optional<ProviderPlanAcceptance> lockByKeyWithoutLocation(
            @Param("npi") String providerNpi,
            @Param("planId") String planId);

    /**
     * Exact-key lookup.
     */
    default Optional<ProviderPlanAcceptance> findByKey(String providerNpi, String planId, Long locationId) {
        return locationId == null
                ? findByProviderNpiAndPlanIdAndLocationIdIsNull(providerNpi, planId)
                : findByProviderNpiAndPlanIdAndLocationId(providerNpi, planId, locationId);
    }

    /**
     * Exact-key lookup holding a write lock until the surrounding transaction ends.
     */
    default Optional<ProviderPlanAcceptance> findByKeyForUpdate(String providerNpi, String planId, Long locationId) {
        return locationId == null
                ? lockByKeyWithoutLocation(providerNpi, planId)
                : lockByKey(providerNpi, planId, locationId);
    }

    /**
     * Next page of verified records after the cursor, in id order.
     */
    @Query("SELECT a FROM ProviderPlanAcceptance a WHERE a.verificationCount >= 1 AND a.id > :cursor ORDER BY a.id ASC")
    List<ProviderPlanAcceptance> findVerifiedAfter(@Param("cursor") Long cursor, Pageable pageable);

    @Query("SELECT COUNT(a) FROM ProviderPlanAcceptance a WHERE a.verificationCount >= 1")
    long countVerified();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProviderPlanAcceptance a SET a.confidenceScore = :score, a.updatedAt = :now WHERE a.id = :id")
    int updateConfidenceScore(@Param("id") Long id, @Param("score") int score, @Param("now") Instant now);

    /**
     * Records past their TTL that no live report for the same provider and plan still backs.
     */
    @Query("SELECT a.id FROM ProviderPlanAcceptance a WHERE a.expiresAt IS NOT NULL AND a.expiresAt <= :now " +
           "AND NOT EXISTS (SELECT 1 FROM VerificationLog v WHERE v.providerNpi = a.providerNpi AND v.planId = a.planId " +
           "AND (v.expiresAt IS NULL OR v.expiresAt > :now)) ORDER BY a.id ASC")
    List<Long> findExpiredUnbackedIds(@Param("now") Instant now, Pageable pageable);

    @Query("SELECT COUNT(a) FROM ProviderPlanAcceptance a WHERE a.expiresAt IS NOT NULL AND a.expiresAt <= :now " +
           "AND NOT EXISTS (SELECT 1 FROM VerificationLog v WHERE v.providerNpi = a.providerNpi AND v.planId = a.planId " +
           "AND (v.expiresAt IS NULL OR v.expiresAt > :now))")
    long countExpiredUnbacked(@Param("now") Instant now);

    long countByExpiresAtIsNotNull();

    @Query("SELECT COUNT(a) FROM ProviderPlanAcceptance a WHERE a.expiresAt IS NOT NULL AND a.expiresAt <= :now")
    long countExpired(@Param("now") Instant now);

    @Query("SELECT COUNT(a) FROM ProviderPlanAcceptance a WHERE a.expiresAt > :now AND a.expiresAt <= :until")
    long countExpiringBetween(@Param("now") Instant now, @Param("until") Instant until);
}
