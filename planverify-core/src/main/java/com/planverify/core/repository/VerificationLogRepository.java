package com.planverify.core.repository;

import com.planverify.core.domain.VerificationLog;
import com.planverify.core.domain.VerificationType;
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
import java.util.UUID;

/**
 * Repository for crowd reports.
 *
 * Reports are never updated through the entity; vote counters move only through the
 * atomic updates below. A report is live while expiresAt is null or in the future.
 */
@Repository
public interface VerificationLogRepository extends JpaRepository<VerificationLog, UUID> {

    /**
     * Loads a report holding its row lock until the transaction ends. Votes on one report run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VerificationLog v WHERE v.id = :id")
    Optional<VerificationLog> lockById(@Param("id") UUID id);

    /**
     * Live reports for the pair from the given address created at or after the cutoff.
     */
    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.sourceIp = :sourceIp AND v.createdAt >= :since AND (v.expiresAt IS NULL OR v.expiresAt > :now)")
    long countRecentBySourceIp(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("sourceIp") String sourceIp,
            @Param("since") Instant since,
            @Param("now") Instant now);

    /**
     * Live reports for the pair from the given submitter created at or after the cutoff.
     */
    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.submittedBy = :submittedBy AND v.createdAt >= :since AND (v.expiresAt IS NULL OR v.expiresAt > :now)")
    long countRecentBySubmitter(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("submittedBy") String submittedBy,
            @Param("since") Instant since,
            @Param("now") Instant now);

    @Query("SELECT v FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.verificationType = :type AND (v.expiresAt IS NULL OR v.expiresAt > :now) ORDER BY v.createdAt DESC")
    List<VerificationLog> findLiveForPair(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("type") VerificationType type,
            @Param("now") Instant now);

    @Query("SELECT v FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND (:includeExpired = true OR v.expiresAt IS NULL OR v.expiresAt > :now) ORDER BY v.createdAt DESC")
    List<VerificationLog> findForPair(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("includeExpired") boolean includeExpired,
            @Param("now") Instant now,
            Pageable pageable);

    @Query("SELECT v FROM VerificationLog v WHERE (:npi IS NULL OR v.providerNpi = :npi) " +
           "AND (:planId IS NULL OR v.planId = :planId) " +
           "AND (:includeExpired = true OR v.expiresAt IS NULL OR v.expiresAt > :now) ORDER BY v.createdAt DESC")
    List<VerificationLog> findRecent(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("includeExpired") boolean includeExpired,
            @Param("now") Instant now,
            Pageable pageable);

    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND (:includeExpired = true OR v.expiresAt IS NULL OR v.expiresAt > :now)")
    long countForPair(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("includeExpired") boolean includeExpired,
            @Param("now") Instant now);

    /**
     * Vote totals summed over every report of the pair, live ones only unless includeExpired is set.
     */
    @Query("SELECT new com.planverify.core.repository.VoteTotals(COALESCE(SUM(v.upvotes), 0), COALESCE(SUM(v.downvotes), 0)) " +
           "FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND (:includeExpired = true OR v.expiresAt IS NULL OR v.expiresAt > :now)")
    VoteTotals sumVotesForPair(
            @Param("npi") String providerNpi,
            @Param("planId") String planId,
            @Param("includeExpired") boolean includeExpired,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VerificationLog v SET v.upvotes = v.upvotes + 1 WHERE v.id = :id")
    int incrementUpvotes(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VerificationLog v SET v.downvotes = v.downvotes + 1 WHERE v.id = :id")
    int incrementDownvotes(@Param("id") UUID id);

    /**
     * Moves one vote from down to up. Returns 0 and changes nothing when there is no downvote to move.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VerificationLog v SET v.upvotes = v.upvotes + 1, v.downvotes = v.downvotes - 1 " +
           "WHERE v.id = :id AND v.downvotes > 0")
    int moveVoteFromDownToUp(@Param("id") UUID id);

    /**
     * Moves one vote from up to down. Returns 0 and changes nothing when there is no upvote to move.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VerificationLog v SET v.upvotes = v.upvotes - 1, v.downvotes = v.downvotes + 1 " +
           "WHERE v.id = :id AND v.upvotes > 0")
    int moveVoteFromUpToDown(@Param("id") UUID id);

    @Query("SELECT v.id FROM VerificationLog v WHERE v.expiresAt IS NOT NULL AND v.expiresAt <= :now ORDER BY v.createdAt ASC")
    List<UUID> findExpiredIds(@Param("now") Instant now, Pageable pageable);

    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.expiresAt IS NOT NULL AND v.expiresAt <= :now")
    long countExpired(@Param("now") Instant now);

    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.expiresAt IS NULL OR v.expiresAt > :now")
    long countLive(@Param("now") Instant now);

    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.expiresAt > :now AND v.expiresAt <= :until")
    long countExpiringBetween(@Param("now") Instant now, @Param("until") Instant until);

    long countByExpiresAtIsNotNull();

    long countByCreatedAtAfter(Instant since);

    long countByVerificationType(VerificationType type);
}
