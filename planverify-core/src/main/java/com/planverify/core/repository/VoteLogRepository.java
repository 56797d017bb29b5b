package com.planverify.core.repository;

import com.planverify.core.domain.VoteLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VoteLogRepository extends JpaRepository<VoteLog, UUID> {

    Optional<VoteLog> findByVerification_IdAndSourceIp(UUID verificationId, String sourceIp);

    long countByVerification_Id(UUID verificationId);
}
