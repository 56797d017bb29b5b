package com.planverify.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import java.time.Instant;
import java.util.UUID;

/**
 * One vote per (report, voter address). Removed with its report.
 */
@Entity
@Table(name = "vote_logs",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_vote_verification_ip", columnNames = {"verification_id", "source_ip"})
    },
    indexes = {
        @Index(name = "idx_vote_verification", columnList = "verification_id"),
        @Index(name = "idx_vote_source_ip", columnList = "source_ip")
    })
public class VoteLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "verification_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private VerificationLog verification;

    @NotNull
    @Column(name = "source_ip", nullable = false, length = 50, updatable = false)
    private String sourceIp;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private VoteDirection vote;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected VoteLog() {}

    public static VoteLog create(VerificationLog verification, String sourceIp, VoteDirection vote, Instant now) {
        VoteLog voteLog = new VoteLog();
        voteLog.verification = verification;
        voteLog.sourceIp = sourceIp;
        voteLog.vote = vote;
        voteLog.createdAt = now;
        return voteLog;
    }

    public void flipTo(VoteDirection direction) {
        if (direction == this.vote) {
            throw new IllegalStateException("Vote already points " + direction);
        }
        this.vote = direction;
    }

    // Getters
    public UUID getId() { return id; }
    public VerificationLog getVerification() { return verification; }
    public String getSourceIp() { return sourceIp; }
    public VoteDirection getVote() { return vote; }
    public Instant getCreatedAt() { return createdAt; }
}
