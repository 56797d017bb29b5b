package com.planverify.api.verification;

import com.planverify.api.confidence.ConfidenceCalculator;
import com.planverify.api.confidence.ConfidenceCalculator.ConfidenceInput;
import com.planverify.api.verification.VerificationService.SubmissionResult;
import com.planverify.api.verification.VerificationService.SubmitVerificationCommand;
import com.planverify.api.verification.VoteService.VoteResult;
import com.planverify.core.domain.InsurancePlan;
import com.planverify.core.domain.Provider;
import com.planverify.core.domain.ProviderPlanAcceptance;
import com.planverify.core.domain.VoteDirection;
import com.planverify.core.repository.InsurancePlanRepository;
import com.planverify.core.repository.ProviderPlanAcceptanceRepository;
import com.planverify.core.repository.ProviderRepository;
import com.planverify.core.repository.VerificationLogRepository;
import com.planverify.core.repository.VoteLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property tests for voting on reports.
 *
 * Each address holds at most one vote per report, the counters always equal the
 * number of stored votes per direction, and votes never change the published status.
 */
@SpringBootTest
@ActiveProfiles("test")
class VoteServicePropertyTest {

    private static final String NPI = "1234567890";
    private static final String PLAN = "BCBS-PPO-2025";

    @Autowired
    private VoteService voteService;

    @Autowired
    private VerificationService verificationService;

    @Autowired
    private ConfidenceCalculator confidenceCalculator;

    @Autowired
    private ProviderRepository providerRepository;

    @Autowired
    private InsurancePlanRepository planRepository;

    @Autowired
    private ProviderPlanAcceptanceRepository acceptanceRepository;

    @Autowired
    private VerificationLogRepository verificationLogRepository;

    @Autowired
    private VoteLogRepository voteLogRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private final Random random = new Random();

    @BeforeEach
    void setUp() {
        voteLogRepository.deleteAll();
        verificationLogRepository.deleteAll();
        acceptanceRepository.deleteAll();
        providerRepository.deleteAll();
        planRepository.deleteAll();

        providerRepository.save(Provider.individual(NPI, "Ana", "Ruiz", "Psychiatry", null));
        planRepository.save(InsurancePlan.create(PLAN, "Blue PPO", "Blue Cross"));
    }

    @Test
    void upvoteThenFlipToDownvote() {
        UUID id = submitReport("10.0.0.1");

        VoteResult up = voteService.vote(id, VoteDirection.UP, "10.1.0.1");
        assertThat(up.voteChanged()).isFalse();
        assertThat(up.verification().upvotes()).isEqualTo(1);
        assertThat(up.verification().downvotes()).isZero();

        VoteResult flipped = voteService.vote(id, VoteDirection.DOWN, "10.1.0.1");
        assertThat(flipped.voteChanged()).isTrue();
        assertThat(flipped.verification().upvotes()).isZero();
        assertThat(flipped.verification().downvotes()).isEqualTo(1);
        assertThat(flipped.verification().netVotes()).isEqualTo(-1);

        assertThat(voteLogRepository.countByVerification_Id(id)).isEqualTo(1);
    }

    @Test
    void repeatingSameVoteIsRejected() {
        UUID id = submitReport("10.0.0.1");
        voteService.vote(id, VoteDirection.UP, "10.1.0.1");

        assertThatThrownBy(() -> voteService.vote(id, VoteDirection.UP, "10.1.0.1"))
                .isInstanceOf(VoteService.DuplicateVoteException.class);

        assertThat(verificationLogRepository.findById(id).orElseThrow().getUpvotes()).isEqualTo(1);
    }

    @Test
    void countersMatchStoredVotes() {
        UUID id = submitReport("10.0.0.1");
        int voters = 12;
        VoteDirection[] current = new VoteDirection[voters];

        for (int i = 0; i < 60; i++) {
            int voter = random.nextInt(voters);
            VoteDirection direction = random.nextBoolean() ? VoteDirection.UP : VoteDirection.DOWN;
            if (current[voter] == direction) {
                continue;
            }
            voteService.vote(id, direction, "10.2.0." + voter);
            current[voter] = direction;
        }

        int expectedUp = 0;
        int expectedDown = 0;
        for (VoteDirection direction : current) {
            if (direction == VoteDirection.UP) expectedUp++;
            if (direction == VoteDirection.DOWN) expectedDown++;
        }

        var stored = verificationLogRepository.findById(id).orElseThrow();
        assertThat(stored.getUpvotes()).isEqualTo(expectedUp);
        assertThat(stored.getDownvotes()).isEqualTo(expectedDown);
        assertThat(voteLogRepository.countByVerification_Id(id)).isEqualTo(expectedUp + expectedDown);
    }

    @Test
    void votesRefreshConfidenceButNotStatus() {
        UUID id = submitReport("10.0.0.1");
        ProviderPlanAcceptance before = acceptanceRepository.findAll().get(0);

        for (int i = 1; i <= 5; i++) {
            voteService.vote(id, VoteDirection.UP, "10.3.0." + i);
        }

        ProviderPlanAcceptance after = acceptanceRepository.findById(before.getId()).orElseThrow();
        int expected = confidenceCalculator.calculate(new ConfidenceInput(
                after.getVerificationSource().name(),
                after.getLastVerified(),
                after.getVerificationCount(),
                5, 0, "Psychiatry", null), Instant.now()).score();

        assertThat(after.getConfidenceScore()).isEqualTo(expected);
        assertThat(after.getConfidenceScore()).isGreaterThan(before.getConfidenceScore());
        assertThat(after.getAcceptanceStatus()).isEqualTo(before.getAcceptanceStatus());
        assertThat(after.getVerificationCount()).isEqualTo(before.getVerificationCount());
    }

    @Test
    void concurrentFlipsFromOneAddressMoveCountersOnce() throws Exception {
        UUID id = submitReport("10.0.0.1");
        voteService.vote(id, VoteDirection.UP, "10.4.0.1");

        CountDownLatch flipped = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                voteService.vote(id, VoteDirection.DOWN, "10.4.0.1");
                flipped.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertThat(flipped.await(10, TimeUnit.SECONDS)).isTrue();

            Future<VoteResult> second = executor.submit(() -> voteService.vote(id, VoteDirection.DOWN, "10.4.0.1"));
            Thread.sleep(300);
            assertThat(second.isDone()).isFalse();

            release.countDown();
            first.get(10, TimeUnit.SECONDS);

            assertThatThrownBy(() -> second.get(10, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(VoteService.DuplicateVoteException.class);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        var stored = verificationLogRepository.findById(id).orElseThrow();
        assertThat(stored.getUpvotes()).isZero();
        assertThat(stored.getDownvotes()).isEqualTo(1);
        assertThat(voteLogRepository.countByVerification_Id(id)).isEqualTo(1);
    }

    @Test
    void moveWithoutVoteToMoveChangesNothing() {
        UUID id = submitReport("10.0.0.1");

        Integer moved = transactionTemplate.execute(status -> verificationLogRepository.moveVoteFromUpToDown(id));
        assertThat(moved).isZero();

        var stored = verificationLogRepository.findById(id).orElseThrow();
        assertThat(stored.getUpvotes()).isZero();
        assertThat(stored.getDownvotes()).isZero();
    }

    @Test
    void flipAgainstDriftedCountersIsRejected() {
        UUID id = submitReport("10.0.0.1");
        voteService.vote(id, VoteDirection.UP, "10.5.0.1");
        // Counters drift away from the stored UP vote
        transactionTemplate.execute(status -> verificationLogRepository.moveVoteFromUpToDown(id));

        assertThatThrownBy(() -> voteService.vote(id, VoteDirection.DOWN, "10.5.0.1"))
                .isInstanceOf(VoteService.VoteConflictException.class);

        var stored = verificationLogRepository.findById(id).orElseThrow();
        assertThat(stored.getUpvotes()).isZero();
        assertThat(stored.getDownvotes()).isEqualTo(1);
        assertThat(voteLogRepository.findByVerification_IdAndSourceIp(id, "10.5.0.1").orElseThrow().getVote())
                .isEqualTo(VoteDirection.UP);
    }

    @Test
    void missingAddressOrDirectionIsInvalid() {
        UUID id = submitReport("10.0.0.1");

        assertThatThrownBy(() -> voteService.vote(id, VoteDirection.UP, null))
                .isInstanceOf(VoteService.InvalidVoteException.class);
        assertThatThrownBy(() -> voteService.vote(id, VoteDirection.UP, "  "))
                .isInstanceOf(VoteService.InvalidVoteException.class);
        assertThatThrownBy(() -> voteService.vote(id, null, "10.1.0.1"))
                .isInstanceOf(VoteService.InvalidVoteException.class);
    }

    @Test
    void unknownReportIsNotFound() {
        assertThatThrownBy(() -> voteService.vote(UUID.randomUUID(), VoteDirection.UP, "10.1.0.1"))
                .isInstanceOf(VoteService.VerificationNotFoundException.class);
        assertThat(voteLogRepository.count()).isZero();
    }

    private UUID submitReport(String sourceIp) {
        SubmissionResult result = verificationService.submitVerification(new SubmitVerificationCommand(
                NPI, PLAN, null, true, null, null, null, null, null, null, null, sourceIp, "JUnit", null));
        return result.verification().id();
    }
}
