package com.planverify.api.confidence;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Multi-factor confidence formula for a provider-plan acceptance record.
 *
 * Score = data source (0-30) + recency (0-30) + verification count (0-25) + agreement (0-20),
 * clamped to [0, 100] and rounded to an integer. The calculation is pure: the same input and
 * the same {@code now} always produce the same result.
 */
@Component
public class ConfidenceCalculator {

    static final int MAX_DATA_SOURCE_SCORE = 30;
    static final int MAX_RECENCY_SCORE = 30;
    static final int MAX_VERIFICATION_SCORE = 25;
    static final int MAX_AGREEMENT_SCORE = 20;

    static final int UNKNOWN_SOURCE_SCORE = 10;
    static final int FULL_ENGAGEMENT_VOTES = 5;

    private static final Map<String, Integer> DATA_SOURCE_SCORES = Map.of(
            "CMS_NPPES", 30,
            "CMS_PLAN_FINDER", 30,
            "CMS_DATA", 30,
            "CARRIER_API", 27,
            "CARRIER_DATA", 27,
            "PROVIDER_PORTAL", 23,
            "PHONE_CALL", 22,
            "AUTOMATED", 15,
            "CROWDSOURCE", 15,
            "USER_UPLOAD", 12
    );

    private final SpecialtyClassifier specialtyClassifier;

    public ConfidenceCalculator(SpecialtyClassifier specialtyClassifier) {
        this.specialtyClassifier = specialtyClassifier;
    }

    public ConfidenceResult calculate(ConfidenceInput input, Instant now) {
        SpecialtyCategory category = specialtyClassifier.classify(input.specialty(), input.taxonomyDescription());
        int threshold = category.freshnessThresholdDays();
        Long daysSinceVerification = daysSince(input.lastVerifiedAt(), now);

        ConfidenceFactors factors = new ConfidenceFactors(
                dataSourceScore(input.dataSource()),
                recencyScore(daysSinceVerification, threshold),
                verificationScore(input.verificationCount()),
                agreementScore(input.upvotes(), input.downvotes())
        );

        double sum = factors.dataSourceScore() + factors.recencyScore()
                + factors.verificationScore() + factors.agreementScore();
        int score = (int) Math.round(Math.max(0.0, Math.min(100.0, sum)));

        ConfidenceLevel level = ConfidenceLevel.of(score, input.verificationCount());

        boolean stale = daysSinceVerification != null && daysSinceVerification > threshold;
        long daysUntilStale = daysSinceVerification == null
                ? threshold
                : Math.max(0, threshold - daysSinceVerification);
        boolean recommendReVerification = stale
                || daysSinceVerification == null
                || daysSinceVerification > threshold * 0.8;

        ConfidenceMetadata metadata = new ConfidenceMetadata(
                daysSinceVerification,
                threshold,
                daysUntilStale,
                stale,
                recommendReVerification,
                category,
                explain(score, factors, input.verificationCount(), daysSinceVerification, threshold, category)
        );

        return new ConfidenceResult(score, level, level.describe(input.verificationCount()), factors, metadata);
    }

    static int dataSourceScore(String dataSource) {
        if (dataSource == null) {
            return UNKNOWN_SOURCE_SCORE;
        }
        return DATA_SOURCE_SCORES.getOrDefault(dataSource, UNKNOWN_SOURCE_SCORE);
    }

    /**
     * Full points up to the threshold, linear decay to zero at twice the threshold.
     */
    static double recencyScore(Long daysSinceVerification, int freshnessThresholdDays) {
        if (daysSinceVerification == null) {
            return 0;
        }
        long days = daysSinceVerification;
        if (days <= freshnessThresholdDays) {
            return MAX_RECENCY_SCORE;
        }
        long cutoff = 2L * freshnessThresholdDays;
        if (days > cutoff) {
            return 0;
        }
        return MAX_RECENCY_SCORE * (double) (cutoff - days) / freshnessThresholdDays;
    }

    static int verificationScore(int verificationCount) {
        if (verificationCount <= 0) return 0;
        if (verificationCount == 1) return 10;
        if (verificationCount == 2) return 15;
        return Math.min(MAX_VERIFICATION_SCORE, 22 + (verificationCount - 3));
    }

    /**
     * Ratio band of upvotes among all votes, damped until five votes have been cast.
     */
    static double agreementScore(long upvotes, long downvotes) {
        long totalVotes = upvotes + downvotes;
        if (totalVotes <= 0) {
            return 0;
        }
        double ratio = (double) upvotes / totalVotes;
        int band;
        if (ratio >= 1.0) band = MAX_AGREEMENT_SCORE;
        else if (ratio >= 0.8) band = 15;
        else if (ratio >= 0.6) band = 10;
        else if (ratio >= 0.4) band = 5;
        else band = 0;

        double engagement = Math.min(1.0, (double) totalVotes / FULL_ENGAGEMENT_VOTES);
        return band * engagement;
    }

    static Long daysSince(Instant lastVerifiedAt, Instant now) {
        if (lastVerifiedAt == null) {
            return null;
        }
        return Math.max(0, Duration.between(lastVerifiedAt, now).toDays());
    }

    private String explain(int score, ConfidenceFactors factors, int verificationCount,
                           Long daysSinceVerification, int threshold, SpecialtyCategory category) {
        List<String> parts = new ArrayList<>();

        int source = factors.dataSourceScore();
        if (source >= 30) parts.add("verified through official CMS data");
        else if (source >= 23) parts.add("verified through carrier or provider data");
        else if (source >= 15) parts.add("verified through community reports");
        else parts.add("limited authoritative data");

        if (daysSinceVerification == null) {
            parts.add("never verified");
        } else if (factors.recencyScore() >= MAX_RECENCY_SCORE) {
            parts.add("verified " + daysSinceVerification + " days ago, within the " + threshold + "-day freshness window");
        } else if (factors.recencyScore() > 0) {
            parts.add("aging data (" + daysSinceVerification + " days old)");
        } else {
            parts.add("stale data (" + daysSinceVerification + " days old), re-verification needed");
        }

        if (verificationCount == 0) {
            parts.add("no reports yet");
        } else if (verificationCount < ConfidenceLevel.MIN_VERIFICATIONS_FOR_HIGH_CONFIDENCE) {
            parts.add(verificationCount + " of 3 reports needed for high confidence");
        } else {
            parts.add(verificationCount + " reports");
        }

        double agreement = factors.agreementScore();
        if (agreement >= MAX_AGREEMENT_SCORE) parts.add("complete community agreement");
        else if (agreement >= 15) parts.add("strong community agreement");
        else if (agreement >= 10) parts.add("moderate community agreement");
        else if (agreement > 0) parts.add("weak community agreement");
        else if (verificationCount > 0) parts.add("no clear community agreement");

        String explanation = "This " + score + "% confidence score is based on: " + String.join(", ", parts) + ".";
        return switch (category) {
            case MENTAL_HEALTH -> explanation + " Mental health network participation changes frequently.";
            case HOSPITAL_BASED -> explanation + " Hospital-based network participation is usually stable.";
            default -> explanation;
        };
    }

    /**
     * Inputs to the formula. {@code dataSource} is a source name such as CMS_DATA or CROWDSOURCE;
     * unknown names and null score as the lowest tier.
     */
    public record ConfidenceInput(
            String dataSource,
            Instant lastVerifiedAt,
            int verificationCount,
            long upvotes,
            long downvotes,
            String specialty,
            String taxonomyDescription
    ) {}

    public record ConfidenceFactors(
            int dataSourceScore,
            double recencyScore,
            int verificationScore,
            double agreementScore
    ) {}

    public record ConfidenceMetadata(
            Long daysSinceVerification,
            int freshnessThreshold,
            long daysUntilStale,
            boolean isStale,
            boolean recommendReVerification,
            SpecialtyCategory specialtyCategory,
            String explanation
    ) {}

    public record ConfidenceResult(
            int score,
            ConfidenceLevel level,
            String description,
            ConfidenceFactors factors,
            ConfidenceMetadata metadata
    ) {}
}
