package com.planverify.api.confidence;

/**
 * Qualitative band of a confidence score.
 */
public enum ConfidenceLevel {
    VERY_HIGH("Verified through multiple authoritative sources with a high level of agreement."),
    HIGH("Verified through authoritative sources or several agreeing community reports."),
    MEDIUM("Some verification exists, but it may need confirmation."),
    LOW("Limited verification data. Call the provider to confirm before visiting."),
    VERY_LOW("Unverified or possibly inaccurate. Always call to confirm.");

    static final int MIN_VERIFICATIONS_FOR_HIGH_CONFIDENCE = 3;

    private final String baseDescription;

    ConfidenceLevel(String baseDescription) {
        this.baseDescription = baseDescription;
    }

    /**
     * Level for a rounded score. Fewer than three reports (but at least one) caps the level at MEDIUM.
     */
    public static ConfidenceLevel of(int score, int verificationCount) {
        ConfidenceLevel level;
        if (score >= 91) level = VERY_HIGH;
        else if (score >= 76) level = HIGH;
        else if (score >= 51) level = MEDIUM;
        else if (score >= 26) level = LOW;
        else level = VERY_LOW;

        boolean tooFewReports = verificationCount > 0 && verificationCount < MIN_VERIFICATIONS_FOR_HIGH_CONFIDENCE;
        if (tooFewReports && level.ordinal() < MEDIUM.ordinal()) {
            return MEDIUM;
        }
        return level;
    }

    public String describe(int verificationCount) {
        if (verificationCount < MIN_VERIFICATIONS_FOR_HIGH_CONFIDENCE) {
            return baseDescription + " At least 3 independent reports are needed for high confidence.";
        }
        return baseDescription;
    }
}
