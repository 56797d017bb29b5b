package com.planverify.api.confidence;

import java.util.List;

/**
 * Specialty groups with their own freshness threshold, in matching priority order.
 */
public enum SpecialtyCategory {
    MENTAL_HEALTH(30, List.of("psychiatr", "psycholog", "mental health", "behavioral health", "counselor", "therapist")),
    PRIMARY_CARE(60, List.of("family medicine", "family practice", "internal medicine", "general practice", "primary care")),
    HOSPITAL_BASED(90, List.of("hospital", "radiology", "anesthesiology", "pathology", "emergency medicine")),
    SPECIALIST(60, List.of());

    private final int freshnessThresholdDays;
    private final List<String> keywords;

    SpecialtyCategory(int freshnessThresholdDays, List<String> keywords) {
        this.freshnessThresholdDays = freshnessThresholdDays;
        this.keywords = keywords;
    }

    public int freshnessThresholdDays() {
        return freshnessThresholdDays;
    }

    boolean matches(String lowerCaseText) {
        return keywords.stream().anyMatch(lowerCaseText::contains);
    }
}
