package com.planverify.api.confidence;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps free-text specialty and taxonomy descriptions to a freshness category.
 *
 * Matching is a case-insensitive substring search over both texts joined by a space.
 * The first category in declaration order wins; anything unmatched is SPECIALIST.
 */
@Component
public class SpecialtyClassifier {

    public SpecialtyCategory classify(String specialty, String taxonomyDescription) {
        String text = ((specialty == null ? "" : specialty) + " "
                + (taxonomyDescription == null ? "" : taxonomyDescription)).toLowerCase(Locale.ROOT);

        for (SpecialtyCategory category : SpecialtyCategory.values()) {
            if (category.matches(text)) {
                return category;
            }
        }
        return SpecialtyCategory.SPECIALIST;
    }

    public int freshnessThresholdDays(String specialty, String taxonomyDescription) {
        return classify(specialty, taxonomyDescription).freshnessThresholdDays();
    }
}
