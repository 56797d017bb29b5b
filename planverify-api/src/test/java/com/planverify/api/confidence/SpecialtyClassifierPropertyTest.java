package com.planverify.api.confidence;

import net.jqwik.api.*;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for specialty classification.
 */
class SpecialtyClassifierPropertyTest {

    private final SpecialtyClassifier classifier = new SpecialtyClassifier();

    @Property(tries = 100)
    @Label("Classification ignores case")
    void caseInsensitive(@ForAll("knownSpecialties") String specialty, @ForAll boolean upper) {
        String variant = upper ? specialty.toUpperCase(Locale.ROOT) : specialty.toLowerCase(Locale.ROOT);

        assertThat(classifier.classify(variant, null)).isEqualTo(classifier.classify(specialty, null));
    }

    @Property(tries = 100)
    @Label("Taxonomy text alone is enough to classify")
    void taxonomyIsSearched(@ForAll("knownSpecialties") String text) {
        assertThat(classifier.classify(null, text)).isEqualTo(classifier.classify(text, null));
    }

    @Example
    void categoriesAndThresholds() {
        assertThat(classifier.classify("Psychiatry", null)).isEqualTo(SpecialtyCategory.MENTAL_HEALTH);
        assertThat(classifier.classify("Licensed Professional Counselor", null)).isEqualTo(SpecialtyCategory.MENTAL_HEALTH);
        assertThat(classifier.classify("Internal Medicine", null)).isEqualTo(SpecialtyCategory.PRIMARY_CARE);
        assertThat(classifier.classify(null, "Emergency Medicine Physician")).isEqualTo(SpecialtyCategory.HOSPITAL_BASED);
        assertThat(classifier.classify("Orthopaedic Surgery", null)).isEqualTo(SpecialtyCategory.SPECIALIST);
        assertThat(classifier.classify(null, null)).isEqualTo(SpecialtyCategory.SPECIALIST);

        assertThat(classifier.freshnessThresholdDays("Psychology", null)).isEqualTo(30);
        assertThat(classifier.freshnessThresholdDays("Family Practice", null)).isEqualTo(60);
        assertThat(classifier.freshnessThresholdDays("Anesthesiology", null)).isEqualTo(90);
        assertThat(classifier.freshnessThresholdDays("Dermatology", null)).isEqualTo(60);
    }

    @Example
    void firstMatchingCategoryWins() {
        // mentions both a mental health and a hospital keyword
        assertThat(classifier.classify("Psychiatry", "Hospital based")).isEqualTo(SpecialtyCategory.MENTAL_HEALTH);
    }

    @Provide
    Arbitrary<String> knownSpecialties() {
        return Arbitraries.of("Psychiatry", "Behavioral Health", "Family Medicine", "General Practice",
                "Radiology", "Pathology", "Cardiology", "Neurology");
    }
}
