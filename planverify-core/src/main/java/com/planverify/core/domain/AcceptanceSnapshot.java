package com.planverify.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Published status and score of an acceptance record at the moment a report was filed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AcceptanceSnapshot(AcceptanceStatus acceptanceStatus, Integer confidenceScore) {

    public static AcceptanceSnapshot of(ProviderPlanAcceptance acceptance) {
        return new AcceptanceSnapshot(acceptance.getAcceptanceStatus(), acceptance.getConfidenceScore());
    }
}
