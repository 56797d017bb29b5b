package com.planverify.core.domain;

/**
 * Published acceptance status of a provider-plan pair.
 */
public enum AcceptanceStatus {
    UNKNOWN,
    PENDING,
    ACCEPTED,
    NOT_ACCEPTED;

    public static AcceptanceStatus fromClaim(boolean acceptsInsurance) {
        return acceptsInsurance ? ACCEPTED : NOT_ACCEPTED;
    }
}
