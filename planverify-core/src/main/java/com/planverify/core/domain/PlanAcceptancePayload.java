package com.planverify.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Plan acceptance claim plus the optional secondary signals a reporter may supply.
 */
@JsonTypeName("PLAN_ACCEPTANCE")
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanAcceptancePayload(
        AcceptanceStatus acceptanceStatus,
        Boolean acceptsNewPatients,
        Boolean phoneReached,
        Boolean phoneCorrect,
        Boolean scheduledAppointment
) implements VerificationPayload {

    public static PlanAcceptancePayload of(boolean acceptsInsurance) {
        return new PlanAcceptancePayload(AcceptanceStatus.fromClaim(acceptsInsurance), null, null, null, null);
    }

    @Override
    @JsonIgnore
    public VerificationType type() {
        return VerificationType.PLAN_ACCEPTANCE;
    }
}
