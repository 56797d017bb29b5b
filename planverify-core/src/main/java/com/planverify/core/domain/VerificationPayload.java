package com.planverify.core.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Claimed values carried by a report, tagged by report kind.
 * Payloads written before the kind tag existed read as plan acceptance.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "kind",
        defaultImpl = PlanAcceptancePayload.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlanAcceptancePayload.class, name = "PLAN_ACCEPTANCE")
})
public interface VerificationPayload {

    VerificationType type();
}
