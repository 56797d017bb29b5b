package com.planverify.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

@Entity
@Table(name = "insurance_plans", indexes = {
    @Index(name = "idx_plans_issuer", columnList = "issuer_name")
})
public class InsurancePlan {

    @Id
    @NotNull
    @Column(name = "plan_id", length = 50)
    private String planId;

    @Column(name = "plan_name", length = 200)
    private String planName;

    @Column(name = "issuer_name", length = 200)
    private String issuerName;

    protected InsurancePlan() {}

    public static InsurancePlan create(String planId, String planName, String issuerName) {
        InsurancePlan plan = new InsurancePlan();
        plan.planId = planId;
        plan.planName = planName;
        plan.issuerName = issuerName;
        return plan;
    }

    public String getPlanId() { return planId; }
    public String getPlanName() { return planName; }
    public String getIssuerName() { return issuerName; }
}
