package com.planverify.core.domain;

/**
 * Kind of report. Only plan acceptance reports feed the consensus engine today.
 */
public enum VerificationType {
    PLAN_ACCEPTANCE
}
