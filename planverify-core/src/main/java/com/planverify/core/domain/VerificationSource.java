package com.planverify.core.domain;

/**
 * Channel through which a verification was obtained.
 */
public enum VerificationSource {
    CMS_DATA,
    CARRIER_DATA,
    PROVIDER_PORTAL,
    PHONE_CALL,
    CROWDSOURCE,
    AUTOMATED
}
