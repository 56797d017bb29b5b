package com.planverify.core.domain;

import jakarta.persistence.Converter;

@Converter
public class VerificationPayloadConverter extends JsonColumnConverter<VerificationPayload> {

    public VerificationPayloadConverter() {
        super(VerificationPayload.class);
    }
}
