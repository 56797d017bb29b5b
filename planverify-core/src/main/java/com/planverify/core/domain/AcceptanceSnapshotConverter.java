package com.planverify.core.domain;

import jakarta.persistence.Converter;

@Converter
public class AcceptanceSnapshotConverter extends JsonColumnConverter<AcceptanceSnapshot> {

    public AcceptanceSnapshotConverter() {
        super(AcceptanceSnapshot.class);
    }
}
