/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Groove and fillet positions qualified by one test position.
 *
 * @param groove    qualified groove positions, {@code All}, or {@code N/A} for a fillet-only test
 * @param fillet    qualified fillet positions, {@code All}, or null when fillets are not derived
 * @param reference code clause both values come from
 */
public record PositionQualification(
        @JsonProperty("groove") String groove,
        @JsonProperty("fillet") String fillet,
        @JsonProperty("reference") String reference
) implements Serializable {

    public PositionQualification {
        Objects.requireNonNull(groove, "groove");
        Objects.requireNonNull(reference, "reference");
    }

    public DerivedField.PositionSet grooveField() {
        return new DerivedField.PositionSet(groove, reference);
    }

    public Optional<DerivedField.PositionSet> filletField() {
        return fillet == null ? Optional.empty() : Optional.of(new DerivedField.PositionSet(fillet, reference));
    }
}
