/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Audit entry: which code clause produced which value.
 */
public record RuleFired(
        @JsonProperty("code") String code,
        @JsonProperty("field") QualifiedField field,
        @JsonProperty("reference") String reference,
        @JsonProperty("value") DerivedField value
) implements Serializable {

    public static RuleFired of(String codeId, QualifiedField field, DerivedField value) {
        return new RuleFired(codeId, field, value.reference(), value);
    }
}
