/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one code derived for a record, in derivation order.
 */
public record CodeDerivation(
        @JsonProperty("code_id") String codeId,
        @JsonProperty("code_name") String codeName,
        @JsonProperty("fields") Map<QualifiedField, DerivedField> fields
) implements Serializable {

    public CodeDerivation {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<DerivedField> field(QualifiedField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public <T extends DerivedField> Optional<T> field(QualifiedField field, Class<T> type) {
        return field(field).filter(type::isInstance).map(type::cast);
    }
}
