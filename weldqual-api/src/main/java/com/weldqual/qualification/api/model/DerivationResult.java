/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one derivation call.
 *
 * @param perCode       derived fields keyed by code id, in execution order
 * @param governing     most restrictive value per field across all codes
 * @param governingCode code id that set each governing attribute
 * @param rulesFired    one audit entry per derived value
 * @param warnings      non-fatal problems, in the order they occurred
 * @param skippedFields {@code code:derivation} entries for derivations that produced nothing
 */
public record DerivationResult(
        @JsonProperty("per_code") Map<String, CodeDerivation> perCode,
        @JsonProperty("governing") Map<QualifiedField, DerivedField> governing,
        @JsonProperty("governing_code") Map<String, String> governingCode,
        @JsonProperty("rules_fired") List<RuleFired> rulesFired,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("skipped_fields") List<String> skippedFields
) implements Serializable {

    public DerivationResult {
        perCode = Collections.unmodifiableMap(new LinkedHashMap<>(perCode));
        governing = Collections.unmodifiableMap(new LinkedHashMap<>(governing));
        governingCode = Collections.unmodifiableMap(new LinkedHashMap<>(governingCode));
        rulesFired = List.copyOf(rulesFired);
        warnings = List.copyOf(warnings);
        skippedFields = List.copyOf(skippedFields);
    }

    public static DerivationResult withWarning(String warning) {
        return builder().addWarning(warning).build();
    }

    public Optional<DerivedField> governing(QualifiedField field) {
        return Optional.ofNullable(governing.get(field));
    }

    public <T extends DerivedField> Optional<T> governing(QualifiedField field, Class<T> type) {
        return governing(field).filter(type::isInstance).map(type::cast);
    }

    public Optional<String> governingCode(String attribute) {
        return Optional.ofNullable(governingCode.get(attribute));
    }

    public Optional<CodeDerivation> forCode(String codeId) {
        return Optional.ofNullable(perCode.get(codeId));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while a derivation is in progress.
     */
    public static final class Builder {
        private final Map<String, CodeDerivation> perCode = new LinkedHashMap<>();
        private final Map<QualifiedField, DerivedField> governing = new LinkedHashMap<>();
        private final Map<String, String> governingCode = new LinkedHashMap<>();
        private final List<RuleFired> rulesFired = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> skippedFields = new ArrayList<>();

        private Builder() {
        }

        public Builder putCodeDerivation(CodeDerivation derivation) {
            perCode.put(derivation.codeId(), derivation);
            return this;
        }

        public Builder putGoverning(QualifiedField field, DerivedField value) {
            governing.put(field, value);
            return this;
        }

        public Builder attribute(String attribute, String codeId) {
            governingCode.put(attribute, codeId);
            return this;
        }

        public Builder addRuleFired(RuleFired rule) {
            rulesFired.add(rule);
            return this;
        }

        public Builder addWarning(String warning) {
            warnings.add(warning);
            return this;
        }

        /**
         * @param derivation derivation that produced nothing, e.g. {@code diameter}
         */
        public Builder addSkipped(String codeId, String derivation) {
            skippedFields.add(codeId + ":" + derivation);
            return this;
        }

        public Map<String, CodeDerivation> perCode() {
            return Collections.unmodifiableMap(perCode);
        }

        public DerivationResult build() {
            return new DerivationResult(perCode, governing, governingCode, rulesFired, warnings, skippedFields);
        }
    }
}
