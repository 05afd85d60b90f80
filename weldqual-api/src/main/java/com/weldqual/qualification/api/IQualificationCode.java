/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api;

import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.FormType;
import com.weldqual.qualification.api.model.PositionQualification;
import com.weldqual.qualification.api.model.QualifiedField;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Contract for one welding or brazing qualification code (ASME IX, AWS D1.1, ...).
 *
 * <p>A code turns the actual values recorded for a qualification test into the
 * range of production conditions the welder or brazer is qualified for. Each
 * code owns its own thresholds and citation strings; nothing outside the
 * implementing class needs to change when a new code is added.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations are stateless and thread-safe.</li>
 *   <li>A missing or unparseable source field yields {@link Optional#empty()},
 *       never an exception.</li>
 *   <li>Every derivation is invoked independently; a failure in one must not
 *       depend on the outcome of another.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CodeRegistry registry = new CodeRegistry();
 * registry.register(new AsmeIxCode());
 * registry.register(new AwsD11Code());
 *
 * DerivationResult result = new DerivationEngine(registry)
 *     .derive(record, FormType.WPQ);
 * }</pre>
 */
public interface IQualificationCode {

    /**
     * Stable short identifier, e.g. {@code asme_ix}.
     */
    String codeId();

    /**
     * Display name, e.g. {@code ASME BPVC Section IX}.
     */
    String codeName();

    /**
     * Form types this code derives ranges for.
     */
    Set<FormType> applicableFormTypes();

    /**
     * Derives the qualified base metal thickness range.
     *
     * @return (min, max, reference) or empty when the coupon thickness is missing
     */
    Optional<DerivedField.NumericRange> deriveThickness(ActualValueRecord record, FormType formType);

    /**
     * Derives the qualified pipe outside diameter range.
     *
     * @return (min, max, reference) or empty when the diameter cannot be parsed
     */
    Optional<DerivedField.NumericRange> deriveDiameter(ActualValueRecord record, FormType formType);

    /**
     * Derives qualified groove and fillet positions from the test position.
     *
     * @param lookup read-only reference data handle, never null
     * @return the position qualification or empty for an unknown position
     */
    Optional<PositionQualification> derivePositions(ActualValueRecord record, FormType formType,
                                                    LookupHandle lookup);

    /**
     * Derives the backing qualification.
     *
     * @return the backing label or empty when backing does not apply
     */
    Optional<DerivedField.Text> deriveBacking(ActualValueRecord record, FormType formType);

    /**
     * Derives code-specific extra fields (P/F-numbers, deposit thickness, ...).
     *
     * @param lookup read-only reference data handle, never null
     * @return derived fields in a stable order; empty when the code has none
     */
    default Map<QualifiedField, DerivedField> deriveSupplemental(ActualValueRecord record, FormType formType,
                                                                 LookupHandle lookup) {
        return Map.of();
    }
}
