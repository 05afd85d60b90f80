/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api;

import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivationResult;
import com.weldqual.qualification.api.model.FormType;

import java.util.Collection;

/**
 * Contract for deriving qualified ranges across every applicable code.
 *
 * <p>Implementations are synchronous and side-effect free. The only failure
 * that propagates is an unknown code id in an explicit filter; everything else
 * degrades to a partial result explained by the warnings and skipped fields.
 */
public interface IDerivationEngine {

    /**
     * Derives ranges with every registered code applicable to the form type.
     *
     * @param record   actual values of the test coupon (must not be null)
     * @param formType form the record belongs to (must not be null)
     * @return per-code ranges, governing values and the audit trail
     */
    default DerivationResult derive(ActualValueRecord record, FormType formType) {
        return derive(record, formType, null, LookupHandle.NONE);
    }

    /**
     * Derives ranges with a subset of the registered codes.
     *
     * @param codeFilter code ids to run, or null for all applicable codes
     * @throws com.weldqual.qualification.api.exceptions.UnknownCodeException
     *         if the filter names a code that is not registered
     */
    default DerivationResult derive(ActualValueRecord record, FormType formType, Collection<String> codeFilter) {
        return derive(record, formType, codeFilter, LookupHandle.NONE);
    }

    /**
     * Derives ranges with a subset of codes and a read-only lookup handle.
     *
     * @param codeFilter code ids to run, or null for all applicable codes
     * @param lookup     read-only reference data handed to the codes
     */
    DerivationResult derive(ActualValueRecord record, FormType formType, Collection<String> codeFilter,
                            LookupHandle lookup);
}
