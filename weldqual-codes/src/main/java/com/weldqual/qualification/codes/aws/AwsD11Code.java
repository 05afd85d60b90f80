/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.codes.aws;

import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.api.LookupHandle;
import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.DerivedField.NumericRange;
import com.weldqual.qualification.api.model.FormType;
import com.weldqual.qualification.api.model.PositionQualification;
import com.weldqual.qualification.codes.WeldingPositions;
import com.weldqual.qualification.codes.parsing.ValueParsers;

import java.util.Optional;
import java.util.Set;

/**
 * AWS D1.1 Structural Welding Code (Steel), welder qualification.
 * Brazing is outside D1.1, so only WPQ records apply.
 */
public final class AwsD11Code implements IQualificationCode {

    public static final String CODE_ID = "aws_d1_1";
    public static final String CODE_NAME = "AWS D1.1";

    static final double MIN_QUALIFIED_THICKNESS = 1.0 / 8;
    static final double UNLIMITED_THICKNESS = 1.0;
    static final double UNLIMITED_DIAMETER = 4.0;

    private static final String QUALIFICATION_TABLE = "Table 6.11";
    private static final String POSITION_TABLE = "Table 6.10";
    private static final String BACKING_CLAUSE = "Clause 6.16";

    @Override
    public String codeId() {
        return CODE_ID;
    }

    @Override
    public String codeName() {
        return CODE_NAME;
    }

    @Override
    public Set<FormType> applicableFormTypes() {
        return Set.of(FormType.WPQ);
    }

    @Override
    public Optional<NumericRange> deriveThickness(ActualValueRecord record, FormType formType) {
        return record.number(ActualValueRecord.COUPON_THICKNESS)
                .filter(t -> t > 0)
                .map(t -> {
                    if (t < MIN_QUALIFIED_THICKNESS) {
                        // Below the 1/8 in floor the coupon qualifies its own thickness only.
                        return NumericRange.of(t, t, QUALIFICATION_TABLE);
                    }
                    return t < UNLIMITED_THICKNESS
                            ? NumericRange.of(MIN_QUALIFIED_THICKNESS, 2 * t, QUALIFICATION_TABLE)
                            : NumericRange.atLeast(MIN_QUALIFIED_THICKNESS, QUALIFICATION_TABLE);
                });
    }

    @Override
    public Optional<NumericRange> deriveDiameter(ActualValueRecord record, FormType formType) {
        return record.text(ActualValueRecord.COUPON_DIAMETER)
                .flatMap(ValueParsers::parseDiameter)
                .filter(od -> od > 0)
                .map(od -> od < UNLIMITED_DIAMETER
                        ? NumericRange.of(od, 2 * od, QUALIFICATION_TABLE)
                        : NumericRange.atLeast(UNLIMITED_DIAMETER, QUALIFICATION_TABLE));
    }

    @Override
    public Optional<PositionQualification> derivePositions(ActualValueRecord record, FormType formType,
                                                           LookupHandle lookup) {
        return WeldingPositions.resolve(record, lookup)
                .flatMap(position -> WeldingPositions.qualify(position, POSITION_TABLE));
    }

    @Override
    public Optional<DerivedField.Text> deriveBacking(ActualValueRecord record, FormType formType) {
        String backing = ValueParsers.hasBacking(record)
                ? DerivedField.Text.WITH_ONLY
                : DerivedField.Text.WITH_OR_WITHOUT;
        return Optional.of(new DerivedField.Text(backing, BACKING_CLAUSE));
    }
}
