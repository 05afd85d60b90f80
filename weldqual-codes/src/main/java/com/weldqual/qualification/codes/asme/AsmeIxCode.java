/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.codes.asme;

import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.api.LookupHandle;
import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.DerivedField.NumericRange;
import com.weldqual.qualification.api.model.FormType;
import com.weldqual.qualification.api.model.PositionQualification;
import com.weldqual.qualification.api.model.QualifiedField;
import com.weldqual.qualification.codes.WeldingPositions;
import com.weldqual.qualification.codes.parsing.ValueParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * ASME Boiler and Pressure Vessel Code, Section IX.
 *
 * <p>Covers welder performance qualifications (QW articles) and brazer
 * procedure qualifications (QB articles). All thresholds are in inches.
 */
public final class AsmeIxCode implements IQualificationCode {
    private static final Logger logger = LoggerFactory.getLogger(AsmeIxCode.class);

    public static final String CODE_ID = "asme_ix";
    public static final String CODE_NAME = "ASME BPVC Section IX";

    static final double MIN_QUALIFIED_THICKNESS = 1.0 / 16;
    static final double WELDING_UNLIMITED_THICKNESS = 3.0 / 8;
    static final double BRAZING_UNLIMITED_THICKNESS = 3.0 / 16;
    static final double SMALL_DIAMETER_LIMIT = 1.0;
    static final double LARGE_DIAMETER_LIMIT = 2.875;
    /** Highest P-number covered by the QW-423.1 group. */
    static final int P_NUMBER_GROUP_LIMIT = 11;

    static final String P_NUMBER_GROUP = "P-1 thru P-11 & P-4X";

    private static final Set<String> BRAZING_FLAT_POSITIONS = Set.of("1", "FLAT", "1F", "1G");

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
        return Set.of(FormType.WPQ, FormType.BPQR);
    }

    // ---------- thickness ----------

    @Override
    public Optional<NumericRange> deriveThickness(ActualValueRecord record, FormType formType) {
        return positive(record.number(ActualValueRecord.COUPON_THICKNESS), ActualValueRecord.COUPON_THICKNESS)
                .map(t -> formType.isBrazing()
                        ? thicknessRange(t, BRAZING_UNLIMITED_THICKNESS, "QB-452.1")
                        : thicknessRange(t, WELDING_UNLIMITED_THICKNESS, "QW-452.1"));
    }

    private static NumericRange thicknessRange(double t, double unlimitedFrom, String table) {
        if (t < MIN_QUALIFIED_THICKNESS) {
            return NumericRange.of(t, t, table + "(a)");
        }
        if (t < unlimitedFrom) {
            return NumericRange.of(MIN_QUALIFIED_THICKNESS, 2 * t, table + "(b)");
        }
        return NumericRange.atLeast(MIN_QUALIFIED_THICKNESS, table + "(c)");
    }

    // ---------- diameter ----------

    @Override
    public Optional<NumericRange> deriveDiameter(ActualValueRecord record, FormType formType) {
        Optional<Double> od = record.text(ActualValueRecord.COUPON_DIAMETER).flatMap(ValueParsers::parseDiameter);
        String table = formType.isBrazing() ? "QB-452.3" : "QW-452.3";
        return positive(od, ActualValueRecord.COUPON_DIAMETER).map(d -> diameterRange(d, table));
    }

    private static NumericRange diameterRange(double od, String table) {
        if (od < SMALL_DIAMETER_LIMIT) {
            return NumericRange.of(od, SMALL_DIAMETER_LIMIT, table + "(a)");
        }
        if (od < LARGE_DIAMETER_LIMIT) {
            return NumericRange.atLeast(SMALL_DIAMETER_LIMIT, table + "(b)");
        }
        return NumericRange.atLeast(LARGE_DIAMETER_LIMIT, table + "(c)");
    }

    // ---------- positions ----------

    @Override
    public Optional<PositionQualification> derivePositions(ActualValueRecord record, FormType formType,
                                                           LookupHandle lookup) {
        Optional<String> position = WeldingPositions.resolve(record, lookup);
        if (position.isEmpty()) {
            return Optional.empty();
        }
        if (formType.isBrazing()) {
            // Flat qualifies flat only; any other position qualifies all
            String qualified = BRAZING_FLAT_POSITIONS.contains(position.get())
                    ? "Flat"
                    : DerivedField.PositionSet.ALL;
            return Optional.of(new PositionQualification(qualified, null, "QB-461"));
        }
        return WeldingPositions.qualify(position.get(), "QW-461.9");
    }

    // ---------- backing ----------

    @Override
    public Optional<DerivedField.Text> deriveBacking(ActualValueRecord record, FormType formType) {
        if (formType.isBrazing()) {
            return Optional.empty();
        }
        String backing = ValueParsers.hasBacking(record)
                ? DerivedField.Text.WITH_ONLY
                : DerivedField.Text.WITH_OR_WITHOUT;
        return Optional.of(new DerivedField.Text(backing, "QW-402.4"));
    }

    // ---------- supplemental ----------

    @Override
    public Map<QualifiedField, DerivedField> deriveSupplemental(ActualValueRecord record, FormType formType,
                                                                LookupHandle lookup) {
        Map<QualifiedField, DerivedField> result = new LinkedHashMap<>();
        if (FormType.WPQ.equals(formType)) {
            derivePerformanceExtras(record, result);
        } else if (FormType.BPQR.equals(formType)) {
            deriveBrazingExtras(record, result);
        }
        return Collections.unmodifiableMap(result);
    }

    private void derivePerformanceExtras(ActualValueRecord record, Map<QualifiedField, DerivedField> result) {
        record.text(ActualValueRecord.P_NUMBER_ACTUAL)
                .flatMap(AsmeIxCode::expandPNumber)
                .ifPresent(p -> result.put(QualifiedField.P_NUMBER, new DerivedField.Text(p, "QW-423")));

        record.text(ActualValueRecord.F_NUMBER_ACTUAL)
                .flatMap(AsmeIxCode::expandFNumber)
                .ifPresent(f -> result.put(QualifiedField.F_NUMBER, new DerivedField.Text(f, "QW-433")));

        if (record.get(ActualValueRecord.DEPOSIT_THICKNESS_ACTUAL).isPresent()) {
            Optional<Double> deposit = record.number(ActualValueRecord.DEPOSIT_THICKNESS_ACTUAL);
            if (deposit.isPresent()) {
                result.put(QualifiedField.DEPOSIT_THICKNESS_MAX,
                        new DerivedField.Scalar(2 * deposit.get(), "QW-452.5"));
            } else {
                logger.debug("Ignoring non-numeric {}", ActualValueRecord.DEPOSIT_THICKNESS_ACTUAL);
            }
        }

        record.text(ActualValueRecord.FILLER_TYPE)
                .ifPresent(f -> result.put(QualifiedField.FILLER_TYPE, new DerivedField.Text(f, "QW-404")));
    }

    private void deriveBrazingExtras(ActualValueRecord record, Map<QualifiedField, DerivedField> result) {
        // Brazing qualifies the same P-number group only
        record.text(ActualValueRecord.P_NUMBER_ACTUAL)
                .ifPresent(p -> result.put(QualifiedField.P_NUMBER, new DerivedField.Text(p, "QB-423")));

        record.text(ActualValueRecord.F_NUMBER)
                .ifPresent(f -> result.put(QualifiedField.F_NUMBER, new DerivedField.Text(f, "QB-432")));

        record.text(ActualValueRecord.JOINT_TYPE)
                .ifPresent(j -> result.put(QualifiedField.JOINT_TYPE, new DerivedField.Text(j, "QB-402.1")));

        record.number(ActualValueRecord.OVERLAP_LENGTH)
                .ifPresent(o -> result.put(QualifiedField.OVERLAP, new DerivedField.Text(
                        String.format(Locale.ROOT, "%.3f\" and greater", o), "QB-452.2")));
    }

    /**
     * QW-423: the lowest P-number in the designation decides. P-11 and below
     * qualify the whole P-1 to P-11 group; higher numbers qualify themselves.
     */
    static Optional<String> expandPNumber(String designation) {
        List<Integer> numbers = ValueParsers.extractPNumbers(designation);
        if (numbers.isEmpty()) {
            return Optional.empty();
        }
        int base = Collections.min(numbers);
        return Optional.of(base <= P_NUMBER_GROUP_LIMIT ? P_NUMBER_GROUP : "P-" + base);
    }

    /**
     * QW-433: the highest F-number qualifies itself and every lower one.
     */
    static Optional<String> expandFNumber(String designation) {
        List<Integer> numbers = ValueParsers.extractFNumbers(designation);
        if (numbers.isEmpty()) {
            return Optional.empty();
        }
        int max = Collections.max(numbers);
        if (max < 1) {
            return Optional.empty();
        }
        return Optional.of(IntStream.iterate(max, i -> i >= 1, i -> i - 1)
                .mapToObj(i -> "F" + i)
                .collect(Collectors.joining(", ")));
    }

    private static Optional<Double> positive(Optional<Double> value, String field) {
        if (value.isPresent() && value.get() <= 0) {
            logger.debug("Ignoring non-positive {}: {}", field, value.get());
            return Optional.empty();
        }
        return value;
    }
}
