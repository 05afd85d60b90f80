/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Actual values recorded for a qualification test coupon.
 *
 * <p>Values arrive untyped from forms: a thickness may be a number or a
 * string, a diameter is usually free text such as {@code 2" N.P.S (2.375" OD)}.
 * Accessors never throw on bad content; they return empty instead.
 */
public final class ActualValueRecord implements Serializable {

    public static final String COUPON_THICKNESS = "coupon_thickness";
    public static final String COUPON_DIAMETER = "coupon_diameter";
    public static final String TEST_POSITION = "test_position";
    public static final String BACKING_ACTUAL = "backing_actual";
    public static final String P_NUMBER_ACTUAL = "p_number_actual";
    public static final String F_NUMBER_ACTUAL = "f_number_actual";
    /** Brazing filler F-number, recorded as a bare number. */
    public static final String F_NUMBER = "f_number";
    public static final String DEPOSIT_THICKNESS_ACTUAL = "deposit_thickness_actual";
    public static final String FILLER_TYPE = "filler_type";
    public static final String JOINT_TYPE = "joint_type";
    public static final String OVERLAP_LENGTH = "overlap_length";

    private static final ActualValueRecord EMPTY = new ActualValueRecord(Map.of());

    private final Map<String, Object> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ActualValueRecord(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ActualValueRecord of(Map<String, ?> values) {
        return new ActualValueRecord(values);
    }

    public static ActualValueRecord empty() {
        return EMPTY;
    }

    /**
     * A record is empty when it carries no non-null value.
     */
    public boolean isEmpty() {
        return values.values().stream().allMatch(Objects::isNull);
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    /**
     * Trimmed text form of a field; empty when missing or blank.
     */
    public Optional<String> text(String field) {
        Object raw = values.get(field);
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Numeric form of a field; empty when missing, non-numeric or not finite.
     */
    public Optional<Double> number(String field) {
        Object raw = values.get(field);
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActualValueRecord)) return false;
        return values.equals(((ActualValueRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ActualValueRecord" + values;
    }
}
