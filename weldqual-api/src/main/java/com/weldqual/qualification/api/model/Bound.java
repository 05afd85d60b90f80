/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * One end of a qualified range: either a finite value in inches or unlimited.
 *
 * <p>Unlimited compares greater than every finite value and renders as
 * {@code "Unlimited"}.
 */
public sealed interface Bound extends Comparable<Bound>, Serializable permits Bound.Value, Bound.Unlimited {

    Bound UNLIMITED = new Unlimited();

    static Bound of(double value) {
        return new Value(value);
    }

    boolean isUnlimited();

    /**
     * Numeric form of the bound; unlimited maps to positive infinity.
     */
    double toDouble();

    @Override
    default int compareTo(Bound other) {
        return Double.compare(toDouble(), other.toDouble());
    }

    static Bound min(Bound a, Bound b) {
        return b.compareTo(a) < 0 ? b : a;
    }

    static Bound max(Bound a, Bound b) {
        return b.compareTo(a) > 0 ? b : a;
    }

    record Value(double value) implements Bound {

        public Value {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Bound value must be finite: " + value);
            }
        }

        @Override
        public boolean isUnlimited() {
            return false;
        }

        @Override
        public double toDouble() {
            return value;
        }

        @JsonValue
        public double json() {
            return value;
        }

        @Override
        public String toString() {
            return String.format("%.4f\"", value);
        }
    }

    record Unlimited() implements Bound {

        public static final String LABEL = "Unlimited";

        @Override
        public boolean isUnlimited() {
            return true;
        }

        @Override
        public double toDouble() {
            return Double.POSITIVE_INFINITY;
        }

        @JsonValue
        public String json() {
            return LABEL;
        }

        @Override
        public String toString() {
            return LABEL;
        }
    }
}
