/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single derived value together with the code clause that produced it.
 */
public sealed interface DerivedField extends Serializable
        permits DerivedField.NumericRange, DerivedField.Scalar, DerivedField.PositionSet, DerivedField.Text {

    /**
     * Code clause or table the value was derived from, e.g. {@code QW-452.1(b)}.
     */
    String reference();

    /**
     * Human-readable value without the reference.
     */
    @JsonIgnore
    String display();

    record NumericRange(
            @JsonProperty("min") Bound min,
            @JsonProperty("max") Bound max,
            @JsonProperty("reference") String reference
    ) implements DerivedField {

        public NumericRange {
            Objects.requireNonNull(min, "min");
            Objects.requireNonNull(max, "max");
            Objects.requireNonNull(reference, "reference");
        }

        public static NumericRange of(double min, double max, String reference) {
            return new NumericRange(Bound.of(min), Bound.of(max), reference);
        }

        public static NumericRange atLeast(double min, String reference) {
            return new NumericRange(Bound.of(min), Bound.UNLIMITED, reference);
        }

        /** True when min is above max, i.e. nothing satisfies the range. */
        @JsonIgnore
        public boolean isEmpty() {
            return min.compareTo(max) > 0;
        }

        public boolean contains(double value) {
            return Bound.of(value).compareTo(min) >= 0 && Bound.of(value).compareTo(max) <= 0;
        }

        @Override
        public String display() {
            return min + " - " + max;
        }
    }

    record Scalar(
            @JsonProperty("value") double value,
            @JsonProperty("reference") String reference
    ) implements DerivedField {

        public Scalar {
            Objects.requireNonNull(reference, "reference");
        }

        @Override
        public String display() {
            return String.format("%.4f\"", value);
        }
    }

    record PositionSet(
            @JsonProperty("value") String value,
            @JsonProperty("reference") String reference
    ) implements DerivedField {

        public static final String ALL = "All";
        public static final String NOT_APPLICABLE = "N/A";

        public PositionSet {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(reference, "reference");
        }

        public static PositionSet of(Collection<String> positions, String reference) {
            return new PositionSet(String.join(", ", positions), reference);
        }

        @JsonIgnore
        public boolean isAll() {
            return ALL.equals(value);
        }

        @JsonIgnore
        public boolean isNotApplicable() {
            return NOT_APPLICABLE.equals(value);
        }

        /**
         * Explicit positions in this set; empty for {@code All} and {@code N/A}.
         */
        @JsonIgnore
        public Set<String> positions() {
            if (isAll() || isNotApplicable() || value.isBlank()) {
                return Set.of();
            }
            Set<String> result = new LinkedHashSet<>();
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
            return Collections.unmodifiableSet(result);
        }

        @Override
        public String display() {
            return value;
        }
    }

    record Text(
            @JsonProperty("value") String value,
            @JsonProperty("reference") String reference
    ) implements DerivedField {

        /** Backing label for a coupon welded with backing; outranks {@link #WITH_OR_WITHOUT}. */
        public static final String WITH_ONLY = "With Only";
        public static final String WITH_OR_WITHOUT = "With or Without";

        public Text {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(reference, "reference");
        }

        @Override
        public String display() {
            return value;
        }
    }
}
