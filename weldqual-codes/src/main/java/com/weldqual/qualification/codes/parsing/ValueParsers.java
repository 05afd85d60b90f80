/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.codes.parsing;

import com.weldqual.qualification.api.model.ActualValueRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the free-text values found on qualification forms.
 *
 * <p>Every parser is total: bad input yields {@link Optional#empty()} or a
 * default, never an exception.
 */
public final class ValueParsers {

    // 2" N.P.S (2.375" OD), 2.375 OD; the inch mark may be a curly quote
    private static final Pattern OD_ANNOTATION =
            Pattern.compile("([\\d.]+)\\s*[\"\u201d]?\\s*OD", Pattern.CASE_INSENSITIVE);
    private static final Pattern MIXED_FRACTION = Pattern.compile("^(\\d{1,9})-(\\d{1,9})/(\\d{1,9})$");
    private static final Pattern FRACTION = Pattern.compile("^(\\d{1,9})/(\\d{1,9})$");
    private static final Pattern DECIMAL = Pattern.compile("^[\\d.]+$");

    private static final Pattern P_DESIGNATION = Pattern.compile("P-?(\\d{1,9})", Pattern.CASE_INSENSITIVE);
    private static final Pattern F_DESIGNATION = Pattern.compile("F-?(\\d{1,9})", Pattern.CASE_INSENSITIVE);

    private static final List<String> NO_BACKING_PHRASES = List.of(
            "open root", "without", "n/a", "none", "no backing", "single sided", "consumable insert");

    private ValueParsers() {
    }

    /**
     * Parses a pipe diameter into inches.
     *
     * <p>Formats are tried in order: an explicit OD annotation anywhere in the
     * text, a mixed fraction {@code 2-7/8}, a bare fraction {@code 7/8}, then a
     * bare decimal {@code 24}.
     */
    public static Optional<Double> parseDiameter(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String s = text.trim();

        Matcher od = OD_ANNOTATION.matcher(s);
        if (od.find()) {
            return parseDecimal(od.group(1));
        }

        Matcher mixed = MIXED_FRACTION.matcher(s);
        if (mixed.matches()) {
            return fraction(mixed.group(2), mixed.group(3))
                    .map(f -> Integer.parseInt(mixed.group(1)) + f);
        }

        Matcher fraction = FRACTION.matcher(s);
        if (fraction.matches()) {
            return fraction(fraction.group(1), fraction.group(2));
        }

        if (DECIMAL.matcher(s).matches()) {
            return parseDecimal(s);
        }
        return Optional.empty();
    }

    /**
     * Normalises a test position: {@code " 2g"} becomes {@code "2G"}.
     */
    public static Optional<String> parsePosition(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * True when the test was welded with backing. A blank backing entry is
     * assumed to mean backing was used.
     */
    public static boolean hasBacking(ActualValueRecord record) {
        Optional<String> backing = record.text(ActualValueRecord.BACKING_ACTUAL);
        if (backing.isEmpty()) {
            return true;
        }
        String lower = backing.get().toLowerCase(Locale.ROOT);
        for (String phrase : NO_BACKING_PHRASES) {
            if (lower.contains(phrase)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extracts every P-number in a designation such as {@code "P-1 to P-8"}.
     */
    public static List<Integer> extractPNumbers(String text) {
        return extractNumbers(text, P_DESIGNATION);
    }

    /**
     * Extracts every F-number in a designation such as {@code "F3/F4"}.
     */
    public static List<Integer> extractFNumbers(String text) {
        return extractNumbers(text, F_DESIGNATION);
    }

    private static List<Integer> extractNumbers(String text, Pattern designation) {
        if (text == null) {
            return List.of();
        }
        List<Integer> numbers = new ArrayList<>();
        Matcher m = designation.matcher(text);
        while (m.find()) {
            numbers.add(Integer.parseInt(m.group(1)));
        }
        return Collections.unmodifiableList(numbers);
    }

    private static Optional<Double> fraction(String numerator, String denominator) {
        int den = Integer.parseInt(denominator);
        if (den == 0) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(numerator) / (double) den);
    }

    private static Optional<Double> parseDecimal(String text) {
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            // "." or "1.2.3" match the digit/dot class but are not numbers
            return Optional.empty();
        }
    }
}
