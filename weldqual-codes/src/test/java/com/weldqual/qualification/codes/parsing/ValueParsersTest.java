/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.codes.parsing;

import com.weldqual.qualification.api.model.ActualValueRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValueParsersTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "2\" N.P.S (2.375\" OD) | 2.375",
            "2.375 od              | 2.375",
            "2.375\u201d OD        | 2.375",
            "2-7/8                 | 2.875",
            "2-1/8                 | 2.125",
            "7/8                   | 0.875",
            "24                    | 24.0",
            "0.840                 | 0.84"
    })
    @DisplayName("Diameter formats parse to inches")
    void shouldParseDiameterFormats(String text, double expected) {
        assertThat(ValueParsers.parseDiameter(text)).hasValueSatisfying(
                od -> assertThat(od).isCloseTo(expected, within(1e-9)));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "NPS 2", "1/0", "2-1/0", "..", "Plate"})
    void shouldRejectUnparseableDiameters(String text) {
        assertThat(ValueParsers.parseDiameter(text)).isEmpty();
    }

    @Test
    void shouldNormalisePosition() {
        assertThat(ValueParsers.parsePosition(" 6gr ")).contains("6GR");
        assertThat(ValueParsers.parsePosition("")).isEmpty();
        assertThat(ValueParsers.parsePosition(null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "N/A Single Sided weld open root",
            "Without",
            "None",
            "No backing",
            "Consumable Insert",
            "OPEN ROOT"
    })
    void noBackingPhrasesMeanNoBacking(String backing) {
        assertThat(ValueParsers.hasBacking(recordWithBacking(backing))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"With Backing", "Metal backing strip", "Back gouged"})
    void otherTextMeansBacking(String backing) {
        assertThat(ValueParsers.hasBacking(recordWithBacking(backing))).isTrue();
    }

    @Test
    @DisplayName("Blank backing entry is assumed to be with backing")
    void blankBackingDefaultsToBacking() {
        assertThat(ValueParsers.hasBacking(recordWithBacking(""))).isTrue();
        assertThat(ValueParsers.hasBacking(recordWithBacking(null))).isTrue();
    }

    @Test
    void shouldExtractDesignationNumbers() {
        assertThat(ValueParsers.extractPNumbers("P-1 to P-8")).containsExactly(1, 8);
        assertThat(ValueParsers.extractPNumbers("p43")).containsExactly(43);
        assertThat(ValueParsers.extractFNumbers("F3/F4")).containsExactly(3, 4);
        assertThat(ValueParsers.extractFNumbers("Coated electrode")).isEmpty();
        assertThat(ValueParsers.extractFNumbers(null)).isEmpty();
    }

    private static ActualValueRecord recordWithBacking(String backing) {
        Map<String, Object> values = new HashMap<>();
        values.put(ActualValueRecord.BACKING_ACTUAL, backing);
        return ActualValueRecord.of(values);
    }
}
