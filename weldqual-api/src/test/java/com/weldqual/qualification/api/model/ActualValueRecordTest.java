/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActualValueRecordTest {

    @Test
    @DisplayName("number() accepts numbers and numeric strings")
    void numberAcceptsNumbersAndNumericText() {
        ActualValueRecord record = ActualValueRecord.of(Map.of(
                "coupon_thickness", 0.375,
                "deposit_thickness_actual", " 0.25 ",
                "f_number", 104));

        assertThat(record.number("coupon_thickness")).contains(0.375);
        assertThat(record.number("deposit_thickness_actual")).contains(0.25);
        assertThat(record.number("f_number")).contains(104.0);
    }

    @Test
    @DisplayName("number() never throws on bad content")
    void numberIsEmptyForBadContent() {
        ActualValueRecord record = ActualValueRecord.of(Map.of(
                "coupon_thickness", "3/8 in",
                "deposit_thickness_actual", Double.NaN));

        assertThat(record.number("coupon_thickness")).isEmpty();
        assertThat(record.number("deposit_thickness_actual")).isEmpty();
        assertThat(record.number("missing")).isEmpty();
    }

    @Test
    void textIsTrimmedAndBlankIsEmpty() {
        Map<String, Object> values = new HashMap<>();
        values.put("test_position", "  6G ");
        values.put("backing_actual", "   ");
        values.put("filler_type", null);
        ActualValueRecord record = ActualValueRecord.of(values);

        assertThat(record.text("test_position")).contains("6G");
        assertThat(record.text("backing_actual")).isEmpty();
        assertThat(record.text("filler_type")).isEmpty();
    }

    @Test
    void recordWithOnlyNullsIsEmpty() {
        Map<String, Object> values = new HashMap<>();
        values.put("coupon_thickness", null);

        assertThat(ActualValueRecord.of(values).isEmpty()).isTrue();
        assertThat(ActualValueRecord.empty().isEmpty()).isTrue();
        assertThat(ActualValueRecord.of(Map.of("test_position", "1G")).isEmpty()).isFalse();
    }

    @Test
    void readsFromJsonObject() throws Exception {
        ActualValueRecord record = new ObjectMapper()
                .readValue("{\"coupon_thickness\":0.5,\"test_position\":\"2G\"}", ActualValueRecord.class);

        assertThat(record.number("coupon_thickness")).contains(0.5);
        assertThat(record.text("test_position")).contains("2G");
    }

    @Test
    void formTypeIsCaseInsensitive() {
        assertThat(FormType.of(" WPQ ")).isEqualTo(FormType.WPQ);
        assertThat(FormType.BPQR.isBrazing()).isTrue();
        assertThat(FormType.WPQ.isBrazing()).isFalse();
        assertThatThrownBy(() -> FormType.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
