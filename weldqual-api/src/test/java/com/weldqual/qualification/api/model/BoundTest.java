/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Unlimited sorts above every finite value")
    void unlimitedIsGreatest() {
        List<Bound> bounds = new ArrayList<>(List.of(Bound.UNLIMITED, Bound.of(999.0), Bound.of(0.0625)));
        Collections.sort(bounds);

        assertThat(bounds).containsExactly(Bound.of(0.0625), Bound.of(999.0), Bound.UNLIMITED);
        assertThat(Bound.UNLIMITED.compareTo(new Bound.Unlimited())).isZero();
    }

    @Test
    void minAndMaxKeepFirstOnTie() {
        Bound first = Bound.of(1.0);
        Bound second = Bound.of(1.0);

        assertThat(Bound.min(first, second)).isSameAs(first);
        assertThat(Bound.max(first, second)).isSameAs(first);
        assertThat(Bound.min(Bound.UNLIMITED, Bound.of(4.0))).isEqualTo(Bound.of(4.0));
        assertThat(Bound.max(Bound.UNLIMITED, Bound.of(4.0))).isEqualTo(Bound.UNLIMITED);
    }

    @Test
    void shouldRejectNonFiniteValues() {
        assertThatThrownBy(() -> Bound.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Bound.of(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Bounds serialise as a number or the string Unlimited")
    void shouldSerialiseAsNumberOrLabel() throws Exception {
        DerivedField.NumericRange range = DerivedField.NumericRange.atLeast(0.0625, "QW-452.1(c)");

        assertThat(mapper.writeValueAsString(range))
                .isEqualTo("{\"min\":0.0625,\"max\":\"Unlimited\",\"reference\":\"QW-452.1(c)\"}");
    }
}
