/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.config;

import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivationResult;
import com.weldqual.qualification.api.model.FormType;
import com.weldqual.qualification.infra.registry.CodeRegistry;
import com.weldqual.qualification.runtime.derivation.DerivationEngine;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineBootstrapTest {

    private static final ActualValueRecord RECORD = ActualValueRecord.of(Map.of(
            "coupon_thickness", 0.25,
            "test_position", "3G"));

    @Test
    void registersBuiltinCodesInPriorityOrder() {
        CodeRegistry registry = EngineBootstrap.registry(EngineConfig.defaults());

        assertThat(registry.codes()).extracting(c -> c.codeId()).containsExactly("asme_ix", "aws_d1_1");
    }

    @Test
    void configurationCanDisableCodes() {
        EngineConfig config = EngineConfig.builder()
                .enabledCodes(List.of("aws_d1_1", "api_1104"))
                .build();

        DerivationEngine engine = EngineBootstrap.create(config, OpenTelemetry.noop().getTracer("test"));
        DerivationResult result = engine.derive(RECORD, FormType.WPQ);

        assertThat(result.perCode()).containsOnlyKeys("aws_d1_1");
    }

    @Test
    void defaultEngineDerivesWithAllCodes() {
        DerivationResult result = EngineBootstrap.createDefault().derive(RECORD, FormType.WPQ);

        assertThat(result.perCode()).containsOnlyKeys("asme_ix", "aws_d1_1");
    }
}
