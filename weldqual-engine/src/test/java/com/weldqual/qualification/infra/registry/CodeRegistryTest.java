/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.registry;

import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.api.exceptions.UnknownCodeException;
import com.weldqual.qualification.codes.asme.AsmeIxCode;
import com.weldqual.qualification.codes.aws.AwsD11Code;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CodeRegistryTest {

    private CodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CodeRegistry();
    }

    @Test
    void shouldRegisterAndLookUpCodes() {
        AsmeIxCode asme = new AsmeIxCode();
        registry.register(asme);

        assertThat(registry.get("asme_ix")).isSameAs(asme);
        assertThat(registry.contains("asme_ix")).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("listIds is sorted, codes() keeps registration order")
    void shouldExposeSortedIdsAndOrderedCodes() {
        IQualificationCode zeta = code("zeta_code");
        registry.register(zeta);
        registry.register(new AsmeIxCode());

        assertThat(registry.listIds()).containsExactly("asme_ix", "zeta_code");
        assertThat(registry.codes()).extracting(IQualificationCode::codeId)
                .containsExactly("zeta_code", "asme_ix");
    }

    @Test
    @DisplayName("Re-registering an id replaces the code in its original slot")
    void reRegistrationIsIdempotentAndKeepsSlot() {
        registry.register(new AsmeIxCode());
        registry.register(new AwsD11Code());
        AsmeIxCode replacement = new AsmeIxCode();
        registry.register(replacement);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.codes()).extracting(IQualificationCode::codeId)
                .containsExactly("asme_ix", "aws_d1_1");
        assertThat(registry.get("asme_ix")).isSameAs(replacement);
    }

    @Test
    @DisplayName("A snapshot is unaffected by later registrations")
    void snapshotIsStable() {
        registry.register(new AwsD11Code());
        Map<String, IQualificationCode> before = registry.snapshot();

        registry.register(new AsmeIxCode());

        assertThat(before).containsOnlyKeys("aws_d1_1");
        assertThat(registry.snapshot().keySet()).containsExactly("aws_d1_1", "asme_ix");
    }

    @Test
    void unknownIdNamesRegisteredCodes() {
        registry.register(new AwsD11Code());
        registry.register(new AsmeIxCode());

        assertThatThrownBy(() -> registry.get("api_1104"))
                .isInstanceOf(UnknownCodeException.class)
                .hasMessage("Unknown code 'api_1104'. Registered: asme_ix, aws_d1_1")
                .satisfies(e -> assertThat(((UnknownCodeException) e).getCodeId()).isEqualTo("api_1104"));
    }

    @Test
    void shouldRejectBlankIds() {
        assertThatThrownBy(() -> registry.register(code(" ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void snapshotsAreImmutable() {
        registry.register(new AsmeIxCode());

        assertThatThrownBy(() -> registry.codes().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.listIds().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    private static IQualificationCode code(String id) {
        IQualificationCode code = mock(IQualificationCode.class);
        when(code.codeId()).thenReturn(id);
        return code;
    }
}
