/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivationResult;
import com.weldqual.qualification.api.model.QualifiedField;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON reading of input records and writing of derivation results.
 *
 * <p>Field keys use the stable snake_case names; unlimited bounds are written
 * as the string {@code "Unlimited"}.
 */
public final class QualificationJson {

    private final ObjectMapper objectMapper;

    public QualificationJson() {
        this(false);
    }

    public QualificationJson(boolean prettyPrint) {
        SimpleModule module = new SimpleModule("weldqual");
        module.addKeySerializer(QualifiedField.class, new QualifiedFieldKeySerializer());

        this.objectMapper = new ObjectMapper()
                .registerModule(module)
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    public String write(DerivationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize derivation result", e);
        }
    }

    /**
     * Reads a flat JSON object of actual values.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public ActualValueRecord readRecord(String json) {
        try {
            return objectMapper.readValue(json, ActualValueRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid actual value record: " + e.getOriginalMessage(), e);
        }
    }

    private static final class QualifiedFieldKeySerializer extends JsonSerializer<QualifiedField> {
        @Override
        public void serialize(QualifiedField value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeFieldName(value.key());
        }
    }
}
