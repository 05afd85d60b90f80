/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Qualification form a record belongs to. Kept open rather than an enum so
 * new forms can be introduced by new codes without touching this module.
 */
public record FormType(String id) implements Serializable {

    public static final FormType WPQ = new FormType("wpq");
    public static final FormType BPQR = new FormType("bpqr");

    public FormType {
        Objects.requireNonNull(id, "id");
        id = id.trim().toLowerCase(Locale.ROOT);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Form type id must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FormType of(String id) {
        return new FormType(id);
    }

    /** Brazing forms switch the codes to their brazing tables. */
    public boolean isBrazing() {
        return BPQR.id.equals(id);
    }

    @JsonValue
    @Override
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
