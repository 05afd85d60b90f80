/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every field a qualification code can derive.
 *
 * <p>The key is the stable external name used in JSON output and in the
 * governing-code attribution map.
 */
public enum QualifiedField {
    THICKNESS("thickness_qualified", FieldKind.NUMERIC_RANGE),
    DIAMETER("diameter_qualified", FieldKind.NUMERIC_RANGE),
    GROOVE_POSITIONS("groove_positions_qualified", FieldKind.POSITION_SET),
    FILLET_POSITIONS("fillet_positions_qualified", FieldKind.POSITION_SET),
    BACKING_TYPE("backing_type", FieldKind.RANKED_TEXT),
    P_NUMBER("p_number_qualified", FieldKind.TEXT),
    F_NUMBER("f_number_qualified", FieldKind.TEXT),
    DEPOSIT_THICKNESS_MAX("deposit_thickness_max", FieldKind.SCALAR),
    FILLER_TYPE("filler_type_qualified", FieldKind.TEXT),
    JOINT_TYPE("joint_type_qualified", FieldKind.TEXT),
    OVERLAP("overlap_qualified", FieldKind.TEXT);

    private final String key;
    private final FieldKind kind;

    QualifiedField(String key, FieldKind kind) {
        this.key = key;
        this.kind = kind;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public FieldKind kind() {
        return kind;
    }

    public String minAttribute() {
        return key + "_min";
    }

    public String maxAttribute() {
        return key + "_max";
    }
}
