/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.model;

/**
 * Shape of a qualified field, which decides how codes are combined into a
 * governing value.
 */
public enum FieldKind {
    /** min/max pair; governing is the intersection. */
    NUMERIC_RANGE,
    /** single maximum; governing is the smallest. */
    SCALAR,
    /** set of welding positions; governing is the intersection. */
    POSITION_SET,
    /** free text; governing is the first code in order. */
    TEXT,
    /** backing label; "With Only" outranks "With or Without". */
    RANKED_TEXT
}
