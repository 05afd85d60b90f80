/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup handle a caller may hand to the derivation engine.
 *
 * <p>Codes consult it for site-specific reference data (for example position
 * aliases). Implementations must only read; transaction boundaries belong to
 * the caller.
 */
@FunctionalInterface
public interface LookupHandle {

    /** Table of site-specific position designations mapped to canonical codes. */
    String POSITION_ALIAS_TABLE = "position_alias";

    /** A handle with no tables. */
    LookupHandle NONE = (table, key) -> Optional.empty();

    /**
     * Looks up a single value.
     *
     * @param table logical table name
     * @param key   lookup key
     * @return the value, or empty when the table or key is unknown
     */
    Optional<String> find(String table, String key);

    /**
     * Creates a handle backed by in-memory tables.
     */
    static LookupHandle of(Map<String, Map<String, String>> tables) {
        Map<String, Map<String, String>> snapshot = Map.copyOf(tables);
        return (table, key) -> {
            Map<String, String> rows = snapshot.get(table);
            return rows == null ? Optional.empty() : Optional.ofNullable(rows.get(key));
        };
    }
}
