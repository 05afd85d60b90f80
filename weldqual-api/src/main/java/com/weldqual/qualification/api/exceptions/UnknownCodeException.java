/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.api.exceptions;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a qualification code id is requested that was never registered.
 *
 * This is a RuntimeException: an unknown id is a caller or configuration
 * mistake, not a condition the derivation pipeline recovers from.
 */
public class UnknownCodeException extends RuntimeException {

    private final String codeId;
    private final List<String> registeredIds;

    public UnknownCodeException(String codeId, Collection<String> registeredIds) {
        super(String.format("Unknown code '%s'. Registered: %s",
                codeId, String.join(", ", registeredIds)));
        this.codeId = codeId;
        this.registeredIds = List.copyOf(registeredIds);
    }

    public String getCodeId() {
        return codeId;
    }

    public List<String> getRegisteredIds() {
        return registeredIds;
    }
}
