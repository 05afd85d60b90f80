/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.registry;

import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.api.exceptions.UnknownCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of qualification codes keyed by code id.
 *
 * <p>Registration order is code priority: it decides execution order and
 * which code wins free-text disagreements when governing values are computed.
 *
 * <p><b>Concurrency:</b> the registry holds an immutable snapshot swapped
 * atomically on every registration. Readers never lock and always see a
 * consistent set of codes, even while a host registers new codes.
 */
public final class CodeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CodeRegistry.class);

    private final AtomicReference<Map<String, IQualificationCode>> snapshot =
            new AtomicReference<>(Collections.emptyMap());

    /**
     * Registers a code. Registering the same id again replaces the earlier
     * instance but keeps its original position.
     *
     * @throws IllegalArgumentException if the code id is blank
     */
    public void register(IQualificationCode code) {
        Objects.requireNonNull(code, "code");
        String codeId = code.codeId();
        if (codeId == null || codeId.isBlank()) {
            throw new IllegalArgumentException("Qualification code id must not be blank");
        }
        Map<String, IQualificationCode> previous = snapshot.getAndUpdate(current -> {
            Map<String, IQualificationCode> next = new LinkedHashMap<>(current);
            next.put(codeId, code);
            return Collections.unmodifiableMap(next);
        });
        if (previous.containsKey(codeId)) {
            logger.info("Replaced qualification code '{}' ({})", codeId, code.codeName());
        } else {
            logger.info("Registered qualification code '{}' ({})", codeId, code.codeName());
        }
    }

    /**
     * @throws UnknownCodeException if no code with this id is registered
     */
    public IQualificationCode get(String codeId) {
        Map<String, IQualificationCode> current = snapshot.get();
        IQualificationCode code = current.get(codeId);
        if (code == null) {
            throw new UnknownCodeException(codeId, sortedIds(current));
        }
        return code;
    }

    public boolean contains(String codeId) {
        return snapshot.get().containsKey(codeId);
    }

    /**
     * Registered ids in alphabetical order.
     */
    public List<String> listIds() {
        return sortedIds(snapshot.get());
    }

    /**
     * Registered codes in registration order.
     */
    public List<IQualificationCode> codes() {
        return List.copyOf(snapshot.get().values());
    }

    /**
     * One consistent view of the registered codes keyed by id, in
     * registration order. Later registrations do not change the returned map.
     */
    public Map<String, IQualificationCode> snapshot() {
        return snapshot.get();
    }

    public int size() {
        return snapshot.get().size();
    }

    private static List<String> sortedIds(Map<String, IQualificationCode> codes) {
        List<String> ids = new ArrayList<>(codes.keySet());
        Collections.sort(ids);
        return Collections.unmodifiableList(ids);
    }
}
