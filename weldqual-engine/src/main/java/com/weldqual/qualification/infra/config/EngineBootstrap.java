/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.config;

import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.codes.asme.AsmeIxCode;
import com.weldqual.qualification.codes.aws.AwsD11Code;
import com.weldqual.qualification.infra.registry.CodeRegistry;
import com.weldqual.qualification.runtime.derivation.DerivationEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wires the built-in codes into a ready-to-use engine.
 *
 * <p>Built-in codes are registered in priority order: ASME IX first, then
 * AWS D1.1. Hosts that need extra codes register them on
 * {@link #registry(EngineConfig)} before building their own engine.
 */
public final class EngineBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(EngineBootstrap.class);

    private EngineBootstrap() {
    }

    public static List<IQualificationCode> builtinCodes() {
        return List.of(new AsmeIxCode(), new AwsD11Code());
    }

    /**
     * Registry holding the built-in codes enabled by the configuration.
     */
    public static CodeRegistry registry(EngineConfig config) {
        CodeRegistry registry = new CodeRegistry();
        for (IQualificationCode code : builtinCodes()) {
            if (config.isCodeEnabled(code.codeId())) {
                registry.register(code);
            } else {
                logger.info("Qualification code '{}' disabled by configuration", code.codeId());
            }
        }
        for (String codeId : config.enabledCodes()) {
            if (!registry.contains(codeId)) {
                logger.warn("Enabled code '{}' is not a built-in code and was not registered", codeId);
            }
        }
        return registry;
    }

    public static DerivationEngine create(EngineConfig config, Tracer tracer) {
        CodeRegistry registry = registry(config);
        logger.info("Qualification engine ready with codes {}", registry.listIds());
        return new DerivationEngine(registry, tracer, config.logRulesFired());
    }

    /**
     * Engine from the default configuration with a no-op tracer.
     */
    public static DerivationEngine createDefault() {
        return create(EngineConfig.loadDefault(), OpenTelemetry.noop().getTracer("weldqual-engine"));
    }
}
