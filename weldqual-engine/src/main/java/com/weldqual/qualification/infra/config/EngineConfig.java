/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.infra.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration for the qualification engine.
 *
 * <p><b>Configuration sources</b> (in priority order):
 * <ol>
 *   <li>Environment variables (highest priority)</li>
 *   <li>Properties file ({@code qualification-engine.properties})</li>
 *   <li>Builder defaults (lowest priority)</li>
 * </ol>
 *
 * <p><b>Environment variables:</b>
 * <pre>
 * QUALIFICATION_ENABLED_CODES=asme_ix,aws_d1_1   # empty or unset = all built-in codes
 * QUALIFICATION_LOG_RULES_FIRED=true             # log every fired rule at INFO
 * </pre>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig custom = EngineConfig.builder()
 *     .enabledCodes(List.of("asme_ix"))
 *     .logRulesFired(true)
 *     .build();
 * }</pre>
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_PROPERTIES = "qualification-engine.properties";

    static final String PROP_ENABLED_CODES = "enabled.codes";
    static final String PROP_LOG_RULES_FIRED = "log.rules.fired";

    static final String ENV_ENABLED_CODES = "QUALIFICATION_ENABLED_CODES";
    static final String ENV_LOG_RULES_FIRED = "QUALIFICATION_LOG_RULES_FIRED";

    private final Set<String> enabledCodes;
    private final boolean logRulesFired;

    private EngineConfig(Builder builder) {
        this.enabledCodes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.enabledCodes));
        this.logRulesFired = builder.logRulesFired;
    }

    /**
     * Code ids the bootstrap registers; empty means every built-in code.
     */
    public Set<String> enabledCodes() {
        return enabledCodes;
    }

    public boolean isCodeEnabled(String codeId) {
        return enabledCodes.isEmpty() || enabledCodes.contains(codeId);
    }

    public boolean logRulesFired() {
        return logRulesFired;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} and applies environment overrides.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads configuration from a properties file, searched on the classpath
     * first and then on the file system. A missing file falls back to
     * defaults. Environment variables override file values.
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading engine configuration from: {}", propertiesPath);
        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.warn("Could not load properties file: {}. Using defaults.", propertiesPath);
            }
        }

        return fromSources(props, System.getenv());
    }

    /**
     * Builds a configuration from explicit sources; environment wins.
     */
    static EngineConfig fromSources(Properties props, Map<String, String> env) {
        Builder builder = builder();

        Optional.ofNullable(props.getProperty(PROP_ENABLED_CODES))
                .ifPresent(val -> builder.enabledCodes(splitIds(val)));
        Optional.ofNullable(props.getProperty(PROP_LOG_RULES_FIRED))
                .map(String::trim)
                .ifPresent(val -> builder.logRulesFired(Boolean.parseBoolean(val)));

        getEnv(env, ENV_ENABLED_CODES).ifPresent(val -> builder.enabledCodes(splitIds(val)));
        getEnv(env, ENV_LOG_RULES_FIRED).ifPresent(val -> builder.logRulesFired(Boolean.parseBoolean(val)));

        return builder.build();
    }

    private static Optional<String> getEnv(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null ? Optional.empty() : Optional.of(value.trim());
    }

    private static List<String> splitIds(String value) {
        List<String> ids = new ArrayList<>();
        for (String part : value.split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().enabledCodes(enabledCodes).logRulesFired(logRulesFired);
    }

    @Override
    public String toString() {
        return "EngineConfig{enabledCodes=" + enabledCodes + ", logRulesFired=" + logRulesFired + "}";
    }

    public static final class Builder {
        private final Set<String> enabledCodes = new LinkedHashSet<>();
        private boolean logRulesFired = false;

        private Builder() {
        }

        /** Replaces the enabled code ids. */
        public Builder enabledCodes(Collection<String> codeIds) {
            enabledCodes.clear();
            enabledCodes.addAll(codeIds);
            return this;
        }

        public Builder logRulesFired(boolean logRulesFired) {
            this.logRulesFired = logRulesFired;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
