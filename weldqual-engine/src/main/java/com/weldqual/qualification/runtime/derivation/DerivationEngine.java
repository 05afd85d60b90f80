/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.runtime.derivation;

import com.weldqual.qualification.api.IDerivationEngine;
import com.weldqual.qualification.api.IQualificationCode;
import com.weldqual.qualification.api.LookupHandle;
import com.weldqual.qualification.api.exceptions.UnknownCodeException;
import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.CodeDerivation;
import com.weldqual.qualification.api.model.DerivationResult;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.FormType;
import com.weldqual.qualification.api.model.QualifiedField;
import com.weldqual.qualification.api.model.RuleFired;
import com.weldqual.qualification.infra.registry.CodeRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every applicable qualification code against one record and combines
 * the results.
 *
 * <h2>Failure isolation</h2>
 * <p>Each derivation of each code runs in its own guard. An exception becomes
 * a warning on the result and a WARN log line; all other derivations still
 * run. The same holds for a code's name and form-type lookups. The only
 * exception that leaves {@link #derive} is {@link UnknownCodeException} for a
 * filter naming an unregistered code.
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from the registry, which is read lock-free. A single
 * instance can serve concurrent callers.
 */
public class DerivationEngine implements IDerivationEngine {
    private static final Logger logger = LoggerFactory.getLogger(DerivationEngine.class);

    static final String NO_VALUES_WARNING = "No actual values for derivation";

    private final CodeRegistry registry;
    private final Tracer tracer;
    private final GoverningResolver governingResolver = new GoverningResolver();
    private final boolean logRulesFired;

    public DerivationEngine(CodeRegistry registry) {
        this(registry, OpenTelemetry.noop().getTracer("weldqual-engine"), false);
    }

    public DerivationEngine(CodeRegistry registry, Tracer tracer) {
        this(registry, tracer, false);
    }

    /**
     * @param logRulesFired log each fired rule at INFO rather than DEBUG
     */
    public DerivationEngine(CodeRegistry registry, Tracer tracer, boolean logRulesFired) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.logRulesFired = logRulesFired;
    }

    @Override
    public DerivationResult derive(ActualValueRecord record, FormType formType, Collection<String> codeFilter,
                                   LookupHandle lookup) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(formType, "formType");
        LookupHandle handle = lookup != null ? lookup : LookupHandle.NONE;

        Span span = tracer.spanBuilder("derive-qualification").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("formType", formType.id());

            DerivationResult result = deriveInternal(record, formType, codeFilter, handle);

            span.setAttribute("codesRun", (long) result.perCode().size());
            span.setAttribute("warnings", (long) result.warnings().size());
            span.setAttribute("rulesFired", (long) result.rulesFired().size());
            logger.debug("Derived {} form with {} codes: {} rules fired, {} warnings",
                    formType, result.perCode().size(), result.rulesFired().size(), result.warnings().size());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private DerivationResult deriveInternal(ActualValueRecord record, FormType formType,
                                            Collection<String> codeFilter, LookupHandle lookup) {
        if (record.isEmpty()) {
            logger.warn(NO_VALUES_WARNING);
            return DerivationResult.withWarning(NO_VALUES_WARNING);
        }

        DerivationResult.Builder builder = DerivationResult.builder();
        Map<String, IQualificationCode> codes = selectCodes(formType, codeFilter, builder);
        if (codes.isEmpty()) {
            String warning = String.format("No applicable codes for form type '%s'", formType);
            logger.warn(warning);
            return builder.addWarning(warning).build();
        }

        codes.forEach((codeId, code) ->
                builder.putCodeDerivation(runCode(codeId, code, record, formType, lookup, builder)));

        governingResolver.resolve(builder.perCode(), builder);
        return builder.build();
    }

    /**
     * Candidate codes in registration order, keyed by their registered id.
     * A filter only narrows the candidates: every named id is resolved up
     * front so an unknown id fails before any derivation runs, and a named
     * code that does not cover the form type adds a warning.
     */
    private Map<String, IQualificationCode> selectCodes(FormType formType, Collection<String> codeFilter,
                                                        DerivationResult.Builder builder) {
        Map<String, IQualificationCode> registered = registry.snapshot();
        Set<String> requested = null;
        if (codeFilter != null) {
            requested = new LinkedHashSet<>();
            for (String codeId : codeFilter) {
                if (!registered.containsKey(codeId)) {
                    throw new UnknownCodeException(codeId, registry.listIds());
                }
                requested.add(codeId);
            }
        }

        Map<String, IQualificationCode> applicable = new LinkedHashMap<>();
        for (Map.Entry<String, IQualificationCode> entry : registered.entrySet()) {
            String codeId = entry.getKey();
            if (requested != null && !requested.contains(codeId)) {
                continue;
            }
            if (appliesTo(codeId, entry.getValue(), formType, builder)) {
                applicable.put(codeId, entry.getValue());
            } else if (requested != null) {
                String warning = String.format("Code '%s' not applicable to form type '%s'", codeId, formType);
                logger.warn(warning);
                builder.addWarning(warning);
            }
        }
        return applicable;
    }

    private boolean appliesTo(String codeId, IQualificationCode code, FormType formType,
                              DerivationResult.Builder builder) {
        try {
            Set<FormType> formTypes = code.applicableFormTypes();
            return formTypes != null && formTypes.contains(formType);
        } catch (RuntimeException e) {
            recordFailure(codeId, "applicability", builder, e);
            return false;
        }
    }

    private CodeDerivation runCode(String codeId, IQualificationCode code, ActualValueRecord record,
                                   FormType formType, LookupHandle lookup, DerivationResult.Builder builder) {
        Map<QualifiedField, DerivedField> fields = new LinkedHashMap<>();

        guarded(codeId, "thickness", builder, () -> code.deriveThickness(record, formType).ifPresentOrElse(
                range -> store(codeId, QualifiedField.THICKNESS, range, fields, builder),
                () -> builder.addSkipped(codeId, "thickness")));

        guarded(codeId, "diameter", builder, () -> code.deriveDiameter(record, formType).ifPresentOrElse(
                range -> store(codeId, QualifiedField.DIAMETER, range, fields, builder),
                () -> builder.addSkipped(codeId, "diameter")));

        guarded(codeId, "positions", builder, () -> code.derivePositions(record, formType, lookup).ifPresentOrElse(
                positions -> {
                    store(codeId, QualifiedField.GROOVE_POSITIONS, positions.grooveField(), fields, builder);
                    positions.filletField().ifPresent(
                            fillet -> store(codeId, QualifiedField.FILLET_POSITIONS, fillet, fields, builder));
                },
                () -> builder.addSkipped(codeId, "positions")));

        guarded(codeId, "backing", builder, () -> code.deriveBacking(record, formType).ifPresentOrElse(
                backing -> store(codeId, QualifiedField.BACKING_TYPE, backing, fields, builder),
                () -> builder.addSkipped(codeId, "backing")));

        guarded(codeId, "supplemental", builder, () -> {
            Map<QualifiedField, DerivedField> supplemental = Optional
                    .ofNullable(code.deriveSupplemental(record, formType, lookup))
                    .orElse(Map.of());
            supplemental.forEach((field, value) -> {
                if (accepts(field, value)) {
                    store(codeId, field, value, fields, builder);
                } else {
                    String warning = String.format("%s supplemental error: %s expects a %s value",
                            codeId, field.key(), field.kind());
                    logger.warn(warning);
                    builder.addWarning(warning);
                }
            });
        });

        return new CodeDerivation(codeId, displayName(codeId, code, builder), fields);
    }

    private String displayName(String codeId, IQualificationCode code, DerivationResult.Builder builder) {
        try {
            String codeName = code.codeName();
            return codeName != null ? codeName : codeId;
        } catch (RuntimeException e) {
            recordFailure(codeId, "name", builder, e);
            return codeId;
        }
    }

    private void guarded(String codeId, String derivation, DerivationResult.Builder builder, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            recordFailure(codeId, derivation, builder, e);
        }
    }

    private static void recordFailure(String codeId, String step, DerivationResult.Builder builder,
                                      RuntimeException e) {
        logger.warn("{} {} failed, continuing with remaining fields", codeId, step, e);
        builder.addWarning(String.format("%s %s error: %s", codeId, step, e.getMessage()));
    }

    private void store(String codeId, QualifiedField field, DerivedField value,
                       Map<QualifiedField, DerivedField> fields, DerivationResult.Builder builder) {
        fields.put(field, value);
        RuleFired rule = RuleFired.of(codeId, field, value);
        builder.addRuleFired(rule);
        if (logRulesFired) {
            logger.info("Rule fired: {} {} -> {} ({})", codeId, field.key(), value.display(), value.reference());
        } else {
            logger.debug("Rule fired: {} {} -> {} ({})", codeId, field.key(), value.display(), value.reference());
        }
    }

    private static boolean accepts(QualifiedField field, DerivedField value) {
        if (value == null) {
            return false;
        }
        return switch (field.kind()) {
            case NUMERIC_RANGE -> value instanceof DerivedField.NumericRange;
            case SCALAR -> value instanceof DerivedField.Scalar;
            case POSITION_SET -> value instanceof DerivedField.PositionSet;
            case TEXT, RANKED_TEXT -> value instanceof DerivedField.Text;
        };
    }
}
