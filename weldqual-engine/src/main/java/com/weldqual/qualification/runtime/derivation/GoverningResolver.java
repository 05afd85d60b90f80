/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.runtime.derivation;

import com.weldqual.qualification.api.model.Bound;
import com.weldqual.qualification.api.model.CodeDerivation;
import com.weldqual.qualification.api.model.DerivationResult;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.DerivedField.NumericRange;
import com.weldqual.qualification.api.model.DerivedField.PositionSet;
import com.weldqual.qualification.api.model.QualifiedField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Combines per-code values into the governing (most restrictive) value for
 * each field and records which code supplied it.
 *
 * <p>Contributions are visited in code execution order, so "first" always
 * means the highest-priority code.
 */
public final class GoverningResolver {
    private static final Logger logger = LoggerFactory.getLogger(GoverningResolver.class);

    /**
     * Resolves every field present in at least one code derivation.
     */
    public void resolve(Map<String, CodeDerivation> perCode, DerivationResult.Builder builder) {
        for (QualifiedField field : QualifiedField.values()) {
            List<Contribution> contributions = collect(perCode, field);
            if (contributions.isEmpty()) {
                continue;
            }
            switch (field.kind()) {
                case NUMERIC_RANGE -> resolveRange(field, contributions, builder);
                case SCALAR -> resolveScalar(field, contributions, builder);
                case POSITION_SET -> resolvePositions(field, contributions, builder);
                case TEXT -> apply(field, contributions.get(0), builder);
                case RANKED_TEXT -> resolveBacking(field, contributions, builder);
            }
        }
    }

    private static List<Contribution> collect(Map<String, CodeDerivation> perCode, QualifiedField field) {
        List<Contribution> contributions = new ArrayList<>();
        for (CodeDerivation derivation : perCode.values()) {
            derivation.field(field).ifPresent(value -> contributions.add(new Contribution(derivation.codeId(), value)));
        }
        return contributions;
    }

    // Intersection: highest min, lowest max; ties keep the earlier code
    private void resolveRange(QualifiedField field, List<Contribution> contributions,
                              DerivationResult.Builder builder) {
        Contribution minSource = null;
        Contribution maxSource = null;
        for (Contribution c : contributions) {
            NumericRange range = (NumericRange) c.value();
            if (minSource == null || range.min().compareTo(((NumericRange) minSource.value()).min()) > 0) {
                minSource = c;
            }
            if (maxSource == null || range.max().compareTo(((NumericRange) maxSource.value()).max()) < 0) {
                maxSource = c;
            }
        }

        NumericRange minRange = (NumericRange) minSource.value();
        NumericRange maxRange = (NumericRange) maxSource.value();
        Bound min = minRange.min();
        Bound max = maxRange.max();
        String reference = minSource == maxSource
                ? minRange.reference()
                : minRange.reference() + "; " + maxRange.reference();

        if (min.compareTo(max) > 0) {
            String warning = String.format("Governing %s is empty: min %s from %s exceeds max %s from %s",
                    field.key(), min, minSource.codeId(), max, maxSource.codeId());
            logger.warn(warning);
            builder.addWarning(warning);
        }

        builder.putGoverning(field, new NumericRange(min, max, reference));
        builder.attribute(field.minAttribute(), minSource.codeId());
        builder.attribute(field.maxAttribute(), maxSource.codeId());
    }

    private void resolveScalar(QualifiedField field, List<Contribution> contributions,
                               DerivationResult.Builder builder) {
        Contribution smallest = contributions.get(0);
        for (Contribution c : contributions) {
            if (((DerivedField.Scalar) c.value()).value() < ((DerivedField.Scalar) smallest.value()).value()) {
                smallest = c;
            }
        }
        apply(field, smallest, builder);
    }

    private void resolvePositions(QualifiedField field, List<Contribution> contributions,
                                  DerivationResult.Builder builder) {
        List<Contribution> restricting = new ArrayList<>();
        Contribution firstApplicable = null;
        boolean anyNotApplicable = false;
        for (Contribution c : contributions) {
            PositionSet set = (PositionSet) c.value();
            if (set.isNotApplicable()) {
                anyNotApplicable = true;
                continue;
            }
            if (firstApplicable == null) {
                firstApplicable = c;
            }
            if (!set.isAll()) {
                restricting.add(c);
            }
        }

        if (anyNotApplicable) {
            // A fillet-only test leaves groove positions unqualified for that code
            apply(field, firstApplicable != null ? firstApplicable : contributions.get(0), builder);
            return;
        }
        if (restricting.isEmpty()) {
            apply(field, contributions.get(0), builder);
            return;
        }

        Set<String> common = new TreeSet<>(((PositionSet) restricting.get(0).value()).positions());
        for (Contribution c : restricting.subList(1, restricting.size())) {
            common.retainAll(((PositionSet) c.value()).positions());
        }
        Contribution first = restricting.get(0);
        if (common.isEmpty()) {
            String warning = String.format("Governing %s is empty: no position is qualified by every code",
                    field.key());
            logger.warn(warning);
            builder.addWarning(warning);
        }
        builder.putGoverning(field, PositionSet.of(common, first.value().reference()));
        builder.attribute(field.key(), first.codeId());
    }

    private void resolveBacking(QualifiedField field, List<Contribution> contributions,
                                DerivationResult.Builder builder) {
        for (Contribution c : contributions) {
            if (DerivedField.Text.WITH_ONLY.equals(((DerivedField.Text) c.value()).value())) {
                apply(field, c, builder);
                return;
            }
        }
        apply(field, contributions.get(0), builder);
    }

    private static void apply(QualifiedField field, Contribution source, DerivationResult.Builder builder) {
        builder.putGoverning(field, source.value());
        builder.attribute(field.key(), source.codeId());
    }

    private record Contribution(String codeId, DerivedField value) {
    }
}
