/*
 * Copyright (c) 2025 WeldQual Qualification Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.weldqual.qualification.codes;

import com.weldqual.qualification.api.LookupHandle;
import com.weldqual.qualification.api.model.ActualValueRecord;
import com.weldqual.qualification.api.model.DerivedField;
import com.weldqual.qualification.api.model.PositionQualification;
import com.weldqual.qualification.codes.parsing.ValueParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Welding position cascade shared by ASME IX (QW-461.9) and AWS D1.1
 * (Table 6.10): a groove test position qualifies a set of groove positions
 * and a set of fillet positions; a fillet test position qualifies fillets only.
 */
public final class WeldingPositions {
    private static final Logger logger = LoggerFactory.getLogger(WeldingPositions.class);

    /** Groove sets this large cover every groove position. */
    static final int ALL_GROOVE_THRESHOLD = 6;
    /** Fillet sets this large cover every fillet position. */
    static final int ALL_FILLET_THRESHOLD = 5;

    private static final List<String> ALL_FILLETS = List.of("1F", "2F", "3F", "4F", "5F");

    private static final Map<String, List<String>> GROOVE = Map.of(
            "1G", List.of("1G"),
            "2G", List.of("1G", "2G"),
            "3G", List.of("1G", "3G"),
            "4G", List.of("1G", "4G"),
            "5G", List.of("1G", "2G", "3G", "4G", "5G"),
            "6G", List.of("1G", "2G", "3G", "4G", "5G", "6G"),
            "6GR", List.of("1G", "2G", "3G", "4G", "5G", "6G", "6GR"));

    private static final Map<String, List<String>> FILLET_FROM_GROOVE = Map.of(
            "1G", List.of("1F"),
            "2G", List.of("1F", "2F"),
            "3G", List.of("1F", "2F", "3F"),
            "4G", List.of("1F", "4F"),
            "5G", ALL_FILLETS,
            "6G", ALL_FILLETS,
            "6GR", ALL_FILLETS);

    private static final Map<String, List<String>> FILLET = Map.of(
            "1F", List.of("1F"),
            "2F", List.of("1F", "2F"),
            "3F", List.of("1F", "3F"),
            "4F", List.of("1F", "4F"),
            "5F", ALL_FILLETS);

    private WeldingPositions() {
    }

    /**
     * Reads the test position from the record and maps site-specific
     * designations through the {@code position_alias} lookup table.
     */
    public static Optional<String> resolve(ActualValueRecord record, LookupHandle lookup) {
        Optional<String> position = ValueParsers.parsePosition(
                record.text(ActualValueRecord.TEST_POSITION).orElse(null));
        if (position.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> alias = lookup.find(LookupHandle.POSITION_ALIAS_TABLE, position.get())
                .flatMap(ValueParsers::parsePosition);
        if (alias.isPresent()) {
            logger.debug("Position '{}' resolved to '{}' via lookup", position.get(), alias.get());
            return alias;
        }
        return position;
    }

    /**
     * Applies the cascade to a normalised test position.
     *
     * @param reference citation attached to the result
     * @return the qualification, or empty for a position outside the table
     */
    public static Optional<PositionQualification> qualify(String position, String reference) {
        List<String> groove = GROOVE.get(position);
        if (groove == null) {
            List<String> filletOnly = FILLET.get(position);
            if (filletOnly == null) {
                logger.debug("Unknown test position '{}'", position);
                return Optional.empty();
            }
            return Optional.of(new PositionQualification(
                    DerivedField.PositionSet.NOT_APPLICABLE, String.join(", ", filletOnly), reference));
        }

        List<String> fillet = FILLET_FROM_GROOVE.get(position);
        String grooveText = groove.size() >= ALL_GROOVE_THRESHOLD
                ? DerivedField.PositionSet.ALL
                : String.join(", ", groove);
        String filletText = fillet.size() >= ALL_FILLET_THRESHOLD
                ? DerivedField.PositionSet.ALL
                : String.join(", ", fillet);
        return Optional.of(new PositionQualification(grooveText, filletText, reference));
    }
}
