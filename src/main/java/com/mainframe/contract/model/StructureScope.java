package com.mainframe.contract.model;

import java.util.Locale;

/**
 * Where a structure rule counts its occurrences.
 */
public enum StructureScope {
    /** Counted over the whole file. */
    FILE,
    /** Counted per invoice block. */
    INVOICE,
    /** Counted per detail-line segment of a block. */
    LINE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StructureScope fromValue(String value) {
        if (value == null) {
            throw new ContractValidationException("Structure scope is required.");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ContractValidationException("Unknown structure scope: " + value);
        }
    }
}
