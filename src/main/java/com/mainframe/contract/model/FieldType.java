package com.mainframe.contract.model;

import java.util.Locale;

/**
 * Logical type of a decoded field. Serialized in lowercase.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    DATE,
    SIGN;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public static FieldType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ContractValidationException("Unknown field type: " + value);
        }
    }
}
