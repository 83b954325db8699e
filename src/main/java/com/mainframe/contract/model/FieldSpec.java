package com.mainframe.contract.model;

import lombok.Builder;
import lombok.Value;

/**
 * One field of a record type: a 1-based byte range and its logical type.
 */
@Value
public class FieldSpec {

    String name;
    int start;
    int length;
    FieldType type;
    Integer decimals;
    String description;

    @Builder(toBuilder = true)
    public FieldSpec(String name, int start, int length, FieldType type, Integer decimals, String description) {
        if (name == null || name.isBlank()) {
            throw new ContractValidationException("Field name must not be empty.");
        }
        if (start < 1) {
            throw new ContractValidationException("Field " + name + " must start at position 1 or later, got " + start);
        }
        if (length < 1) {
            throw new ContractValidationException("Field " + name + " must have a positive length, got " + length);
        }
        FieldType effectiveType = type == null ? FieldType.STRING : type;
        if (effectiveType == FieldType.DECIMAL && decimals == null) {
            throw new ContractValidationException("Field " + name + " of type decimal requires decimals.");
        }
        if (effectiveType != FieldType.DECIMAL && decimals != null) {
            throw new ContractValidationException("Field " + name + " of type " + effectiveType.getValue()
                    + " cannot have decimals.");
        }
        if (decimals != null && decimals < 0) {
            throw new ContractValidationException("Field " + name + " has negative decimals: " + decimals);
        }
        this.name = name;
        this.start = start;
        this.length = length;
        this.type = effectiveType;
        this.decimals = decimals;
        this.description = description;
    }

    /**
     * Last byte position covered by the field, inclusive.
     */
    public int getEnd() {
        return start + length - 1;
    }

    /**
     * Extracts the raw slice of this field from a line already fitted to the record length.
     */
    public String slice(String line) {
        int from = Math.min(start - 1, line.length());
        int to = Math.min(getEnd(), line.length());
        return line.substring(from, to);
    }
}
