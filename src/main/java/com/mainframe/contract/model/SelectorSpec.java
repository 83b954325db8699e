package com.mainframe.contract.model;

import lombok.Builder;
import lombok.Value;

/**
 * Identifies a record type by the literal found at a fixed position of the line.
 */
@Value
public class SelectorSpec {

    int start;
    int length;
    String value;

    @Builder
    public SelectorSpec(int start, int length, String value) {
        if (start < 1) {
            throw new ContractValidationException("Selector start must be >= 1, got " + start);
        }
        if (length < 1) {
            throw new ContractValidationException("Selector length must be >= 1, got " + length);
        }
        if (value == null || value.isEmpty()) {
            throw new ContractValidationException("Selector value must not be empty.");
        }
        this.start = start;
        this.length = length;
        this.value = value;
    }

    public int getEnd() {
        return start + length - 1;
    }

    public boolean matches(String line) {
        if (line == null || line.length() < getEnd()) {
            return false;
        }
        return line.substring(start - 1, getEnd()).equals(value);
    }
}
