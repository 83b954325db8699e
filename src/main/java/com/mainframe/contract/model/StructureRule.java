package com.mainframe.contract.model;

import lombok.Builder;
import lombok.Value;

/**
 * Multiplicity and ordering constraint for one record type inside a scope.
 * A {@code null} maximum means unbounded.
 */
@Value
public class StructureRule {

    String label;
    String recordName;
    StructureScope scope;
    int minOccurs;
    Integer maxOccurs;
    int orderIndex;
    String description;

    @Builder(toBuilder = true)
    public StructureRule(String label, String recordName, StructureScope scope, int minOccurs, Integer maxOccurs,
                         int orderIndex, String description) {
        if (label == null || label.isBlank()) {
            throw new ContractValidationException("Structure rule label must not be empty.");
        }
        if (recordName == null || recordName.isBlank()) {
            throw new ContractValidationException("Structure rule " + label + " requires a record name.");
        }
        if (scope == null) {
            throw new ContractValidationException("Structure rule " + label + " requires a scope.");
        }
        if (minOccurs < 0) {
            throw new ContractValidationException("Structure rule " + label + " has negative min_occurs.");
        }
        if (maxOccurs != null && maxOccurs < Math.max(1, minOccurs)) {
            throw new ContractValidationException("Structure rule " + label + " has max_occurs " + maxOccurs
                    + " lower than " + Math.max(1, minOccurs));
        }
        if (orderIndex < 1) {
            throw new ContractValidationException("Structure rule " + label + " must have order_index >= 1.");
        }
        this.label = label;
        this.recordName = recordName;
        this.scope = scope;
        this.minOccurs = minOccurs;
        this.maxOccurs = maxOccurs;
        this.orderIndex = orderIndex;
        this.description = description == null ? "" : description;
    }

    public boolean isUnbounded() {
        return maxOccurs == null;
    }

    /**
     * Returns the violation message for an observed count, or {@code null} when the count is within bounds.
     */
    public String checkOccurrences(int count) {
        if (count < minOccurs) {
            return "Structure rule violated [" + label + "]: minimum " + minOccurs + ", found " + count + ".";
        }
        if (maxOccurs != null && count > maxOccurs) {
            return "Structure rule violated [" + label + "]: maximum " + maxOccurs + ", found " + count + ".";
        }
        return null;
    }
}
