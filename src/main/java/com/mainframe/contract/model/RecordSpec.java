package com.mainframe.contract.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A record type: its selector and its ordered, non-overlapping fields.
 */
@Value
public class RecordSpec {

    String name;
    SelectorSpec selector;
    List<FieldSpec> fields;

    @Builder(toBuilder = true)
    public RecordSpec(String name, SelectorSpec selector, @Singular List<FieldSpec> fields) {
        if (name == null || name.isBlank()) {
            throw new ContractValidationException("Record name must not be empty.");
        }
        if (selector == null) {
            throw new ContractValidationException("Record " + name + " requires a selector.");
        }
        if (fields == null || fields.isEmpty()) {
            throw new ContractValidationException("Record " + name + " must declare at least one field.");
        }
        checkUniqueNames(name, fields);
        checkNoOverlap(name, fields);
        this.name = name;
        this.selector = selector;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public int getSumOfLengths() {
        return fields.stream().mapToInt(FieldSpec::getLength).sum();
    }

    public int getMaxEnd() {
        return fields.stream().mapToInt(FieldSpec::getEnd).max().orElse(0);
    }

    public Optional<FieldSpec> findField(String fieldName) {
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    private static void checkUniqueNames(String record, List<FieldSpec> fields) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (FieldSpec field : fields) {
            if (!seen.add(field.getName())) {
                duplicates.add(field.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ContractValidationException("Duplicate field names in " + record + ": " + duplicates);
        }
    }

    private static void checkNoOverlap(String record, List<FieldSpec> fields) {
        List<FieldSpec> sorted = new ArrayList<>(fields);
        sorted.sort(Comparator.comparingInt(FieldSpec::getStart));
        FieldSpec previous = null;
        for (FieldSpec field : sorted) {
            if (previous != null && field.getStart() <= previous.getEnd()) {
                throw new ContractValidationException("Overlapping fields in " + record + ": " + field.getName()
                        + " starts at " + field.getStart() + " but previous field ends at " + previous.getEnd());
            }
            previous = field;
        }
    }
}
