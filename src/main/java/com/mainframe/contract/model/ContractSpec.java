package com.mainframe.contract.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;

/**
 * The complete description of a fixed-width file: line length, record types and structure rules.
 * <p>
 * Every invariant is checked at construction, so a contract that exists is a valid one.
 */
@Value
public class ContractSpec {

    public static final String DEFAULT_SCHEMA_VERSION = "1.0";

    String schemaVersion;
    String sourceProgram;
    Instant generatedAt;
    int lineLength;
    boolean strictLengthValidation;
    boolean strictStructureValidation;
    String structureSource;
    List<StructureRule> structureRules;
    List<RecordSpec> recordTypes;

    @Builder(toBuilder = true)
    public ContractSpec(String schemaVersion, String sourceProgram, Instant generatedAt, int lineLength,
                        Boolean strictLengthValidation, Boolean strictStructureValidation, String structureSource,
                        List<StructureRule> structureRules, List<RecordSpec> recordTypes) {
        if (sourceProgram == null || sourceProgram.isBlank()) {
            throw new ContractValidationException("Contract source program must not be empty.");
        }
        if (lineLength < 1) {
            throw new ContractValidationException("Line length must be >= 1, got " + lineLength);
        }
        if (recordTypes == null || recordTypes.isEmpty()) {
            throw new ContractValidationException("Contract must declare at least one record type.");
        }
        this.schemaVersion = schemaVersion == null || schemaVersion.isBlank() ? DEFAULT_SCHEMA_VERSION : schemaVersion;
        this.sourceProgram = sourceProgram;
        this.generatedAt = (generatedAt == null ? Instant.now() : generatedAt).truncatedTo(ChronoUnit.SECONDS);
        this.lineLength = lineLength;
        this.strictLengthValidation = strictLengthValidation == null || strictLengthValidation;
        this.strictStructureValidation = strictStructureValidation != null && strictStructureValidation;
        this.structureSource = structureSource;
        this.structureRules = structureRules == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(structureRules));
        this.recordTypes = Collections.unmodifiableList(new ArrayList<>(recordTypes));
        checkRecordNames();
        checkRecordLengths();
    }

    public Optional<RecordSpec> findRecord(String name) {
        return recordTypes.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    public List<String> getRecordNames() {
        return recordTypes.stream().map(RecordSpec::getName).collect(Collectors.toList());
    }

    /**
     * Copy of this contract carrying the given structure rules and their provenance.
     */
    public ContractSpec withStructureRules(List<StructureRule> rules, String source) {
        return toBuilder().structureRules(rules).structureSource(source).build();
    }

    private void checkRecordNames() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (RecordSpec record : recordTypes) {
            if (!seen.add(record.getName())) {
                duplicates.add(record.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ContractValidationException("Duplicate record types: " + duplicates);
        }
    }

    private void checkRecordLengths() {
        for (RecordSpec record : recordTypes) {
            int maxEnd = record.getMaxEnd();
            if (maxEnd > lineLength) {
                throw new ContractValidationException("Record " + record.getName() + " exceeds line length "
                        + lineLength + ": max end position = " + maxEnd);
            }
            if (strictLengthValidation && record.getSumOfLengths() != lineLength) {
                throw new ContractValidationException("Record " + record.getName() + " has sum(lengths)="
                        + record.getSumOfLengths() + ", expected line_length=" + lineLength);
            }
        }
    }
}
