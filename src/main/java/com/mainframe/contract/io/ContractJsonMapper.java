package com.mainframe.contract.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mainframe.contract.io.document.ContractDocument;
import com.mainframe.contract.io.document.FieldDocument;
import com.mainframe.contract.io.document.RecordTypeDocument;
import com.mainframe.contract.io.document.SelectorDocument;
import com.mainframe.contract.io.document.StructureRuleDocument;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.ContractValidationException;
import com.mainframe.contract.model.FieldSpec;
import com.mainframe.contract.model.FieldType;
import com.mainframe.contract.model.RecordSpec;
import com.mainframe.contract.model.SelectorSpec;
import com.mainframe.contract.model.StructureRule;
import com.mainframe.contract.model.StructureScope;

/**
 * Reads and writes contract JSON files. Reading rebuilds the model, so every invariant is checked again.
 */
public class ContractJsonMapper {

    private final ObjectMapper mapper;

    public ContractJsonMapper() {
        this.mapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(ContractSpec contract) throws IOException {
        return mapper.writeValueAsString(toDocument(contract));
    }

    public void write(ContractSpec contract, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, write(contract) + System.lineSeparator(), StandardCharsets.UTF_8);
    }

    public ContractSpec read(String json) throws IOException {
        return fromDocument(mapper.readValue(json, ContractDocument.class));
    }

    public ContractSpec read(Path source) throws IOException {
        return read(Files.readString(source, StandardCharsets.UTF_8));
    }

    static ContractDocument toDocument(ContractSpec contract) {
        ContractDocument document = new ContractDocument();
        document.setSchemaVersion(contract.getSchemaVersion());
        document.setSourceProgram(contract.getSourceProgram());
        document.setGeneratedAt(contract.getGeneratedAt());
        document.setLineLength(contract.getLineLength());
        document.setStrictLengthValidation(contract.isStrictLengthValidation());
        document.setStrictStructureValidation(contract.isStrictStructureValidation());
        document.setStructureSource(contract.getStructureSource());
        for (StructureRule rule : contract.getStructureRules()) {
            StructureRuleDocument ruleDocument = new StructureRuleDocument();
            ruleDocument.setLabel(rule.getLabel());
            ruleDocument.setRecordName(rule.getRecordName());
            ruleDocument.setScope(rule.getScope().getValue());
            ruleDocument.setMinOccurs(rule.getMinOccurs());
            ruleDocument.setMaxOccurs(rule.getMaxOccurs());
            ruleDocument.setOrderIndex(rule.getOrderIndex());
            ruleDocument.setDescription(rule.getDescription());
            document.getStructureRules().add(ruleDocument);
        }
        for (RecordSpec record : contract.getRecordTypes()) {
            RecordTypeDocument recordDocument = new RecordTypeDocument();
            recordDocument.setName(record.getName());
            SelectorSpec selector = record.getSelector();
            recordDocument.setSelector(new SelectorDocument(selector.getStart(), selector.getLength(), selector.getValue()));
            for (FieldSpec field : record.getFields()) {
                FieldDocument fieldDocument = new FieldDocument();
                fieldDocument.setName(field.getName());
                fieldDocument.setStart(field.getStart());
                fieldDocument.setLength(field.getLength());
                fieldDocument.setType(field.getType().getValue());
                fieldDocument.setDecimals(field.getDecimals());
                fieldDocument.setDescription(field.getDescription());
                recordDocument.getFields().add(fieldDocument);
            }
            document.getRecordTypes().add(recordDocument);
        }
        return document;
    }

    static ContractSpec fromDocument(ContractDocument document) {
        List<StructureRule> rules = new ArrayList<>();
        if (document.getStructureRules() != null) {
            for (StructureRuleDocument rule : document.getStructureRules()) {
                rules.add(StructureRule.builder()
                        .label(rule.getLabel())
                        .recordName(rule.getRecordName())
                        .scope(StructureScope.fromValue(rule.getScope()))
                        .minOccurs(rule.getMinOccurs())
                        .maxOccurs(rule.getMaxOccurs())
                        .orderIndex(rule.getOrderIndex())
                        .description(rule.getDescription())
                        .build());
            }
        }
        List<RecordSpec> records = new ArrayList<>();
        if (document.getRecordTypes() != null) {
            for (RecordTypeDocument record : document.getRecordTypes()) {
                SelectorDocument selector = record.getSelector();
                if (selector == null) {
                    throw new ContractValidationException("Record " + record.getName() + " has no selector.");
                }
                RecordSpec.RecordSpecBuilder builder = RecordSpec.builder()
                        .name(record.getName())
                        .selector(new SelectorSpec(selector.getStart(), selector.getLength(), selector.getValue()));
                if (record.getFields() != null) {
                    for (FieldDocument field : record.getFields()) {
                        builder.field(FieldSpec.builder()
                                .name(field.getName())
                                .start(field.getStart())
                                .length(field.getLength())
                                .type(FieldType.fromValue(field.getType()))
                                .decimals(field.getDecimals())
                                .description(field.getDescription())
                                .build());
                    }
                }
                records.add(builder.build());
            }
        }
        return ContractSpec.builder()
                .schemaVersion(document.getSchemaVersion())
                .sourceProgram(document.getSourceProgram())
                .generatedAt(document.getGeneratedAt())
                .lineLength(document.getLineLength())
                .strictLengthValidation(document.getStrictLengthValidation())
                .strictStructureValidation(document.getStrictStructureValidation())
                .structureSource(document.getStructureSource())
                .structureRules(rules)
                .recordTypes(records)
                .build();
    }
}
