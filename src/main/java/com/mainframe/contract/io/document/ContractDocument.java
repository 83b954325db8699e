package com.mainframe.contract.io.document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON shape of a contract file.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"schemaVersion", "sourceProgram", "generatedAt", "lineLength", "strictLengthValidation",
        "strictStructureValidation", "structureSource", "structureRules", "recordTypes"})
public class ContractDocument {
    private String schemaVersion;
    private String sourceProgram;
    @JsonAlias("generated_at_utc")
    private Instant generatedAt;
    private int lineLength;
    private Boolean strictLengthValidation;
    private Boolean strictStructureValidation;
    private String structureSource;
    private List<StructureRuleDocument> structureRules = new ArrayList<>();
    private List<RecordTypeDocument> recordTypes = new ArrayList<>();
}
