package com.mainframe.contract.io.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonPropertyOrder({"label", "recordName", "scope", "minOccurs", "maxOccurs", "orderIndex", "description"})
public class StructureRuleDocument {
    private String label;
    private String recordName;
    private String scope;
    private int minOccurs;
    private Integer maxOccurs;
    private int orderIndex;
    private String description;
}
