package com.mainframe.contract.io.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonPropertyOrder({"name", "start", "length", "type", "decimals", "description"})
public class FieldDocument {
    private String name;
    private int start;
    private int length;
    private String type;
    private Integer decimals;
    private String description;
}
