package com.mainframe.contract.io.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"start", "length", "value"})
public class SelectorDocument {
    private int start;
    private int length;
    private String value;
}
