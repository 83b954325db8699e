package com.mainframe.contract.io.document;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonPropertyOrder({"name", "selector", "fields"})
public class RecordTypeDocument {
    private String name;
    private SelectorDocument selector;
    private List<FieldDocument> fields = new ArrayList<>();
}
