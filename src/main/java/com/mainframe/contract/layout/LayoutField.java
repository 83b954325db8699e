package com.mainframe.contract.layout;

import com.mainframe.contract.layout.model.StorageLayout;
import com.mainframe.contract.model.FieldSpec;

import lombok.Value;

/**
 * A flattened field before it becomes part of a record: position, storage and source literal.
 */
@Value
public class LayoutField {
    String name;
    int start;
    StorageLayout storage;
    String description;
    String valueLiteral;

    public int getLength() {
        return storage.getLength();
    }

    public FieldSpec toFieldSpec() {
        return FieldSpec.builder()
                .name(name)
                .start(start)
                .length(storage.getLength())
                .type(storage.getType())
                .decimals(storage.getDecimals())
                .description(description)
                .build();
    }
}
