package com.mainframe.contract.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.mainframe.contract.model.FieldSpec;

import lombok.Getter;

/**
 * Ordered fields of one flattened structure and the number of bytes consumed.
 */
@Getter
public class FlattenedLayout {

    private final List<LayoutField> fields;
    private final int length;

    public FlattenedLayout(List<LayoutField> fields, int length) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.length = length;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<FieldSpec> toFieldSpecs() {
        return fields.stream().map(LayoutField::toFieldSpec).collect(Collectors.toList());
    }

    public Optional<LayoutField> firstWithValueLiteral() {
        return fields.stream()
                .filter(f -> f.getValueLiteral() != null && !f.getValueLiteral().isEmpty())
                .findFirst();
    }
}
