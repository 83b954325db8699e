package com.mainframe.contract.layout.model;

import com.mainframe.contract.model.FieldType;

import lombok.Value;

/**
 * Evaluated physical length and logical type of an elementary item.
 */
@Value
public class StorageLayout {
    int length;
    FieldType type;
    Integer decimals;

    public static StorageLayout string(int length) {
        return new StorageLayout(length, FieldType.STRING, null);
    }
}
