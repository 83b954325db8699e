package com.mainframe.contract.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;

/**
 * One decoded line: its record type, source line number and coerced field values in declared order.
 */
@Value
public class DecodedRecord {

    public static final String RECORD_TYPE_KEY = "record_type";
    public static final String LINE_NUMBER_KEY = "line_number";

    String recordType;
    int lineNumber;
    Map<String, Object> values;

    public DecodedRecord(String recordType, int lineNumber, Map<String, Object> values) {
        this.recordType = recordType;
        this.lineNumber = lineNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String fieldName) {
        return values.get(fieldName);
    }

    /**
     * Flat view with the record type and line number first, as written to JSON Lines.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(RECORD_TYPE_KEY, recordType);
        row.put(LINE_NUMBER_KEY, lineNumber);
        row.putAll(values);
        return row;
    }
}
