package com.mainframe.contract.decode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.FieldSpec;
import com.mainframe.contract.model.RecordSpec;

import lombok.Getter;

/**
 * Decodes single lines against a contract.
 * <p>
 * Record types are tried in contract order; the first selector that matches wins. A contract with a
 * single record type accepts every line for that type.
 */
@Getter
public class FixedWidthDecoder {

    private final ContractSpec contract;

    public FixedWidthDecoder(ContractSpec contract) {
        this.contract = Objects.requireNonNull(contract, "contract");
    }

    /**
     * @param line       the line without its terminator
     * @param lineNumber 1-based line number, used in issues
     * @throws RecordDecodingException on strict length mismatch or unknown record type
     */
    public DecodedRecord decodeLine(String line, int lineNumber) {
        String fitted = fitToLength(line, lineNumber);
        RecordSpec recordType = resolveRecordType(fitted)
                .orElseThrow(() -> new RecordDecodingException(lineNumber, "Unknown record type.", line));

        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec field : recordType.getFields()) {
            values.put(field.getName(), ValueCoercer.coerce(field.slice(fitted), field));
        }
        return new DecodedRecord(recordType.getName(), lineNumber, values);
    }

    public Optional<RecordSpec> resolveRecordType(String line) {
        for (RecordSpec record : contract.getRecordTypes()) {
            if (record.getSelector().matches(line)) {
                return Optional.of(record);
            }
        }
        if (contract.getRecordTypes().size() == 1) {
            return Optional.of(contract.getRecordTypes().get(0));
        }
        return Optional.empty();
    }

    String fitToLength(String line, int lineNumber) {
        int expected = contract.getLineLength();
        if (line.length() == expected) {
            return line;
        }
        if (contract.isStrictLengthValidation()) {
            throw new RecordDecodingException(lineNumber,
                    "Invalid line length " + line.length() + ", expected " + expected + ".", line);
        }
        if (line.length() < expected) {
            return line + " ".repeat(expected - line.length());
        }
        return line.substring(0, expected);
    }
}
