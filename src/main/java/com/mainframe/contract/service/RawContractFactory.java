package com.mainframe.contract.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.FieldSpec;
import com.mainframe.contract.model.FieldType;
import com.mainframe.contract.model.RecordSpec;
import com.mainframe.contract.model.SelectorSpec;

/**
 * Builds the single-field contract used when no structure can be extracted: each line is one raw string.
 */
public class RawContractFactory {

    public static final int DEFAULT_LINE_LENGTH = 1200;
    public static final String RAW_RECORD = "RAW";
    public static final String RAW_FIELD = "RAW_LINE";

    private static final Pattern FILE_DECLARATION =
            Pattern.compile("\\bDCL\\s+([A-Z0-9_#@$]+)\\s+FILE\\b([^;]*);", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECORD_SIZE =
            Pattern.compile("\\b(?:RECSIZE|BLKSIZE)\\s*\\(\\s*(\\d+)\\s*\\)", Pattern.CASE_INSENSITIVE);

    public ContractSpec create(String sourceProgram, String sourceText, String fileName) {
        int lineLength = declaredLineLength(sourceText, fileName);
        return ContractSpec.builder()
                .sourceProgram(sourceProgram)
                .lineLength(lineLength)
                .strictLengthValidation(false)
                .recordTypes(List.of(RecordSpec.builder()
                        .name(RAW_RECORD)
                        .selector(new SelectorSpec(1, 1, "*"))
                        .field(FieldSpec.builder()
                                .name(RAW_FIELD)
                                .start(1)
                                .length(lineLength)
                                .type(FieldType.STRING)
                                .description("Unparsed line")
                                .build())
                        .build()))
                .build();
    }

    /**
     * Largest RECSIZE or BLKSIZE declared for the named file, or {@link #DEFAULT_LINE_LENGTH}.
     */
    public int declaredLineLength(String sourceText, String fileName) {
        if (sourceText == null || fileName == null || fileName.isBlank()) {
            return DEFAULT_LINE_LENGTH;
        }
        String wanted = fileName.trim().toUpperCase(Locale.ROOT);
        int best = 0;
        Matcher declaration = FILE_DECLARATION.matcher(sourceText);
        while (declaration.find()) {
            if (!declaration.group(1).toUpperCase(Locale.ROOT).equals(wanted)) {
                continue;
            }
            Matcher size = RECORD_SIZE.matcher(declaration.group(2));
            while (size.find()) {
                best = Math.max(best, Integer.parseInt(size.group(1)));
            }
        }
        return best > 0 ? best : DEFAULT_LINE_LENGTH;
    }
}
