package com.mainframe.contract.decode;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.Value;

/**
 * How a data file is read and which problems stop the parse.
 */
@Value
@Builder
public class ParseOptions {

    @Builder.Default
    Charset charset = StandardCharsets.ISO_8859_1;

    /** Collect per-line decode issues instead of stopping at the first one. */
    @Builder.Default
    boolean continueOnDecodeError = true;

    /** Report structural issues without failing, even for contracts with strict structure validation. */
    boolean tolerateStructureIssues;

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }
}
