package com.mainframe.contract.structure;

import lombok.Builder;
import lombok.Value;

/**
 * The record types that shape a document: file header, block header and detail record.
 */
@Value
@Builder
public class DocumentGrammar {

    @Builder.Default
    String fileHeader = "FIC";

    @Builder.Default
    String blockHeader = "ENT";

    @Builder.Default
    String detailRecord = "LIG";

    public static DocumentGrammar invoice() {
        return DocumentGrammar.builder().build();
    }
}
