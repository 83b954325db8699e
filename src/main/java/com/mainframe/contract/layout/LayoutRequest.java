package com.mainframe.contract.layout;

import lombok.Builder;
import lombok.Value;

/**
 * What an analyzer should extract from a source and how strictly the resulting contract is checked.
 */
@Value
@Builder
public class LayoutRequest {

    @Builder.Default
    String sourceName = "source";

    @Builder.Default
    String sourceProgram = "SOURCE";

    @Builder.Default
    boolean strictLengthValidation = true;

    @Builder.Default
    StructureFilter filter = StructureFilter.all();

    /** Keep the full structure name even when a prefix filter matched it. */
    boolean preserveStructureNames;

    @Builder.Default
    int selectorLength = 3;
}
