package com.mainframe.contract.service;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.mainframe.contract.layout.LayoutRequest;
import com.mainframe.contract.layout.StructureFilter;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Settings for one contract extraction.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionConfig {

    public static final List<String> DEFAULT_PLI_PREFIXES = List.of("DEMAT_", "STO_D_");

    @Builder.Default
    String sourceProgram = "IDP470RA";

    @Builder.Default
    AnalyzerEngine engine = AnalyzerEngine.AUTO;

    @Builder.Default
    Charset sourceCharset = StandardCharsets.ISO_8859_1;

    @Builder.Default
    boolean strictLengthValidation = true;

    boolean strictStructureValidation;

    @Singular
    List<String> structureNames;

    @Singular
    List<String> structurePrefixes;

    boolean preserveStructureNames;

    @Builder.Default
    int selectorLength = 3;

    /** Attach the invoice structure rules to the extracted contract. */
    @Builder.Default
    boolean invoiceRules = true;

    /** Optional document (PDF or text) describing the record sections. */
    Path referenceDocument;

    /** Fall back to a single raw-line record when no structure is found. */
    boolean rawFallback;

    /** PL/I file whose RECSIZE/BLKSIZE gives the raw record length. */
    String rawFallbackFileName;

    public static ExtractionConfig defaults() {
        return ExtractionConfig.builder().build();
    }

    /**
     * The structure filter for the given dialect. PL/I sources with neither names nor prefixes
     * select the {@link #DEFAULT_PLI_PREFIXES} output structures.
     */
    public StructureFilter toFilter(AnalyzerEngine dialect) {
        if (dialect == AnalyzerEngine.PLI && structureNames.isEmpty() && structurePrefixes.isEmpty()) {
            return StructureFilter.of(List.of(), DEFAULT_PLI_PREFIXES);
        }
        return StructureFilter.of(structureNames, structurePrefixes);
    }

    LayoutRequest toLayoutRequest(String sourceName, AnalyzerEngine dialect) {
        return LayoutRequest.builder()
                .sourceName(sourceName)
                .sourceProgram(sourceProgram)
                .strictLengthValidation(strictLengthValidation)
                .filter(toFilter(dialect))
                .preserveStructureNames(preserveStructureNames)
                .selectorLength(selectorLength)
                .build();
    }

    /**
     * Identifies the settings that change the extracted layout, for caching.
     */
    public String profileKey() {
        return String.join("|", engine.name(), sourceProgram, String.valueOf(strictLengthValidation),
                String.valueOf(strictStructureValidation), String.join(",", structureNames),
                String.join(",", structurePrefixes), String.valueOf(preserveStructureNames),
                String.valueOf(selectorLength), String.valueOf(invoiceRules), String.valueOf(referenceDocument),
                String.valueOf(rawFallback), String.valueOf(rawFallbackFileName), sourceCharset.name());
    }
}
