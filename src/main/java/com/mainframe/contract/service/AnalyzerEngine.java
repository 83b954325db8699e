package com.mainframe.contract.service;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Declaration dialect used for extraction. {@code AUTO} picks COBOL for copybook suffixes and PL/I otherwise.
 */
public enum AnalyzerEngine {
    AUTO,
    PLI,
    COBOL;

    private static final Set<String> COBOL_SUFFIXES = Set.of(".cbl", ".cob", ".cpy");

    public AnalyzerEngine resolve(Path source) {
        if (this != AUTO) {
            return this;
        }
        String name = source.getFileName() == null ? "" : source.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String suffix = dot >= 0 ? name.substring(dot) : "";
        return COBOL_SUFFIXES.contains(suffix) ? COBOL : PLI;
    }
}
