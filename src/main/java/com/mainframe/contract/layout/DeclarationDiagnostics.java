package com.mainframe.contract.layout;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Non-fatal findings accumulated while building and flattening declarations.
 *
 * Pure structure only: callers decide how to log or report them.
 */
@Getter
public class DeclarationDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void warn(int lineNumber, String message) {
        warnings.add(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
