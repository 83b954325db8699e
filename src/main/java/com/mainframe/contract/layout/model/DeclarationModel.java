package com.mainframe.contract.layout.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.mainframe.contract.layout.DeclarationDiagnostics;

import lombok.Getter;

/**
 * The forest of top-level structures found in one source, plus the diagnostics collected while building it.
 */
@Getter
public class DeclarationModel {

    private final String sourceName;
    private final List<DeclarationNode> roots;
    private final DeclarationDiagnostics diagnostics;

    public DeclarationModel(String sourceName, List<DeclarationNode> roots, DeclarationDiagnostics diagnostics) {
        this.sourceName = sourceName;
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
        this.diagnostics = diagnostics;
    }

    public Optional<DeclarationNode> findRoot(String name) {
        return roots.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    public boolean hasWarnings() {
        return diagnostics.hasWarnings();
    }
}
