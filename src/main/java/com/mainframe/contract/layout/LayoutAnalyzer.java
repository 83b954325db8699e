package com.mainframe.contract.layout;

import com.mainframe.contract.model.ContractSpec;

/**
 * Turns the structure declarations of one source dialect into a contract.
 */
public interface LayoutAnalyzer {

    /**
     * @throws DeclarationException when no structure matches the request or templates form a cycle
     */
    ContractSpec analyze(String sourceText, LayoutRequest request);
}
