package com.mainframe.contract.layout;

/**
 * Fatal error while turning declarations into a contract.
 */
public class DeclarationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String NO_STRUCTURE_FOUND = "No structure found for selected filters in source file.";

    public DeclarationException(String message) {
        super(message);
    }

    public static DeclarationException noStructureFound(String sourceName) {
        return new DeclarationException(NO_STRUCTURE_FOUND + " (" + sourceName + ")");
    }

    public boolean isNoStructureFound() {
        return getMessage() != null && getMessage().startsWith(NO_STRUCTURE_FOUND);
    }
}
