package com.mainframe.contract.model;

/**
 * Raised when a contract object would violate one of its invariants.
 */
public class ContractValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ContractValidationException(String message) {
        super(message);
    }
}
