package com.mainframe.contract.decode;

import lombok.Getter;

/**
 * Parsing stopped before the end of the file. The records and issues gathered so far stay available.
 */
@Getter
public class FileParsingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ParseResult partialResult;

    public FileParsingException(String message, ParseResult partialResult) {
        super(message);
        this.partialResult = partialResult;
    }
}
