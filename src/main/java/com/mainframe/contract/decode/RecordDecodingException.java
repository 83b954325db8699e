package com.mainframe.contract.decode;

import com.mainframe.contract.model.ParseIssue;

import lombok.Getter;

/**
 * A line that cannot be decoded: wrong length in strict mode or no matching record type.
 */
@Getter
public class RecordDecodingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String rawLine;

    public RecordDecodingException(int lineNumber, String message, String rawLine) {
        super(message);
        this.lineNumber = lineNumber;
        this.rawLine = rawLine;
    }

    public ParseIssue toIssue() {
        return new ParseIssue(lineNumber, getMessage(), rawLine);
    }
}
