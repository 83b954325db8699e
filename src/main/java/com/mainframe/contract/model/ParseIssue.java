package com.mainframe.contract.model;

import lombok.Value;

/**
 * A non-fatal problem found while decoding or validating a file.
 * Line number 0 refers to the file as a whole.
 */
@Value
public class ParseIssue {
    int lineNumber;
    String message;
    String rawLine;

    public static ParseIssue of(int lineNumber, String message) {
        return new ParseIssue(lineNumber, message, "");
    }
}
