package com.mainframe.contract.layout.model;

import lombok.Value;

/**
 * A logical declaration extracted from source text, with the line it starts on
 * and the inline comment attached to it.
 */
@Value
public class SourceStatement {
    String text;
    int lineNumber;
    String description;
    boolean terminated;
}
