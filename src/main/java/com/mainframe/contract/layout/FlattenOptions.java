package com.mainframe.contract.layout;

import lombok.Value;

/**
 * How a top-level structure is turned into field names.
 */
@Value
public class FlattenOptions {

    /** Whether field names start with the top-level structure name. */
    boolean qualifyWithRootName;

    /** Field name used when the top-level item itself carries storage; {@code null} keeps its own name. */
    String elementaryRootName;

    public static FlattenOptions qualified() {
        return new FlattenOptions(true, null);
    }

    public static FlattenOptions unqualified(String elementaryRootName) {
        return new FlattenOptions(false, elementaryRootName);
    }
}
