package com.mainframe.contract.layout;

import java.util.List;

import lombok.Value;

/**
 * Relative layout of a group, flattened from position 1, ready to be cloned at another offset.
 */
@Value
public class GroupTemplate {
    String key;
    List<LayoutField> fields;
    int length;
}
