package com.mainframe.contract.layout.pli;

import com.mainframe.contract.layout.model.UsageType;

import lombok.Builder;
import lombok.Value;

/**
 * Storage-relevant attributes of one PL/I item, expressed as picture and usage.
 */
@Value
@Builder
public class PliAttributes {
    String picture;
    UsageType usage;
    String templateReference;
    boolean defined;
    String initialValue;

    public boolean hasStorage() {
        return picture != null || (usage != null && usage.isFloating());
    }
}
