package com.mainframe.contract.layout;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique field names within one record, suffixing {@code _2}, {@code _3}, ... on collision.
 */
public class FieldNameAllocator {

    private final Set<String> used = new HashSet<>();

    public String allocate(String candidate) {
        String base = candidate == null || candidate.isEmpty() ? "FIELD" : candidate;
        if (used.add(base)) {
            return base;
        }
        int suffix = 2;
        while (!used.add(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }
}
