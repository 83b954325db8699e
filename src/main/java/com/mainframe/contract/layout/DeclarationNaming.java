package com.mainframe.contract.layout;

import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Naming rules shared by both dialects when turning declared names into field names.
 */
@UtilityClass
public class DeclarationNaming {

    public static final String FILLER = "FILLER";

    /**
     * Uppercases, maps {@code -} and other non-alphanumerics to {@code _} and collapses runs.
     * Example: "CUST-NAME" -> "CUST_NAME"
     */
    public static String normalizeIdentifier(String name) {
        if (name == null) {
            return "FIELD";
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return normalized.isEmpty() ? "FIELD" : normalized;
    }

    /**
     * Joins a group prefix and a child name. An empty side yields the other one.
     */
    public static String qualify(String prefix, String name) {
        if (prefix == null || prefix.isEmpty()) {
            return name == null ? "" : name;
        }
        if (name == null || name.isEmpty()) {
            return prefix;
        }
        return prefix + "_" + name;
    }

    /**
     * Appends the 1-based occurrence index when the item repeats.
     */
    public static String indexed(String name, int index, int occurs) {
        return occurs > 1 ? name + "_" + index : name;
    }
}
