package com.mainframe.contract.layout.model;

import java.util.Locale;

/**
 * Storage representation of an elementary item.
 */
public enum UsageType {
    /**
     * One byte per picture symbol (character or zoned decimal).
     */
    DISPLAY,

    /**
     * Binary integer (COMP, COMP-4, BINARY, PL/I FIXED BIN).
     */
    BINARY,

    /**
     * Packed decimal (COMP-3).
     */
    PACKED_DECIMAL,

    /**
     * Native binary (COMP-5).
     */
    COMP_5,

    /**
     * Single precision float (COMP-1, PL/I FLOAT short).
     */
    COMP_1,

    /**
     * Double precision float (COMP-2, PL/I FLOAT long).
     */
    COMP_2;

    public static UsageType fromCobol(String usage) {
        if (usage == null) {
            return DISPLAY;
        }
        String normalized = usage.toUpperCase(Locale.ROOT).trim();
        return switch (normalized) {
            case "COMP", "COMP-4", "BINARY", "COMPUTATIONAL", "COMPUTATIONAL-4" -> BINARY;
            case "COMP-3", "COMPUTATIONAL-3", "PACKED-DECIMAL" -> PACKED_DECIMAL;
            case "COMP-5", "COMPUTATIONAL-5" -> COMP_5;
            case "COMP-1", "COMPUTATIONAL-1" -> COMP_1;
            case "COMP-2", "COMPUTATIONAL-2" -> COMP_2;
            default -> DISPLAY;
        };
    }

    public boolean isFloating() {
        return this == COMP_1 || this == COMP_2;
    }

    /**
     * Physical byte length of a numeric item with the given digit count.
     *
     * @param digits        number of digit positions in the picture
     * @param displayLength bytes the picture occupies in display form
     */
    public int storageLength(int digits, int displayLength) {
        return switch (this) {
            case BINARY, COMP_5 -> binaryLength(digits);
            case PACKED_DECIMAL -> (digits + 2) / 2;
            case COMP_1 -> 4;
            case COMP_2 -> 8;
            default -> displayLength;
        };
    }

    /**
     * Byte length of a floating usage declared without picture, or -1 for any other usage.
     */
    public int standaloneLength() {
        if (this == COMP_1) {
            return 4;
        }
        if (this == COMP_2) {
            return 8;
        }
        return -1;
    }

    static int binaryLength(int digits) {
        if (digits <= 4) {
            return 2;
        }
        if (digits <= 9) {
            return 4;
        }
        return 8;
    }
}
