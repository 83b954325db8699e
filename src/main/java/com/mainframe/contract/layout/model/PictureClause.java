package com.mainframe.contract.layout.model;

import java.util.Locale;

import com.mainframe.contract.model.FieldType;

import lombok.Builder;
import lombok.Value;

/**
 * A parsed PICTURE string, e.g. {@code S9(7)V99} or {@code X(10)}.
 * <p>
 * Repetition notation is expanded before the symbols are scanned. {@code V}, {@code S} and {@code P}
 * take no storage; every other symbol takes one display byte.
 */
@Value
@Builder
public class PictureClause {

    String rawPicture;
    String expandedPicture;
    boolean signed;
    boolean alphanumeric;
    int digitPositions;
    int decimalDigits;
    int displayLength;

    private static final String STORAGE_SYMBOLS = "9XAZB.,+-/*0$CRDE";

    /** Largest repetition factor accepted in {@code token(n)}. */
    static final int MAX_REPEAT = 99_999;

    /**
     * Parses a picture string. Returns {@code null} when the string is empty or malformed.
     */
    public static PictureClause parse(String picture) {
        if (picture == null) {
            return null;
        }
        String normalized = picture.trim().toUpperCase(Locale.ROOT).replace("'", "").replace("\"", "");
        if (normalized.isEmpty()) {
            return null;
        }
        String expanded = expand(normalized);
        if (expanded == null || expanded.isEmpty()) {
            return null;
        }

        boolean signed = false;
        boolean alphanumeric = false;
        boolean afterPoint = false;
        int digits = 0;
        int decimals = 0;
        int length = 0;
        for (int i = 0; i < expanded.length(); i++) {
            char symbol = expanded.charAt(i);
            switch (symbol) {
                case 'V' -> afterPoint = true;
                case 'S' -> signed = true;
                case 'P' -> {
                }
                case '9', 'Z' -> {
                    digits++;
                    if (afterPoint) {
                        decimals++;
                    }
                    length++;
                }
                case 'X', 'A' -> {
                    alphanumeric = true;
                    length++;
                }
                default -> {
                    if (STORAGE_SYMBOLS.indexOf(symbol) < 0) {
                        return null;
                    }
                    length++;
                }
            }
        }

        return PictureClause.builder()
                .rawPicture(picture)
                .expandedPicture(expanded)
                .signed(signed)
                .alphanumeric(alphanumeric)
                .digitPositions(digits)
                .decimalDigits(decimals)
                .displayLength(length)
                .build();
    }

    /**
     * Evaluates a picture and usage pair. A missing picture is only meaningful for floating usages.
     *
     * @return the layout, or {@code null} when no storage can be derived
     */
    public static StorageLayout evaluate(String picture, UsageType usage) {
        UsageType effective = usage == null ? UsageType.DISPLAY : usage;
        if (picture == null || picture.isBlank()) {
            int standalone = effective.standaloneLength();
            return standalone > 0 ? StorageLayout.string(standalone) : null;
        }
        PictureClause clause = parse(picture);
        return clause == null ? null : clause.evaluate(effective);
    }

    public StorageLayout evaluate(UsageType usage) {
        UsageType effective = usage == null ? UsageType.DISPLAY : usage;
        int length = displayLength;
        if (digitPositions > 0) {
            length = effective.storageLength(digitPositions, displayLength);
        }
        if (length < 1) {
            return null;
        }
        if (alphanumeric || digitPositions == 0) {
            return StorageLayout.string(length);
        }
        if (decimalDigits > 0) {
            return new StorageLayout(length, FieldType.DECIMAL, decimalDigits);
        }
        return new StorageLayout(length, FieldType.INTEGER, null);
    }

    /**
     * Expands {@code token(n)} into n copies of the token.
     */
    private static String expand(String picture) {
        StringBuilder expanded = new StringBuilder();
        int i = 0;
        while (i < picture.length()) {
            char c = picture.charAt(i);
            if (c == '(') {
                if (expanded.length() == 0) {
                    return null;
                }
                int close = picture.indexOf(')', i);
                if (close < 0) {
                    return null;
                }
                String count = picture.substring(i + 1, close).trim();
                if (count.isEmpty() || !count.chars().allMatch(Character::isDigit)
                        || count.length() > String.valueOf(MAX_REPEAT).length()) {
                    return null;
                }
                int repeat = Integer.parseInt(count);
                if (repeat > MAX_REPEAT) {
                    return null;
                }
                char token = expanded.charAt(expanded.length() - 1);
                for (int k = 1; k < repeat; k++) {
                    expanded.append(token);
                }
                if (repeat == 0) {
                    expanded.setLength(expanded.length() - 1);
                }
                i = close + 1;
            } else if (c == ')') {
                return null;
            } else if (!Character.isWhitespace(c)) {
                expanded.append(c);
                i++;
            } else {
                i++;
            }
        }
        return expanded.toString();
    }
}
