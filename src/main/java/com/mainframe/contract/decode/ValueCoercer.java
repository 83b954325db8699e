package com.mainframe.contract.decode;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.mainframe.contract.model.FieldSpec;

import lombok.experimental.UtilityClass;

/**
 * Converts raw field text into typed values.
 * <p>
 * Text, date and sign fields keep their right-trimmed text. Numeric fields are cleaned of spaces and
 * grouping characters first; an empty result is {@code null} and an unparseable one falls back to the
 * trimmed text.
 */
@UtilityClass
public class ValueCoercer {

    public static Object coerce(String raw, FieldSpec field) {
        String value = stripTrailingSpaces(raw);
        return switch (field.getType()) {
            case INTEGER -> coerceInteger(value);
            case DECIMAL -> coerceDecimal(value, field.getDecimals() == null ? 0 : field.getDecimals());
            default -> value;
        };
    }

    static Object coerceInteger(String value) {
        String normalized = normalizeNumeric(value);
        if (normalized.isEmpty()) {
            return null;
        }
        try {
            BigInteger number = new BigInteger(normalized);
            return number.bitLength() < Long.SIZE ? (Object) number.longValue() : number;
        } catch (NumberFormatException e) {
            return value;
        }
    }

    static Object coerceDecimal(String value, int decimals) {
        String normalized = normalizeNumeric(value);
        if (normalized.isEmpty()) {
            return null;
        }
        try {
            BigDecimal number = new BigDecimal(normalized);
            if (normalized.indexOf('.') < 0 && decimals > 0) {
                number = number.movePointLeft(decimals);
            }
            return number;
        } catch (NumberFormatException e) {
            return value;
        }
    }

    /**
     * Removes blanks and grouping characters, maps a comma decimal separator to {@code .}
     * and moves a trailing sign to the front.
     */
    public static String normalizeNumeric(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.replace(" ", "").replace("\u00A0", "").replace("'", "");
        if (cleaned.length() > 1 && (cleaned.endsWith("-") || cleaned.endsWith("+"))) {
            int last = cleaned.length() - 1;
            cleaned = cleaned.charAt(last) + cleaned.substring(0, last);
        }
        int lastDot = cleaned.lastIndexOf('.');
        int lastComma = cleaned.lastIndexOf(',');
        if (lastDot >= 0 && lastComma >= 0) {
            if (lastComma > lastDot) {
                return cleaned.replace(".", "").replace(',', '.');
            }
            return cleaned.replace(",", "");
        }
        if (lastComma >= 0) {
            return cleaned.indexOf(',') != lastComma ? cleaned.replace(",", "") : cleaned.replace(',', '.');
        }
        if (lastDot >= 0 && cleaned.indexOf('.') != lastDot) {
            return cleaned.replace(".", "");
        }
        return cleaned;
    }

    static String stripTrailingSpaces(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.stripTrailing();
    }
}
