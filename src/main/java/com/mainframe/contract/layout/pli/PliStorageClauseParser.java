package com.mainframe.contract.layout.pli;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mainframe.contract.layout.model.UsageType;

/**
 * Translates PL/I data attributes into the picture/usage vocabulary of the layout evaluator.
 *
 * <ul>
 *   <li>{@code CHAR(n)} becomes {@code X(n)}, {@code VARYING} adds the 2-byte length prefix</li>
 *   <li>{@code PIC 'p'} keeps the picture; prefix repetitions such as {@code (7)9} become {@code 9(7)}</li>
 *   <li>{@code FIXED DEC(p,q)} becomes {@code 9(p-q)V9(q)} in display form: p bytes with an implied point</li>
 *   <li>{@code FIXED BIN(p)} becomes binary with floor(p * log10 2) digits</li>
 *   <li>{@code FLOAT} becomes COMP-1 or COMP-2 depending on precision</li>
 *   <li>{@code BIT(n)} becomes {@code X(ceil(n/8))}, {@code POINTER} becomes {@code X(4)}</li>
 * </ul>
 */
public class PliStorageClauseParser {

    private static final Pattern LIKE = Pattern.compile("\\bLIKE\\s+([A-Z0-9_#@$]+(?:\\s*\\.\\s*[A-Z0-9_#@$]+)*)");
    private static final Pattern CHAR = Pattern.compile("\\bCHAR(?:ACTER)?\\s*\\(\\s*(\\d+)\\s*\\)(\\s*VAR(?:YING)?\\b)?");
    private static final Pattern PIC = Pattern.compile("\\bPIC(?:TURE)?\\s*'([^']*)'");
    private static final Pattern BIT = Pattern.compile("\\bBIT\\s*\\(\\s*(\\d+)\\s*\\)");
    private static final Pattern FLOAT = Pattern.compile("\\bFLOAT\\b");
    private static final Pattern FIXED = Pattern.compile("\\bFIXED\\b");
    private static final Pattern BINARY = Pattern.compile("\\bBIN(?:ARY)?\\b");
    private static final Pattern DECIMAL = Pattern.compile("\\bDEC(?:IMAL)?\\b");
    private static final Pattern PRECISION = Pattern.compile(
            "\\b(?:FIXED|FLOAT|DEC(?:IMAL)?|BIN(?:ARY)?)\\s*\\(\\s*(\\d+)(?:\\s*,\\s*(\\d+))?\\s*\\)");
    private static final Pattern POINTER = Pattern.compile("\\b(?:POINTER|PTR)\\b");
    private static final Pattern DEFINED = Pattern.compile("\\bDEF(?:INED)?\\b");
    private static final Pattern INIT = Pattern.compile("\\bINIT(?:IAL)?\\s*\\(\\s*'([^']*)'");
    private static final Pattern PREFIX_REPETITION = Pattern.compile("\\(\\s*(\\d+)\\s*\\)\\s*([^\\s(])");

    private static final int DEFAULT_FIXED_DEC_PRECISION = 5;
    private static final int DEFAULT_FIXED_BIN_PRECISION = 15;
    private static final int VARYING_PREFIX = 2;

    public PliAttributes parse(String attributes) {
        String text = attributes == null ? "" : attributes.toUpperCase(Locale.ROOT);
        String unquoted = text.replaceAll("'[^']*'", "''");
        PliAttributes.PliAttributesBuilder result = PliAttributes.builder();

        Matcher init = INIT.matcher(text);
        if (init.find()) {
            result.initialValue(init.group(1));
        }
        if (DEFINED.matcher(unquoted).find()) {
            result.defined(true);
        }

        Matcher character = CHAR.matcher(unquoted);
        if (character.find()) {
            int length = Integer.parseInt(character.group(1)) + (character.group(2) != null ? VARYING_PREFIX : 0);
            return result.picture("X(" + length + ")").usage(UsageType.DISPLAY).build();
        }
        Matcher picture = PIC.matcher(text);
        if (picture.find()) {
            return result.picture(suffixRepetitions(picture.group(1))).usage(UsageType.DISPLAY).build();
        }
        Matcher bit = BIT.matcher(unquoted);
        if (bit.find()) {
            int bits = Integer.parseInt(bit.group(1));
            return result.picture("X(" + Math.max(1, (bits + 7) / 8) + ")").usage(UsageType.DISPLAY).build();
        }

        Matcher precision = PRECISION.matcher(unquoted);
        Integer digits = null;
        int scale = 0;
        if (precision.find()) {
            digits = Integer.parseInt(precision.group(1));
            scale = precision.group(2) != null ? Integer.parseInt(precision.group(2)) : 0;
        }
        boolean binary = BINARY.matcher(unquoted).find();
        boolean fixed = FIXED.matcher(unquoted).find();
        boolean decimal = DECIMAL.matcher(unquoted).find();

        if (FLOAT.matcher(unquoted).find() || (decimal && !fixed)) {
            return result.usage(isShortFloat(binary, digits) ? UsageType.COMP_1 : UsageType.COMP_2).build();
        }
        if (fixed || binary) {
            if (binary) {
                int bits = digits != null ? digits : DEFAULT_FIXED_BIN_PRECISION;
                int decimalDigits = Math.max(1, (int) Math.floor(bits * Math.log10(2)));
                return result.picture(digitsPicture(decimalDigits, 0)).usage(UsageType.BINARY).build();
            }
            int total = digits != null ? digits : DEFAULT_FIXED_DEC_PRECISION;
            return result.picture(digitsPicture(total, Math.min(scale, total))).usage(UsageType.DISPLAY).build();
        }
        if (POINTER.matcher(unquoted).find()) {
            return result.picture("X(4)").usage(UsageType.DISPLAY).build();
        }

        Matcher like = LIKE.matcher(unquoted);
        if (like.find()) {
            result.templateReference(like.group(1).replaceAll("\\s+", ""));
        }
        return result.build();
    }

    private static boolean isShortFloat(boolean binary, Integer digits) {
        if (digits == null) {
            return true;
        }
        return binary ? digits <= 21 : digits <= 6;
    }

    /**
     * PL/I writes the repetition factor before the symbol; the evaluator expects it after.
     */
    static String suffixRepetitions(String picture) {
        return PREFIX_REPETITION.matcher(picture).replaceAll("$2($1)");
    }

    static String digitsPicture(int total, int scale) {
        int integerDigits = total - scale;
        StringBuilder picture = new StringBuilder();
        if (integerDigits > 0) {
            picture.append("9(").append(integerDigits).append(')');
        }
        if (scale > 0) {
            picture.append("V9(").append(scale).append(')');
        }
        return picture.length() == 0 ? "9" : picture.toString();
    }
}
