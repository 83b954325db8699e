package com.mainframe.contract.layout.model;

import com.mainframe.contract.model.FieldType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PictureClause parsing and storage evaluation.
 */
class PictureClauseTest {

    @Test
    void testParseAlphanumericSimple() {
        PictureClause pic = PictureClause.parse("X(10)");

        assertThat(pic).isNotNull();
        assertThat(pic.isAlphanumeric()).isTrue();
        assertThat(pic.getDisplayLength()).isEqualTo(10);
        assertThat(pic.getDigitPositions()).isZero();
    }

    @Test
    void testParseSignedDecimal() {
        PictureClause pic = PictureClause.parse("S9(7)V99");

        assertThat(pic.isSigned()).isTrue();
        assertThat(pic.getDigitPositions()).isEqualTo(9);
        assertThat(pic.getDecimalDigits()).isEqualTo(2);
        assertThat(pic.getDisplayLength()).isEqualTo(9);
    }

    @Test
    void testParseLowercaseAndQuotes() {
        PictureClause pic = PictureClause.parse("'9(3)v9'");

        assertThat(pic.getExpandedPicture()).isEqualTo("999V9");
        assertThat(pic.getDecimalDigits()).isEqualTo(1);
    }

    @Test
    void testExpandedPicture() {
        PictureClause pic = PictureClause.parse("X(3)9(2)");

        assertThat(pic.getExpandedPicture()).isEqualTo("XXX99");
    }

    @Test
    void testEditedPictureTakesDisplayBytes() {
        PictureClause pic = PictureClause.parse("ZZ9.99-");

        assertThat(pic.getDisplayLength()).isEqualTo(7);
        assertThat(pic.getDigitPositions()).isEqualTo(5);
    }

    @ParameterizedTest
    @CsvSource({
        "X(10), DISPLAY, 10",
        "9(5), DISPLAY, 5",
        "S9(7)V99, DISPLAY, 9",
        // binary: 2, 4 or 8 bytes by digit count
        "9(4), BINARY, 2",
        "9(5), BINARY, 4",
        "9(9), BINARY, 4",
        "9(10), BINARY, 8",
        "9(18), COMP_5, 8",
        // packed: (digits + 2) / 2
        "9(1), PACKED_DECIMAL, 1",
        "9(5), PACKED_DECIMAL, 3",
        "9(5)V99, PACKED_DECIMAL, 4",
        "S9(9)V99, PACKED_DECIMAL, 6",
        "9(15), PACKED_DECIMAL, 8"
    })
    void testStorageLength(String picture, String usage, int expectedLength) {
        StorageLayout layout = PictureClause.evaluate(picture, UsageType.valueOf(usage));

        assertThat(layout).isNotNull();
        assertThat(layout.getLength()).isEqualTo(expectedLength);
    }

    @Test
    void testEvaluatedTypes() {
        assertThat(PictureClause.evaluate("X(4)", UsageType.DISPLAY).getType()).isEqualTo(FieldType.STRING);
        assertThat(PictureClause.evaluate("9(4)", UsageType.DISPLAY).getType()).isEqualTo(FieldType.INTEGER);

        StorageLayout decimal = PictureClause.evaluate("9(5)V99", UsageType.PACKED_DECIMAL);
        assertThat(decimal.getType()).isEqualTo(FieldType.DECIMAL);
        assertThat(decimal.getDecimals()).isEqualTo(2);
    }

    @Test
    void testFloatingUsageWithoutPicture() {
        assertThat(PictureClause.evaluate(null, UsageType.COMP_1).getLength()).isEqualTo(4);
        assertThat(PictureClause.evaluate("", UsageType.COMP_2).getLength()).isEqualTo(8);
        assertThat(PictureClause.evaluate(null, UsageType.DISPLAY)).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"(5)9", "9(5", "9)5(", "9(A)", "9(5)Q", "9(99999999999)", "X(2000000000)", "9(100000)"})
    void testMalformedPictureReturnsNull(String picture) {
        assertThat(PictureClause.parse(picture)).isNull();
        assertThat(PictureClause.evaluate(picture, UsageType.DISPLAY)).isNull();
    }

    @Test
    void testOversizedRepetitionHasNoStorage() {
        assertThat(PictureClause.evaluate("9(99999999999)", UsageType.DISPLAY)).isNull();
        assertThat(PictureClause.evaluate("X(" + PictureClause.MAX_REPEAT + ")", UsageType.DISPLAY).getLength())
                .isEqualTo(PictureClause.MAX_REPEAT);
    }

    @Test
    void testNullAndEmptyInput() {
        assertThat(PictureClause.parse(null)).isNull();
        assertThat(PictureClause.parse("")).isNull();
        assertThat(PictureClause.parse("   ")).isNull();
    }

    @Test
    void testUsageFromCobol() {
        assertThat(UsageType.fromCobol("comp-3")).isEqualTo(UsageType.PACKED_DECIMAL);
        assertThat(UsageType.fromCobol("BINARY")).isEqualTo(UsageType.BINARY);
        assertThat(UsageType.fromCobol("COMP-1")).isEqualTo(UsageType.COMP_1);
        assertThat(UsageType.fromCobol(null)).isEqualTo(UsageType.DISPLAY);
        assertThat(UsageType.fromCobol("INDEX")).isEqualTo(UsageType.DISPLAY);
    }
}
