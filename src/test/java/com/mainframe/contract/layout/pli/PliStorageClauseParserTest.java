package com.mainframe.contract.layout.pli;

import com.mainframe.contract.layout.model.PictureClause;
import com.mainframe.contract.layout.model.StorageLayout;
import com.mainframe.contract.layout.model.UsageType;
import com.mainframe.contract.model.FieldType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PliStorageClauseParser.
 */
class PliStorageClauseParserTest {

    private final PliStorageClauseParser parser = new PliStorageClauseParser();

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
        "CHAR(10); 10",
        "CHARACTER (4); 4",
        "CHAR(10) VARYING; 12",
        "CHAR(10) VAR; 12",
        "PIC '999V99'; 5",
        "PIC '(7)9V(2)9'; 9",
        "PIC '(3)X'; 3",
        "PIC 'S(5)9'; 5",
        "FIXED DEC(7,2); 7",
        "FIXED DEC(5); 5",
        "DEC FIXED(9,2); 9",
        "FIXED DEC; 5",
        "FIXED BIN(15); 2",
        "FIXED BIN(31); 4",
        "BIN FIXED(63); 8",
        "FIXED BIN; 2",
        "BIT(1); 1",
        "BIT(12); 2",
        "FLOAT; 4",
        "FLOAT DEC(16); 8",
        "FLOAT BIN(53); 8",
        "DEC(6); 4",
        "POINTER; 4",
        "PTR; 4"
    })
    void testStorageLength(String attributes, int expectedLength) {
        PliAttributes parsed = parser.parse(attributes);

        assertThat(parsed.hasStorage()).isTrue();
        assertThat(PictureClause.evaluate(parsed.getPicture(), parsed.getUsage()).getLength())
                .isEqualTo(expectedLength);
    }

    @Test
    void testFixedDecimalIsDisplayWithImpliedPoint() {
        PliAttributes parsed = parser.parse("fixed dec(7,2)");
        StorageLayout layout = PictureClause.evaluate(parsed.getPicture(), parsed.getUsage());

        assertThat(parsed.getUsage()).isEqualTo(UsageType.DISPLAY);
        assertThat(parsed.getPicture()).isEqualTo("9(5)V9(2)");
        assertThat(layout.getLength()).isEqualTo(7);
        assertThat(layout.getType()).isEqualTo(FieldType.DECIMAL);
        assertThat(layout.getDecimals()).isEqualTo(2);
    }

    @Test
    void testPrefixRepetitionPicture() {
        PliAttributes parsed = parser.parse("PIC '(7)9V(2)9'");
        StorageLayout layout = PictureClause.evaluate(parsed.getPicture(), parsed.getUsage());

        assertThat(parsed.getPicture()).isEqualTo("9(7)V9(2)");
        assertThat(layout.getLength()).isEqualTo(9);
        assertThat(layout.getDecimals()).isEqualTo(2);
    }

    @Test
    void testSuffixRepetitions() {
        assertThat(PliStorageClauseParser.suffixRepetitions("9V(2)9")).isEqualTo("9V9(2)");
        assertThat(PliStorageClauseParser.suffixRepetitions("(3)X")).isEqualTo("X(3)");
        assertThat(PliStorageClauseParser.suffixRepetitions("999V99")).isEqualTo("999V99");
    }

    @Test
    void testFixedBinaryDigits() {
        PliAttributes parsed = parser.parse("FIXED BIN(31)");

        assertThat(parsed.getUsage()).isEqualTo(UsageType.BINARY);
        assertThat(parsed.getPicture()).isEqualTo("9(9)");
    }

    @Test
    void testLikeReference() {
        PliAttributes parsed = parser.parse("LIKE IDP_ADR . STREET");

        assertThat(parsed.hasStorage()).isFalse();
        assertThat(parsed.getTemplateReference()).isEqualTo("IDP_ADR.STREET");
    }

    @Test
    void testInitialValueAndDefined() {
        PliAttributes init = parser.parse("CHAR(3) INIT('ent')");
        PliAttributes defined = parser.parse("CHAR(8) DEF OTHER_FIELD");

        assertThat(init.getInitialValue()).isEqualTo("ENT");
        assertThat(init.isDefined()).isFalse();
        assertThat(defined.isDefined()).isTrue();
    }

    @Test
    void testQuotedTextIsNotAnAttribute() {
        PliAttributes parsed = parser.parse("CHAR(5) INIT('FIXED')");

        assertThat(parsed.getPicture()).isEqualTo("X(5)");
        assertThat(parsed.getUsage()).isEqualTo(UsageType.DISPLAY);
    }

    @Test
    void testNoAttributes() {
        PliAttributes parsed = parser.parse("");

        assertThat(parsed.hasStorage()).isFalse();
        assertThat(parsed.getTemplateReference()).isNull();
    }

    @Test
    void testDigitsPicture() {
        assertThat(PliStorageClauseParser.digitsPicture(5, 0)).isEqualTo("9(5)");
        assertThat(PliStorageClauseParser.digitsPicture(2, 2)).isEqualTo("V9(2)");
        assertThat(PliStorageClauseParser.digitsPicture(0, 0)).isEqualTo("9");
    }
}
