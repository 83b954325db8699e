package com.mainframe.contract.decode;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Map;

import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.FieldSpec;
import com.mainframe.contract.model.RecordSpec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.mainframe.contract.decode.DecodeFixtures.ADR;
import static com.mainframe.contract.decode.DecodeFixtures.ENT;
import static com.mainframe.contract.decode.DecodeFixtures.contract;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FixedWidthDecoder.
 */
class FixedWidthDecoderTest {

    @Test
    void testDecodeBySelector() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(true, ENT, ADR));

        DecodedRecord ent = decoder.decodeLine("ENT0042150", 1);
        DecodedRecord adr = decoder.decodeLine("ADRPARIS  ", 2);

        assertThat(ent.getRecordType()).isEqualTo("ENT");
        assertThat(ent.getLineNumber()).isEqualTo(1);
        assertThat(ent.getValues().keySet()).containsExactly("TYPE", "DOC", "AMT");
        assertThat(ent.get("DOC")).isEqualTo(42L);
        assertThat(ent.get("AMT")).isEqualTo(new BigDecimal("1.50"));
        assertThat(adr.getRecordType()).isEqualTo("ADR");
        assertThat(adr.get("CITY")).isEqualTo("PARIS");
    }

    @ParameterizedTest
    @CsvSource({
        "42, 1.50, PARIS",
        "9999, 9.99, LYON",
        "0, 0.00, ST MALO",
        "7, 0.05, X"
    })
    void testValuesWrittenAtTheirOffsetsDecodeBack(long doc, BigDecimal amount, String city) {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(true, ENT, ADR));
        String entLine = layOut(ENT, Map.of(
                "TYPE", "ENT",
                "DOC", zeroPadded(doc, 4),
                "AMT", zeroPadded(amount.unscaledValue().longValue(), 3)));
        String adrLine = layOut(ADR, Map.of("TYPE", "ADR", "CITY", city));

        DecodedRecord ent = decoder.decodeLine(entLine, 1);
        DecodedRecord adr = decoder.decodeLine(adrLine, 2);

        assertThat(ent.getRecordType()).isEqualTo("ENT");
        assertThat(ent.get("TYPE")).isEqualTo("ENT");
        assertThat(ent.get("DOC")).isEqualTo(doc);
        assertThat(ent.get("AMT")).isEqualTo(amount);
        assertThat(adr.getRecordType()).isEqualTo("ADR");
        assertThat(adr.get("CITY")).isEqualTo(city);
    }

    @Test
    void testUnknownRecordType() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(true, ENT, ADR));

        RecordDecodingException error = catchThrowableOfType(
                () -> decoder.decodeLine("XYZ0000000", 7), RecordDecodingException.class);

        assertThat(error.getMessage()).isEqualTo("Unknown record type.");
        assertThat(error.toIssue().getLineNumber()).isEqualTo(7);
        assertThat(error.toIssue().getRawLine()).isEqualTo("XYZ0000000");
    }

    @Test
    void testSingleRecordTypeAcceptsAnyLine() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(true, ADR));

        DecodedRecord decoded = decoder.decodeLine("XYZLYON   ", 1);

        assertThat(decoded.getRecordType()).isEqualTo("ADR");
        assertThat(decoded.get("TYPE")).isEqualTo("XYZ");
    }

    @Test
    void testStrictLengthRejectsShortLine() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(true, ENT, ADR));

        assertThatThrownBy(() -> decoder.decodeLine("ENT0042", 3))
                .isInstanceOf(RecordDecodingException.class)
                .hasMessage("Invalid line length 7, expected 10.");
    }

    @Test
    void testLenientLengthPadsAndTruncates() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(false, ENT, ADR));

        DecodedRecord shortLine = decoder.decodeLine("ENT0042", 1);
        DecodedRecord longLine = decoder.decodeLine("ADRLILLE  OVERFLOW", 2);

        assertThat(shortLine.get("DOC")).isEqualTo(42L);
        assertThat(shortLine.get("AMT")).isNull();
        assertThat(longLine.get("CITY")).isEqualTo("LILLE");
        assertThat(decoder.fitToLength("ENT", 1)).hasSize(10);
    }

    @Test
    void testSelectorNeedsFullWidth() {
        FixedWidthDecoder decoder = new FixedWidthDecoder(contract(false, ENT, ADR));

        assertThat(decoder.resolveRecordType("EN")).isEmpty();
        assertThat(decoder.resolveRecordType("ADR")).contains(ADR);
    }

    private static String layOut(RecordSpec record, Map<String, String> values) {
        char[] line = new char[10];
        Arrays.fill(line, ' ');
        for (FieldSpec field : record.getFields()) {
            String value = values.getOrDefault(field.getName(), "");
            for (int i = 0; i < value.length() && i < field.getLength(); i++) {
                line[field.getStart() - 1 + i] = value.charAt(i);
            }
        }
        return new String(line);
    }

    private static String zeroPadded(long value, int width) {
        return String.format("%0" + width + "d", value);
    }
}
