package com.mainframe.contract.layout.cobol;

import java.util.List;

import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.layout.LayoutRequest;
import com.mainframe.contract.layout.StructureFilter;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.FieldSpec;
import com.mainframe.contract.model.FieldType;
import com.mainframe.contract.model.RecordSpec;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CobolLayoutAnalyzer.
 */
class CobolLayoutAnalyzerTest {

    private static final String INVOICE_COPYBOOK = String.join("\n",
            "01 ENT-REC.",
            "  05 REC-TYPE PIC X(3) VALUE 'ENT'.",
            "  05 DOC-NO PIC 9(6).",
            "  05 AMOUNT PIC S9(5)V99.",
            "01 LIG-REC.",
            "  05 REC-TYPE PIC X(3) VALUE 'LIG'.",
            "  05 QTY PIC 9(4) COMP.",
            "  05 FILLER PIC X(10).",
            "");

    private final CobolLayoutAnalyzer analyzer = new CobolLayoutAnalyzer();

    private static LayoutRequest request(boolean strict) {
        return LayoutRequest.builder()
                .sourceName("invoice.cpy")
                .sourceProgram("IDP470RA")
                .strictLengthValidation(strict)
                .build();
    }

    @Test
    void testOneRecordPerStructure() {
        ContractSpec contract = analyzer.analyze(INVOICE_COPYBOOK, request(true));

        assertThat(contract.getSourceProgram()).isEqualTo("IDP470RA");
        assertThat(contract.getRecordNames()).containsExactly("ENT_REC", "LIG_REC");
        assertThat(contract.getLineLength()).isEqualTo(16);
        assertThat(contract.isStrictLengthValidation()).isFalse();

        RecordSpec ent = contract.findRecord("ENT_REC").orElseThrow();
        assertThat(ent.getFields()).extracting(FieldSpec::getName)
                .containsExactly("ENT_REC_REC_TYPE", "ENT_REC_DOC_NO", "ENT_REC_AMOUNT");
        FieldSpec amount = ent.findField("ENT_REC_AMOUNT").orElseThrow();
        assertThat(amount.getStart()).isEqualTo(10);
        assertThat(amount.getLength()).isEqualTo(7);
        assertThat(amount.getType()).isEqualTo(FieldType.DECIMAL);
        assertThat(amount.getDecimals()).isEqualTo(2);
    }

    @Test
    void testSelectorFromValueLiteral() {
        ContractSpec contract = analyzer.analyze(INVOICE_COPYBOOK, request(true));

        RecordSpec lig = contract.findRecord("LIG_REC").orElseThrow();
        assertThat(lig.getSelector().getStart()).isEqualTo(1);
        assertThat(lig.getSelector().getLength()).isEqualTo(3);
        assertThat(lig.getSelector().getValue()).isEqualTo("LIG");
        assertThat(lig.findField("LIG_REC_QTY").orElseThrow().getLength()).isEqualTo(2);
    }

    @Test
    void testSelectorFallsBackToFirstLetter() {
        ContractSpec contract = analyzer.analyze("01 TRAILER.\n  05 TOTAL PIC 9(9).\n", request(true));

        RecordSpec trailer = contract.getRecordTypes().get(0);
        assertThat(trailer.getSelector().getStart()).isEqualTo(1);
        assertThat(trailer.getSelector().getLength()).isEqualTo(1);
        assertThat(trailer.getSelector().getValue()).isEqualTo("T");
        assertThat(contract.isStrictLengthValidation()).isTrue();
        assertThat(contract.getLineLength()).isEqualTo(9);
    }

    @Test
    void testOccursExpandsIndexedFields() {
        String copybook = "01 REC.\n"
                + "  05 TAG PIC X VALUE 'R'.\n"
                + "  05 SLOT OCCURS 2.\n"
                + "    10 CODE PIC X(2).\n"
                + "    10 QTY PIC 9(3).\n";

        ContractSpec contract = analyzer.analyze(copybook, request(true));

        assertThat(contract.getRecordTypes().get(0).getFields())
                .extracting(FieldSpec::getName, FieldSpec::getStart)
                .containsExactly(
                        tuple("REC_TAG", 1),
                        tuple("REC_SLOT_1_CODE", 2),
                        tuple("REC_SLOT_1_QTY", 4),
                        tuple("REC_SLOT_2_CODE", 7),
                        tuple("REC_SLOT_2_QTY", 9));
        assertThat(contract.getLineLength()).isEqualTo(11);
    }

    @Test
    void testRedefinesConsumesNoBytes() {
        String copybook = "01 REC.\n"
                + "  05 RAW-DATE PIC X(8).\n"
                + "  05 DATE-PARTS REDEFINES RAW-DATE.\n"
                + "    10 YYYY PIC 9(4).\n"
                + "    10 MMDD PIC 9(4).\n"
                + "  05 NEXT-FIELD PIC X(2).\n";

        ContractSpec contract = analyzer.analyze(copybook, request(true));

        assertThat(contract.getRecordTypes().get(0).getFields())
                .extracting(FieldSpec::getName, FieldSpec::getStart)
                .containsExactly(tuple("REC_RAW_DATE", 1), tuple("REC_NEXT_FIELD", 9));
    }

    @Test
    void testDuplicateFillersGetSuffixes() {
        String copybook = "01 REC.\n"
                + "  05 FILLER PIC X.\n"
                + "  05 FILLER PIC X.\n"
                + "  05 FILLER PIC X.\n";

        ContractSpec contract = analyzer.analyze(copybook, request(true));

        assertThat(contract.getRecordTypes().get(0).getFields()).extracting(FieldSpec::getName)
                .containsExactly("REC_FILLER", "REC_FILLER_2", "REC_FILLER_3");
    }

    @Test
    void testFilterByName() {
        LayoutRequest request = LayoutRequest.builder()
                .sourceName("invoice.cpy")
                .filter(StructureFilter.of(List.of("lig-rec"), List.of()))
                .build();

        ContractSpec contract = analyzer.analyze(INVOICE_COPYBOOK, request);

        assertThat(contract.getRecordNames()).containsExactly("LIG_REC");
        assertThat(contract.isStrictLengthValidation()).isTrue();
    }

    @Test
    void testNoStructureFound() {
        LayoutRequest request = LayoutRequest.builder()
                .sourceName("invoice.cpy")
                .filter(StructureFilter.of(List.of("MISSING"), List.of()))
                .build();

        DeclarationException error = catchThrowableOfType(
                () -> analyzer.analyze(INVOICE_COPYBOOK, request), DeclarationException.class);

        assertThat(error).isNotNull();
        assertThat(error.isNoStructureFound()).isTrue();
        assertThat(error.getMessage()).contains("invoice.cpy");
    }

    @Test
    void testOversizedPictureSkipsOnlyThatField() {
        String copybook = String.join("\n",
                "01 ENT-REC.",
                "  05 REC-TYPE PIC X(3) VALUE 'ENT'.",
                "  05 BAD PIC 9(99999999999).",
                "  05 DOC-NO PIC 9(6).",
                "");

        RecordSpec ent = analyzer.analyze(copybook, request(false)).findRecord("ENT_REC").orElseThrow();

        assertThat(ent.getFields())
                .extracting(FieldSpec::getName, FieldSpec::getStart)
                .containsExactly(tuple("ENT_REC_REC_TYPE", 1), tuple("ENT_REC_DOC_NO", 4));
    }

    @Test
    void testDeterministicOutput() {
        ContractSpec first = analyzer.analyze(INVOICE_COPYBOOK, request(false));
        ContractSpec second = analyzer.analyze(INVOICE_COPYBOOK, request(false));

        assertThat(second.getRecordTypes()).isEqualTo(first.getRecordTypes());
        assertThat(second.getLineLength()).isEqualTo(first.getLineLength());
    }
}
