package com.mainframe.contract.layout.pli;

import com.mainframe.contract.layout.model.DeclarationModel;
import com.mainframe.contract.layout.model.DeclarationNode;
import com.mainframe.contract.layout.model.UsageType;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PliDeclarationTreeBuilder.
 */
class PliDeclarationTreeBuilderTest {

    private static final String SOURCE = String.join("\n",
            " DCL 1 IDP_ENT,",
            "       2 HDR,",
            "         3 TYP CHAR(3) INIT('ENT'),",
            "         3 NUM PIC '9999',",
            "       2 LINES(2:4) CHAR(2),",
            "       2 TOTALS(2) FIXED DEC(7,2),",
            "       2 ALT CHAR(6) DEF HDR;",
            " DCL COUNTER FIXED BIN(31);",
            " DCL 1 IDP_FIN CHAR(10);",
            "");

    private final PliDeclarationTreeBuilder builder = new PliDeclarationTreeBuilder();

    @Test
    void testBuildsStructures() {
        DeclarationModel model = builder.build(SOURCE, "idp470ra.pli");

        assertThat(model.getRoots()).extracting(DeclarationNode::getName).containsExactly("IDP_ENT", "IDP_FIN");
        DeclarationNode ent = model.findRoot("IDP_ENT").orElseThrow();
        assertThat(ent.getChildren()).extracting(DeclarationNode::getName)
                .containsExactly("HDR", "LINES", "TOTALS", "ALT");
        assertThat(ent.findDescendant("HDR").getChildren()).extracting(DeclarationNode::getName)
                .containsExactly("TYP", "NUM");
    }

    @Test
    void testItemAttributes() {
        DeclarationNode ent = builder.build(SOURCE, "idp470ra.pli").findRoot("IDP_ENT").orElseThrow();

        DeclarationNode typ = ent.findDescendant("TYP");
        assertThat(typ.getPicture()).isEqualTo("X(3)");
        assertThat(typ.getValue()).isEqualTo("ENT");

        assertThat(ent.findDescendant("LINES").getOccurs()).isEqualTo(3);
        DeclarationNode totals = ent.findDescendant("TOTALS");
        assertThat(totals.getOccurs()).isEqualTo(2);
        assertThat(totals.getUsage()).isEqualTo(UsageType.DISPLAY);
        assertThat(ent.findDescendant("ALT").isRedefines()).isTrue();
    }

    @Test
    void testElementaryStructure() {
        DeclarationNode fin = builder.build(SOURCE, "idp470ra.pli").findRoot("IDP_FIN").orElseThrow();

        assertThat(fin.isElementary()).isTrue();
        assertThat(fin.getPicture()).isEqualTo("X(10)");
    }

    @Test
    void testInvalidNestingIsWarned() {
        DeclarationModel model = builder.build(" DCL 1 A, 2 B CHAR(1), 1 C CHAR(1);\n", "test.pli");

        assertThat(model.getRoots().get(0).getChildren()).extracting(DeclarationNode::getName).containsExactly("B");
        assertThat(model.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("cannot be nested"));
    }

    @Test
    void testItemsAfterTerminatorAreIgnored() {
        DeclarationModel model = builder.build(" DCL 1 A, 2 B CHAR(1);\n 2 C CHAR(1);\n", "test.pli");

        assertThat(model.getRoots().get(0).getChildren()).hasSize(1);
    }
}
