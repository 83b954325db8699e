package com.mainframe.contract.structure;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.StructureRule;
import com.mainframe.contract.model.StructureScope;

/**
 * The invoice document grammar: one FIC per file, then ENT blocks with their ECH, COM, REF, ADR, AD2,
 * LIG (with REF and LEC per line) and PIE records.
 */
public class InvoiceStructureRules {

    private static final Logger log = LoggerFactory.getLogger(InvoiceStructureRules.class);

    public static final String DEFAULT_STRUCTURE_SOURCE = "DOCTECHN IDIL section 3.2";

    private static final List<StructureRule> DEFAULT_RULES = List.of(
            rule("FIC", "FIC", StructureScope.FILE, 1, 1, 1, "File header"),
            rule("ENT", "ENT", StructureScope.INVOICE, 1, 1, 2, "Invoice header"),
            rule("ECH", "ECH", StructureScope.INVOICE, 1, null, 3, "Due dates"),
            rule("COM", "COM", StructureScope.INVOICE, 0, null, 4, "Invoice comments"),
            rule("REF(E)", "REF", StructureScope.INVOICE, 0, null, 5, "Invoice references"),
            rule("ADR", "ADR", StructureScope.INVOICE, 1, 1, 6, "Address"),
            rule("AD2", "AD2", StructureScope.INVOICE, 1, 1, 7, "Address continuation"),
            rule("LIG", "LIG", StructureScope.INVOICE, 1, null, 8, "Invoice line"),
            rule("REF(L)", "REF", StructureScope.LINE, 0, null, 9, "Line references"),
            rule("LEC", "LEC", StructureScope.LINE, 0, null, 10, "Line accounting entries"),
            rule("PIE", "PIE", StructureScope.INVOICE, 0, null, 11, "Invoice footer"));

    private final StructureReferenceVerifier verifier;

    public InvoiceStructureRules() {
        this(new StructureReferenceVerifier());
    }

    public InvoiceStructureRules(StructureReferenceVerifier verifier) {
        this.verifier = verifier;
    }

    public static List<StructureRule> defaultRules() {
        return DEFAULT_RULES;
    }

    /**
     * Copy of the contract carrying the invoice rules. The reference document, when readable, becomes
     * the structure source and is checked for the expected section labels.
     */
    public ContractSpec attach(ContractSpec contract, Path referenceDocument, Charset charset) {
        String source = DEFAULT_STRUCTURE_SOURCE;
        if (referenceDocument != null) {
            if (Files.isRegularFile(referenceDocument)) {
                verifier.verify(referenceDocument, charset);
                source = referenceDocument.toString();
            } else {
                log.warn("Structure reference {} not found, using {}", referenceDocument, DEFAULT_STRUCTURE_SOURCE);
            }
        }
        return contract.withStructureRules(DEFAULT_RULES, source);
    }

    private static StructureRule rule(String label, String recordName, StructureScope scope, int min, Integer max,
                                      int order, String description) {
        return StructureRule.builder()
                .label(label)
                .recordName(recordName)
                .scope(scope)
                .minOccurs(min)
                .maxOccurs(max)
                .orderIndex(order)
                .description(description)
                .build();
    }
}
