package com.mainframe.contract.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.layout.LayoutAnalyzer;
import com.mainframe.contract.layout.cobol.CobolLayoutAnalyzer;
import com.mainframe.contract.layout.pli.PliLayoutAnalyzer;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.structure.InvoiceStructureRules;

/**
 * Extracts a contract from a declaration source: picks the analyzer, applies the invoice rules
 * and falls back to a raw-line contract when configured to.
 */
public class ContractExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ContractExtractionService.class);

    private final CobolLayoutAnalyzer cobolAnalyzer;
    private final PliLayoutAnalyzer pliAnalyzer;
    private final InvoiceStructureRules invoiceRules;
    private final RawContractFactory rawContractFactory;

    public ContractExtractionService() {
        this(new CobolLayoutAnalyzer(), new PliLayoutAnalyzer(), new InvoiceStructureRules(), new RawContractFactory());
    }

    public ContractExtractionService(CobolLayoutAnalyzer cobolAnalyzer, PliLayoutAnalyzer pliAnalyzer,
                                     InvoiceStructureRules invoiceRules, RawContractFactory rawContractFactory) {
        this.cobolAnalyzer = cobolAnalyzer;
        this.pliAnalyzer = pliAnalyzer;
        this.invoiceRules = invoiceRules;
        this.rawContractFactory = rawContractFactory;
    }

    public ContractSpec extract(Path source, ExtractionConfig config) throws IOException {
        String fileName = source.getFileName() == null ? source.toString() : source.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new IllegalArgumentException("Source must be program text, not a PDF: " + source);
        }
        log.info("Extracting contract from {}", source);
        String text = Files.readString(source, config.getSourceCharset());
        return extract(text, fileName, config.getEngine().resolve(source), config);
    }

    public ContractSpec extract(String sourceText, String sourceName, AnalyzerEngine engine, ExtractionConfig config) {
        AnalyzerEngine resolved = engine == AnalyzerEngine.AUTO ? AnalyzerEngine.PLI : engine;
        LayoutAnalyzer analyzer = resolved == AnalyzerEngine.COBOL ? cobolAnalyzer : pliAnalyzer;
        log.debug("Using {} analyzer for {}", resolved, sourceName);

        ContractSpec contract;
        try {
            contract = analyzer.analyze(sourceText, config.toLayoutRequest(sourceName, resolved));
        } catch (DeclarationException e) {
            if (!config.isRawFallback() || !e.isNoStructureFound()) {
                throw e;
            }
            log.warn("{}; using raw line contract", e.getMessage());
            contract = rawContractFactory.create(config.getSourceProgram(), sourceText, config.getRawFallbackFileName());
        }

        if (config.isInvoiceRules()) {
            contract = invoiceRules.attach(contract, config.getReferenceDocument(), config.getSourceCharset());
        }
        if (config.isStrictStructureValidation()) {
            contract = contract.toBuilder().strictStructureValidation(true).build();
        }
        log.info("Extracted {} record types, line length {}", contract.getRecordTypes().size(), contract.getLineLength());
        return contract;
    }
}
