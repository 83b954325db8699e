package com.mainframe.contract.structure;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that a reference document mentions every section label the default rules rely on.
 * Only logs; the rules are applied either way.
 * <p>
 * PDF documents are read through their first {@value #PDF_PAGES} pages; any other file is read as text.
 */
public class StructureReferenceVerifier {

    private static final Logger log = LoggerFactory.getLogger(StructureReferenceVerifier.class);

    static final int PDF_PAGES = 10;

    private static final Map<String, Pattern> EXPECTED_LABELS = new LinkedHashMap<>();

    static {
        for (String label : List.of("FIC", "ENT", "ECH", "COM", "ADR", "AD2", "LIG", "LEC")) {
            EXPECTED_LABELS.put(label, Pattern.compile("\\b" + label + "\\b", Pattern.CASE_INSENSITIVE));
        }
        EXPECTED_LABELS.put("REF(E)", Pattern.compile("\\bREF\\s*\\(\\s*E\\s*\\)", Pattern.CASE_INSENSITIVE));
        EXPECTED_LABELS.put("REF(L)", Pattern.compile("\\bREF\\s*\\(\\s*L\\s*\\)", Pattern.CASE_INSENSITIVE));
    }

    /**
     * @return the expected labels the document does not mention, empty when it cannot be read
     */
    public List<String> verify(Path referenceDocument, Charset charset) {
        String text;
        try {
            text = readText(referenceDocument, charset);
        } catch (IOException e) {
            log.warn("Cannot read structure reference {}: {}", referenceDocument, e.getMessage());
            return new ArrayList<>();
        }
        List<String> missing = missingLabels(text);
        if (missing.isEmpty()) {
            log.info("Structure reference {} mentions every expected section", referenceDocument);
        } else {
            log.warn("Structure reference {} does not mention: {}", referenceDocument, missing);
        }
        return missing;
    }

    static String readText(Path document, Charset charset) throws IOException {
        String name = document.getFileName() == null ? "" : document.getFileName().toString();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return Files.readString(document, charset);
        }
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(PDF_PAGES, pdf.getNumberOfPages()));
            return stripper.getText(pdf);
        }
    }

    List<String> missingLabels(String text) {
        List<String> missing = new ArrayList<>();
        EXPECTED_LABELS.forEach((label, pattern) -> {
            if (!pattern.matcher(text).find()) {
                missing.add(label);
            }
        });
        return missing;
    }
}
