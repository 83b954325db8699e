package com.mainframe.contract.decode;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;
import com.mainframe.contract.structure.StructureValidator;

/**
 * Decodes a whole data file line by line, then validates the record sequence.
 */
public class FixedWidthFileParser {

    private static final Logger log = LoggerFactory.getLogger(FixedWidthFileParser.class);

    private final ContractSpec contract;
    private final FixedWidthDecoder decoder;
    private final StructureValidator structureValidator;

    public FixedWidthFileParser(ContractSpec contract) {
        this(contract, new FixedWidthDecoder(contract), new StructureValidator(contract.getStructureRules()));
    }

    public FixedWidthFileParser(ContractSpec contract, FixedWidthDecoder decoder, StructureValidator structureValidator) {
        this.contract = contract;
        this.decoder = decoder;
        this.structureValidator = structureValidator;
    }

    public ParseResult parse(Path input, ParseOptions options) throws IOException {
        log.info("Parsing {} with contract {}", input, contract.getSourceProgram());
        try (BufferedReader reader = Files.newBufferedReader(input, options.getCharset())) {
            return parse(reader, options);
        }
    }

    /**
     * @throws FileParsingException when a decode error or a strict structural issue stops the parse
     */
    public ParseResult parse(BufferedReader reader, ParseOptions options) throws IOException {
        List<DecodedRecord> records = new ArrayList<>();
        List<ParseIssue> issues = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            try {
                records.add(decoder.decodeLine(line, lineNumber));
            } catch (RecordDecodingException e) {
                issues.add(e.toIssue());
                if (!options.isContinueOnDecodeError()) {
                    throw new FileParsingException("Line " + lineNumber + ": " + e.getMessage(),
                            new ParseResult(records, issues));
                }
            }
        }
        int decodeIssues = issues.size();

        List<ParseIssue> structureIssues = structureValidator.validate(records);
        issues.addAll(structureIssues);
        ParseResult result = new ParseResult(records, issues);

        if (result.hasIssues()) {
            log.warn("Parsed {} records from {} lines with {} decode issues and {} structure issues",
                    records.size(), lineNumber, decodeIssues, structureIssues.size());
        } else {
            log.info("Parsed {} records from {} lines", records.size(), lineNumber);
        }

        if (!structureIssues.isEmpty() && contract.isStrictStructureValidation() && !options.isTolerateStructureIssues()) {
            ParseIssue first = structureIssues.get(0);
            throw new FileParsingException("Line " + first.getLineNumber() + ": " + first.getMessage(), result);
        }
        return result;
    }
}
