package com.mainframe.contract.cli.output;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.decode.ParseResult;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;
import com.mainframe.contract.model.RecordSpec;

/**
 * Responsible only for printing CLI summaries. No validation, no execution.
 */
public class ContractResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ContractResultsPrinter.class);

    private static final int MAX_LISTED_ISSUES = 20;

    public void printContract(ContractSpec contract, Path contractPath) {
        log.info("=================================================");
        log.info("CONTRACT EXTRACTED");
        log.info("=================================================");
        log.info("Program: {}", contract.getSourceProgram());
        log.info("Contract: {}", contractPath.toAbsolutePath());
        log.info("Line Length: {} (strict: {})", contract.getLineLength(), contract.isStrictLengthValidation());
        log.info("Structure Rules: {} from {}", contract.getStructureRules().size(),
                contract.getStructureSource() != null ? contract.getStructureSource() : "None");
        for (RecordSpec record : contract.getRecordTypes()) {
            log.info("  {} selector='{}'@{} fields={} length={}", record.getName(), record.getSelector().getValue(),
                    record.getSelector().getStart(), record.getFields().size(), record.getSumOfLengths());
        }
        log.info("=================================================");
    }

    public void printParse(Path input, ParseResult result, Path recordsPath, Path issuesPath) {
        Map<String, Integer> byType = new TreeMap<>();
        for (DecodedRecord record : result.getRecords()) {
            byType.merge(record.getRecordType(), 1, Integer::sum);
        }

        log.info("=================================================");
        log.info("PARSE {}", result.hasIssues() ? "COMPLETED WITH ISSUES" : "SUCCESSFUL");
        log.info("=================================================");
        log.info("Input: {}", input.toAbsolutePath());
        log.info("Records: {} -> {}", result.getRecords().size(), recordsPath.toAbsolutePath());
        byType.forEach((type, count) -> log.info("  {}: {}", type, count));
        if (result.hasIssues()) {
            log.warn("Issues: {} -> {}", result.getIssues().size(), issuesPath.toAbsolutePath());
            result.getIssues().stream().limit(MAX_LISTED_ISSUES).forEach(this::printIssue);
            if (result.getIssues().size() > MAX_LISTED_ISSUES) {
                log.warn("  ... {} more", result.getIssues().size() - MAX_LISTED_ISSUES);
            }
        }
        log.info("=================================================");
    }

    private void printIssue(ParseIssue issue) {
        log.warn("  line {}: {}", issue.getLineNumber(), issue.getMessage());
    }
}
