package com.mainframe.contract.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;
import com.mainframe.contract.model.StructureRule;
import com.mainframe.contract.model.StructureScope;

/**
 * Checks a decoded record sequence against ordered multiplicity rules.
 * <p>
 * The file is cut into blocks at each block header; inside a block every detail record opens a
 * segment. A record type with both an invoice-scoped and a line-scoped rule is counted as line-scoped
 * once a detail record has been seen in the block, even when it follows a later invoice-level record.
 */
public class StructureValidator {

    private final List<StructureRule> rules;
    private final DocumentGrammar grammar;
    private final Map<String, List<StructureRule>> rulesByRecord = new HashMap<>();
    private final Set<Integer> lineScopedOrders = new HashSet<>();

    public StructureValidator(List<StructureRule> rules) {
        this(rules, DocumentGrammar.invoice());
    }

    public StructureValidator(List<StructureRule> rules, DocumentGrammar grammar) {
        this.rules = rules == null ? Collections.emptyList() : List.copyOf(rules);
        this.grammar = grammar;
        for (StructureRule rule : this.rules) {
            rulesByRecord.computeIfAbsent(rule.getRecordName(), k -> new ArrayList<>()).add(rule);
            if (rule.getScope() == StructureScope.LINE) {
                lineScopedOrders.add(rule.getOrderIndex());
            }
        }
    }

    public List<ParseIssue> validate(List<DecodedRecord> records) {
        List<ParseIssue> issues = new ArrayList<>();
        if (rules.isEmpty()) {
            return issues;
        }
        if (records.isEmpty()) {
            issues.add(ParseIssue.of(0, "Structure validation failed: no records."));
            return issues;
        }

        validateFileScope(records, issues);
        List<Block> blocks = splitBlocks(records, issues);
        if (blocks.isEmpty()) {
            issues.add(ParseIssue.of(0, "Structure rule violated [" + grammar.getBlockHeader()
                    + "]: no invoice block found."));
            return issues;
        }
        for (Block block : blocks) {
            validateBlock(block, issues);
        }
        return issues;
    }

    private void validateFileScope(List<DecodedRecord> records, List<ParseIssue> issues) {
        for (StructureRule rule : rules) {
            if (rule.getScope() != StructureScope.FILE) {
                continue;
            }
            int count = 0;
            int firstLine = 0;
            for (DecodedRecord record : records) {
                if (record.getRecordType().equals(rule.getRecordName())) {
                    if (count == 0) {
                        firstLine = record.getLineNumber();
                    }
                    count++;
                }
            }
            addOccurrenceIssue(rule, count, firstLine, issues);
        }

        boolean hasFileHeader = records.stream().anyMatch(r -> r.getRecordType().equals(grammar.getFileHeader()));
        DecodedRecord first = records.get(0);
        if (hasFileHeader && !first.getRecordType().equals(grammar.getFileHeader())) {
            issues.add(ParseIssue.of(first.getLineNumber(), "Structure order violated: "
                    + grammar.getFileHeader() + " must be the first record."));
        }
    }

    private List<Block> splitBlocks(List<DecodedRecord> records, List<ParseIssue> issues) {
        List<Block> blocks = new ArrayList<>();
        Block current = null;
        for (DecodedRecord record : records) {
            String type = record.getRecordType();
            if (type.equals(grammar.getFileHeader())) {
                continue;
            }
            if (type.equals(grammar.getBlockHeader())) {
                current = new Block(record);
                blocks.add(current);
            } else if (current == null) {
                issues.add(ParseIssue.of(record.getLineNumber(), "Structure order violated: " + type
                        + " found before first " + grammar.getBlockHeader() + "."));
            } else {
                current.records.add(record);
            }
        }
        return blocks;
    }

    private void validateBlock(Block block, List<ParseIssue> issues) {
        StructureRule headerRule = invoiceRule(grammar.getBlockHeader());
        StructureRule detailRule = invoiceRule(grammar.getDetailRecord());
        int lastOrder = headerRule != null ? headerRule.getOrderIndex() : 0;
        boolean seenDetail = false;
        Map<String, Integer> blockCounts = new LinkedHashMap<>();
        List<Segment> segments = new ArrayList<>();
        Segment segment = null;

        for (DecodedRecord record : block.records) {
            String type = record.getRecordType();
            if (type.equals(grammar.getDetailRecord())) {
                seenDetail = true;
                segment = new Segment(record.getLineNumber());
                segments.add(segment);
                blockCounts.merge(detailRule != null ? detailRule.getLabel() : type, 1, Integer::sum);
                if (detailRule != null) {
                    int detailOrder = detailRule.getOrderIndex();
                    if (lastOrder != detailOrder && !lineScopedOrders.contains(lastOrder) && detailOrder < lastOrder) {
                        issues.add(orderIssue(record));
                    }
                    lastOrder = detailOrder;
                }
                continue;
            }

            StructureRule rule = resolveRule(type, seenDetail);
            if (rule == null) {
                continue;
            }
            if (rule.getScope() == StructureScope.LINE) {
                if (segment == null) {
                    issues.add(ParseIssue.of(record.getLineNumber(), "Structure rule violated [" + rule.getLabel()
                            + "]: " + type + " without parent " + grammar.getDetailRecord() + "."));
                } else {
                    segment.counts.merge(rule.getLabel(), 1, Integer::sum);
                }
            } else {
                blockCounts.merge(rule.getLabel(), 1, Integer::sum);
            }

            if (rule.getOrderIndex() < lastOrder) {
                issues.add(orderIssue(record));
            } else {
                lastOrder = rule.getOrderIndex();
            }
        }

        int headerLine = block.header.getLineNumber();
        for (StructureRule rule : rules) {
            if (rule.getScope() != StructureScope.INVOICE) {
                continue;
            }
            int count = rule == headerRule ? 1 : blockCounts.getOrDefault(rule.getLabel(), 0);
            addOccurrenceIssue(rule, count, headerLine, issues);
        }
        for (Segment detail : segments) {
            for (StructureRule rule : rules) {
                if (rule.getScope() == StructureScope.LINE) {
                    addOccurrenceIssue(rule, detail.counts.getOrDefault(rule.getLabel(), 0), detail.lineNumber, issues);
                }
            }
        }
    }

    private StructureRule resolveRule(String recordType, boolean seenDetail) {
        List<StructureRule> candidates = rulesByRecord.get(recordType);
        if (candidates == null) {
            return null;
        }
        StructureRule invoiceRule = null;
        StructureRule lineRule = null;
        for (StructureRule candidate : candidates) {
            if (candidate.getScope() == StructureScope.INVOICE && invoiceRule == null) {
                invoiceRule = candidate;
            } else if (candidate.getScope() == StructureScope.LINE && lineRule == null) {
                lineRule = candidate;
            }
        }
        if (lineRule != null && (invoiceRule == null || seenDetail)) {
            return lineRule;
        }
        return invoiceRule;
    }

    private StructureRule invoiceRule(String recordType) {
        List<StructureRule> candidates = rulesByRecord.getOrDefault(recordType, Collections.emptyList());
        return candidates.stream().filter(r -> r.getScope() == StructureScope.INVOICE).findFirst().orElse(null);
    }

    private static void addOccurrenceIssue(StructureRule rule, int count, int lineNumber, List<ParseIssue> issues) {
        String violation = rule.checkOccurrences(count);
        if (violation != null) {
            issues.add(ParseIssue.of(lineNumber, violation));
        }
    }

    private static ParseIssue orderIssue(DecodedRecord record) {
        return ParseIssue.of(record.getLineNumber(), "Structure order violated in invoice block: "
                + record.getRecordType() + " out of expected sequence.");
    }

    private static final class Block {
        private final DecodedRecord header;
        private final List<DecodedRecord> records = new ArrayList<>();

        private Block(DecodedRecord header) {
            this.header = header;
        }
    }

    private static final class Segment {
        private final int lineNumber;
        private final Map<String, Integer> counts = new HashMap<>();

        private Segment(int lineNumber) {
            this.lineNumber = lineNumber;
        }
    }
}
