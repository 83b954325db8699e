package com.mainframe.contract.decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;

import lombok.Value;

/**
 * Records decoded from a file and the issues found along the way, both in file order.
 */
@Value
public class ParseResult {
    List<DecodedRecord> records;
    List<ParseIssue> issues;

    public ParseResult(List<DecodedRecord> records, List<ParseIssue> issues) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public List<String> getIssueMessages() {
        return issues.stream().map(i -> "line " + i.getLineNumber() + ": " + i.getMessage())
                .collect(Collectors.toList());
    }
}
