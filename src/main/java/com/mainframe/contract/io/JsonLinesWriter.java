package com.mainframe.contract.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;

/**
 * Writes one JSON object per line, UTF-8.
 */
public class JsonLinesWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public void writeRecords(List<DecodedRecord> records, Path target) throws IOException {
        createParent(target);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (DecodedRecord record : records) {
                writer.write(MAPPER.writeValueAsString(record.toMap()));
                writer.newLine();
            }
        }
    }

    public void writeIssues(List<ParseIssue> issues, Path target) throws IOException {
        createParent(target);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (ParseIssue issue : issues) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(DecodedRecord.LINE_NUMBER_KEY, issue.getLineNumber());
                row.put("message", issue.getMessage());
                writer.write(MAPPER.writeValueAsString(row));
                writer.newLine();
            }
        }
    }

    private static void createParent(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
    }
}
