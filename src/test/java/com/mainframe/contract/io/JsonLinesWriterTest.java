package com.mainframe.contract.io;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mainframe.contract.model.DecodedRecord;
import com.mainframe.contract.model.ParseIssue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JsonLinesWriter and JsonLinesReader.
 */
class JsonLinesWriterTest {

    @TempDir
    Path tempDir;

    private final JsonLinesWriter writer = new JsonLinesWriter();
    private final JsonLinesReader reader = new JsonLinesReader();

    @Test
    void testWriteRecords() throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("TYPE", "ENT");
        values.put("AMOUNT", new BigDecimal("1.50"));
        values.put("QTY", 3L);
        values.put("EMPTY", null);
        Path target = tempDir.resolve("nested/records.jsonl");

        writer.writeRecords(List.of(new DecodedRecord("ENT", 1, values), new DecodedRecord("ENT", 2, values)), target);

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0))
                .isEqualTo("{\"record_type\":\"ENT\",\"line_number\":1,\"TYPE\":\"ENT\",\"AMOUNT\":1.50,\"QTY\":3,\"EMPTY\":null}");

        List<Map<String, Object>> rows = reader.read(target);
        assertThat(rows.get(1).keySet()).containsExactly("record_type", "line_number", "TYPE", "AMOUNT", "QTY", "EMPTY");
        assertThat(rows.get(1).get("AMOUNT")).isEqualTo(new BigDecimal("1.50"));
        assertThat(rows.get(1).get("line_number")).isEqualTo(2);
    }

    @Test
    void testWriteIssues() throws IOException {
        Path target = tempDir.resolve("issues.jsonl");

        writer.writeIssues(List.of(new ParseIssue(4, "Unknown record type.", "XYZ")), target);

        assertThat(Files.readAllLines(target, StandardCharsets.UTF_8))
                .containsExactly("{\"line_number\":4,\"message\":\"Unknown record type.\"}");
    }

    @Test
    void testEmptyListsWriteEmptyFiles() throws IOException {
        Path target = tempDir.resolve("empty.jsonl");

        writer.writeIssues(List.of(), target);

        assertThat(Files.size(target)).isZero();
        assertThat(reader.read(target)).isEmpty();
    }

    @Test
    void testReaderSkipsBlankLines() throws IOException {
        Path source = tempDir.resolve("rows.jsonl");
        Files.writeString(source, "{\"a\":1}\n\n{\"a\":2.5}\n", StandardCharsets.UTF_8);

        List<Map<String, Object>> rows = reader.read(source);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).get("a")).isEqualTo(new BigDecimal("2.5"));
    }
}
