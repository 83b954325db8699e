package com.mainframe.contract.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import com.mainframe.contract.io.ContractJsonMapper;
import com.mainframe.contract.model.ContractSpec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the command line: extract, parse and run.
 */
class ContractToolCommandTest {

    private static final String PLI_SOURCE = String.join("\n",
            " DCL 1 IDP_FIC, 2 TYP CHAR(3), 2 FILLER CHAR(7);",
            " DCL 1 IDP_ENT, 2 TYP CHAR(3), 2 DOC FIXED DEC(7);",
            " DCL 1 IDP_LIG, 2 TYP CHAR(3), 2 QTY PIC '9999999';",
            "");

    @TempDir
    Path tempDir;

    private Path source;
    private Path data;

    @BeforeEach
    void setUp() throws IOException {
        source = tempDir.resolve("IDP470RA.pli");
        Files.writeString(source, PLI_SOURCE);
        data = tempDir.resolve("invoices.txt");
        Files.writeString(data, "FIC       \nENT       \nLIG0000002\n", StandardCharsets.ISO_8859_1);
    }

    private static int execute(String... args) {
        return new CommandLine(new ContractToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Test
    void testExtractWritesContract() throws IOException {
        Path contract = tempDir.resolve("contract.json");

        int exitCode = execute("extract", "-s", source.toString(), "--structure-prefix", "IDP_",
                "-o", contract.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        ContractSpec spec = new ContractJsonMapper().read(contract);
        assertThat(spec.getRecordNames()).containsExactly("FIC", "ENT", "LIG");
        assertThat(spec.getLineLength()).isEqualTo(10);
        assertThat(spec.getStructureRules()).isNotEmpty();
    }

    @Test
    void testExtractThenParse() throws IOException {
        Path contract = tempDir.resolve("contract.json");
        Path records = tempDir.resolve("out/invoices.jsonl");
        execute("extract", "--source", source.toString(), "--structure-prefix", "IDP_", "--no-invoice-rules",
                "--output", contract.toString());

        int exitCode = execute("parse", "-c", contract.toString(), "-i", data.toString(), "-o", records.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        List<String> lines = Files.readAllLines(records);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(2)).startsWith("{\"record_type\":\"LIG\",\"line_number\":3");
        assertThat(lines.get(2)).contains("\"QTY\":2");
        assertThat(tempDir.resolve("out/invoices_issues.jsonl")).doesNotExist();
    }

    @Test
    void testParseReportsIssuesFile() throws IOException {
        Path contract = tempDir.resolve("contract.json");
        Path records = tempDir.resolve("records.jsonl");
        Files.writeString(data, "FIC       \nENT       \nXXX\n", StandardCharsets.ISO_8859_1);
        execute("extract", "-s", source.toString(), "--structure-prefix", "IDP_", "-o", contract.toString());

        int exitCode = execute("parse", "-c", contract.toString(), "-i", data.toString(), "-o", records.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readAllLines(tempDir.resolve("records_issues.jsonl")))
                .contains("{\"line_number\":3,\"message\":\"Invalid line length 3, expected 10.\"}");
    }

    @Test
    void testParseFailFast() throws IOException {
        Path contract = tempDir.resolve("contract.json");
        Path records = tempDir.resolve("records.jsonl");
        Files.writeString(data, "FIC       \nXXX\nENT       \n", StandardCharsets.ISO_8859_1);
        execute("extract", "-s", source.toString(), "--structure-prefix", "IDP_", "-o", contract.toString());

        int exitCode = execute("parse", "-c", contract.toString(), "-i", data.toString(), "-o", records.toString(),
                "--fail-fast");

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
        assertThat(Files.readAllLines(records)).hasSize(1);
    }

    @Test
    void testRunExtractsOnceAndDecodes() throws IOException {
        Path outputDir = tempDir.resolve("outputs");

        int exitCode = execute("run", "-s", source.toString(), "--structure-prefix", "IDP_",
                "-i", data.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        Path contract = outputDir.resolve("contract_IDP470RA.json");
        assertThat(contract).exists();
        assertThat(outputDir.resolve("invoices_records.jsonl")).exists();

        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
        Files.writeString(contract, Files.readString(contract).replace("\"IDP470RA\"", "\"REUSED\""));

        assertThat(execute("run", "-s", source.toString(), "--structure-prefix", "IDP_",
                "-i", data.toString(), "-o", outputDir.toString())).isEqualTo(ExitCodes.OK);
        assertThat(new ContractJsonMapper().read(contract).getSourceProgram()).isEqualTo("REUSED");
    }

    @Test
    void testRunWithStrictStructureFails() {
        Path outputDir = tempDir.resolve("outputs");

        int exitCode = execute("run", "-s", source.toString(), "--structure-prefix", "IDP_",
                "--strict-structure-validation", "-i", data.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
        assertThat(outputDir.resolve("invoices_issues.jsonl")).exists();
    }

    @Test
    void testRunToleratesStructureIssuesWhenAsked() {
        int exitCode = execute("run", "-s", source.toString(), "--structure-prefix", "IDP_",
                "--strict-structure-validation", "--tolerate-structure-issues",
                "-i", data.toString(), "-o", tempDir.resolve("outputs").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
    }

    @Test
    void testNoStructureIsFailure() {
        int exitCode = execute("extract", "-s", source.toString(), "--structure-prefix", "NONE_",
                "-o", tempDir.resolve("contract.json").toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
    }

    @Test
    void testInvalidOptions() throws IOException {
        Path pdf = tempDir.resolve("DOCTECHN.pdf");
        Files.writeString(pdf, "%PDF-1.4");

        assertThat(execute()).isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("extract", "-s", source.toString())).isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("extract", "-s", tempDir.resolve("missing.pli").toString(), "-o", "x.json"))
                .isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("extract", "-s", pdf.toString(), "-o", "x.json")).isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("extract", "-s", source.toString(), "--selector-length", "0", "-o", "x.json"))
                .isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("parse", "-c", tempDir.resolve("none.json").toString(), "-i", data.toString(),
                "-o", "x.jsonl")).isEqualTo(ExitCodes.INVALID_OPTIONS);
        assertThat(execute("run", "-s", source.toString(), "-i", data.toString(), "--input-encoding", "NOPE-42"))
                .isEqualTo(ExitCodes.INVALID_OPTIONS);
    }

    @Test
    void testIssuesPathFor() {
        assertThat(ParseCommand.issuesPathFor(Path.of("out/records.jsonl"))).isEqualTo(Path.of("out/records_issues.jsonl"));
        assertThat(ParseCommand.issuesPathFor(Path.of("records.txt"))).isEqualTo(Path.of("records.txt_issues.jsonl"));
    }
}
