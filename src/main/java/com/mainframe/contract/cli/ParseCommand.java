package com.mainframe.contract.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.cli.exception.OptionsValidationException;
import com.mainframe.contract.cli.model.DecodeOptions;
import com.mainframe.contract.cli.model.LoggingOptions;
import com.mainframe.contract.cli.output.ContractResultsPrinter;
import com.mainframe.contract.cli.validation.DecodeOptionsValidator;
import com.mainframe.contract.decode.FileParsingException;
import com.mainframe.contract.decode.FixedWidthFileParser;
import com.mainframe.contract.decode.ParseOptions;
import com.mainframe.contract.decode.ParseResult;
import com.mainframe.contract.io.ContractJsonMapper;
import com.mainframe.contract.io.JsonLinesWriter;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.ContractValidationException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Decodes a data file with an existing contract and writes the records as JSON Lines.
 */
@Command(name = "parse", mixinStandardHelpOptions = true,
        description = "Decodes a fixed-width data file with a contract JSON file.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Option(names = {"--contract", "-c"}, required = true, description = "Contract JSON file")
    private Path contract;

    @Option(names = {"--input", "-i"}, required = true, description = "Fixed-width data file")
    private Path input;

    @Option(names = {"--output-jsonl", "-o"}, required = true, description = "Decoded records (JSON Lines)")
    private Path outputJsonl;

    @Option(names = {"--issues-jsonl"}, description = "Issues file (default: next to the records file)")
    private Path issuesJsonl;

    @Mixin
    private DecodeOptions decodeOptions;

    @Mixin
    private LoggingOptions loggingOptions;

    @Override
    public Integer call() {
        LogLevels.apply(loggingOptions.isVerbose());
        try {
            DecodeOptionsValidator validator = new DecodeOptionsValidator();
            validator.validateContractFile(contract);
            ParseOptions options = validator.validate(decodeOptions, List.of(input));
            ContractSpec spec = new ContractJsonMapper().read(contract);
            return decode(spec, input, options, outputJsonl,
                    issuesJsonl != null ? issuesJsonl : issuesPathFor(outputJsonl));
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return ExitCodes.INVALID_OPTIONS;
        } catch (ContractValidationException e) {
            log.error("Invalid contract {}: {}", contract, e.getMessage());
            return ExitCodes.FAILURE;
        } catch (IOException e) {
            log.error("Parse failed with I/O error", e);
            return ExitCodes.FAILURE;
        }
    }

    /**
     * Decodes one file and writes its records and issues. Returns the exit code.
     */
    static int decode(ContractSpec contract, Path input, ParseOptions options, Path recordsPath, Path issuesPath)
            throws IOException {
        ParseResult result;
        int exitCode = ExitCodes.OK;
        try {
            result = new FixedWidthFileParser(contract).parse(input, options);
        } catch (FileParsingException e) {
            log.error("Parsing of {} stopped: {}", input, e.getMessage());
            result = e.getPartialResult();
            exitCode = ExitCodes.FAILURE;
        }

        JsonLinesWriter writer = new JsonLinesWriter();
        writer.writeRecords(result.getRecords(), recordsPath);
        if (result.hasIssues()) {
            writer.writeIssues(result.getIssues(), issuesPath);
        }
        new ContractResultsPrinter().printParse(input, result, recordsPath, issuesPath);
        return exitCode;
    }

    static Path issuesPathFor(Path recordsPath) {
        String name = recordsPath.getFileName().toString();
        String stem = name.endsWith(".jsonl") ? name.substring(0, name.length() - ".jsonl".length()) : name;
        return recordsPath.resolveSibling(stem + "_issues.jsonl");
    }
}
