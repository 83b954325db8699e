package com.mainframe.contract.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.cli.exception.OptionsValidationException;
import com.mainframe.contract.cli.model.LoggingOptions;
import com.mainframe.contract.cli.model.SourceOptions;
import com.mainframe.contract.cli.output.ContractResultsPrinter;
import com.mainframe.contract.cli.validation.SourceOptionsValidator;
import com.mainframe.contract.io.ContractJsonMapper;
import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.ContractValidationException;
import com.mainframe.contract.service.ContractExtractionService;
import com.mainframe.contract.service.ExtractionConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Extracts a contract JSON file from a PL/I or COBOL source.
 */
@Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Extracts the record contract from a PL/I program or COBOL copybook.")
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @Mixin
    private LoggingOptions loggingOptions;

    @Option(names = {"--output", "-o"}, required = true, description = "Contract JSON file to write")
    private Path output;

    @Override
    public Integer call() {
        LogLevels.apply(loggingOptions.isVerbose());
        try {
            ExtractionConfig config = new SourceOptionsValidator().validate(sourceOptions);
            ContractSpec contract = new ContractExtractionService().extract(sourceOptions.getSource(), config);
            new ContractJsonMapper().write(contract, output);
            new ContractResultsPrinter().printContract(contract, output);
            return ExitCodes.OK;
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return ExitCodes.INVALID_OPTIONS;
        } catch (DeclarationException | ContractValidationException e) {
            log.error("Extraction failed: {}", e.getMessage());
            return ExitCodes.FAILURE;
        } catch (IOException e) {
            log.error("Extraction failed with I/O error", e);
            return ExitCodes.FAILURE;
        }
    }
}
