package com.mainframe.contract.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.cli.exception.OptionsValidationException;
import com.mainframe.contract.cli.model.DecodeOptions;
import com.mainframe.contract.cli.model.LoggingOptions;
import com.mainframe.contract.cli.model.SourceOptions;
import com.mainframe.contract.cli.output.ContractResultsPrinter;
import com.mainframe.contract.cli.validation.DecodeOptionsValidator;
import com.mainframe.contract.cli.validation.SourceOptionsValidator;
import com.mainframe.contract.decode.ParseOptions;
import com.mainframe.contract.io.ContractJsonMapper;
import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.ContractValidationException;
import com.mainframe.contract.service.ContractCache;
import com.mainframe.contract.service.ContractExtractionService;
import com.mainframe.contract.service.ExtractionConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Extracts (or reuses) the contract, then decodes each data file with it.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Extracts the contract when needed and decodes one or more data files.")
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @Mixin
    private DecodeOptions decodeOptions;

    @Mixin
    private LoggingOptions loggingOptions;

    @Option(names = {"--input", "-i"}, required = true, arity = "1..*", description = "Fixed-width data files")
    private List<Path> inputs = new ArrayList<>();

    @Option(names = {"--output-dir", "-o"}, defaultValue = "outputs", description = "Output directory (default: ${DEFAULT-VALUE})")
    private Path outputDir;

    @Option(names = {"--contract", "-c"}, description = "Contract JSON file (default: <output-dir>/contract_<program>.json)")
    private Path contract;

    @Option(names = {"--force-extract"}, description = "Extract the contract even when an up-to-date one exists")
    private boolean forceExtract;

    private final ContractCache cache = new ContractCache();

    @Override
    public Integer call() {
        LogLevels.apply(loggingOptions.isVerbose());
        try {
            ExtractionConfig config = new SourceOptionsValidator().validate(sourceOptions);
            ParseOptions options = new DecodeOptionsValidator().validate(decodeOptions, inputs);
            Path contractPath = contract != null ? contract
                    : outputDir.resolve("contract_" + config.getSourceProgram() + ".json");

            int exitCode = ExitCodes.OK;
            for (Path input : inputs) {
                ContractSpec spec = cache.getOrLoad(sourceOptions.getSource(), config.profileKey(),
                        () -> loadOrExtract(config, contractPath));
                String stem = stem(input);
                int result = ParseCommand.decode(spec, input, options,
                        outputDir.resolve(stem + "_records.jsonl"), outputDir.resolve(stem + "_issues.jsonl"));
                exitCode = Math.max(exitCode, result);
            }
            return exitCode;
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return ExitCodes.INVALID_OPTIONS;
        } catch (DeclarationException | ContractValidationException e) {
            log.error("Run failed: {}", e.getMessage());
            return ExitCodes.FAILURE;
        } catch (IOException e) {
            log.error("Run failed with I/O error", e);
            return ExitCodes.FAILURE;
        }
    }

    private ContractSpec loadOrExtract(ExtractionConfig config, Path contractPath) throws IOException {
        Path source = sourceOptions.getSource();
        ContractJsonMapper mapper = new ContractJsonMapper();
        if (!forceExtract && Files.isRegularFile(contractPath)
                && Files.getLastModifiedTime(contractPath).compareTo(Files.getLastModifiedTime(source)) >= 0) {
            log.info("Reusing contract {}", contractPath);
            return mapper.read(contractPath);
        }
        ContractSpec spec = new ContractExtractionService().extract(source, config);
        mapper.write(spec, contractPath);
        new ContractResultsPrinter().printContract(spec, contractPath);
        return spec;
    }

    private static String stem(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
