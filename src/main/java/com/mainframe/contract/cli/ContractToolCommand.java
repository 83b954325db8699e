package com.mainframe.contract.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command: extracts contracts from declaration sources and decodes fixed-width files with them.
 */
@Command(
        name = "contract-tool",
        mixinStandardHelpOptions = true,
        version = "fixed-width-contract-tool 1.0.0",
        description = "Derives fixed-width record contracts from PL/I or COBOL declarations and decodes data files.",
        subcommands = {ExtractCommand.class, ParseCommand.class, RunCommand.class}
)
public class ContractToolCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing sub-command: extract, parse or run");
    }
}
