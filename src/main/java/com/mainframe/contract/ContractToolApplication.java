package com.mainframe.contract;

import com.mainframe.contract.cli.ContractToolCommand;

import picocli.CommandLine;

/**
 * Main entry point of the fixed-width contract tool.
 * Extracts record contracts from PL/I or COBOL declarations and decodes the files they describe.
 */
public class ContractToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ContractToolCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
