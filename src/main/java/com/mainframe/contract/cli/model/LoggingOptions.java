package com.mainframe.contract.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

@Getter
public class LoggingOptions {

	@Option(names = { "--verbose", "-v" }, description = "Log at DEBUG level")
	private boolean verbose;
}
