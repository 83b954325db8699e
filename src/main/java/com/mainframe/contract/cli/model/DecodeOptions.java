package com.mainframe.contract.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options controlling how data files are decoded.
 */
@Getter
public class DecodeOptions {

	@Option(names = { "--input-encoding" }, defaultValue = "ISO-8859-1", description = "Charset of the data file (default: ${DEFAULT-VALUE})")
	private String inputEncoding;

	@Option(names = { "--fail-fast" }, description = "Stop at the first line that cannot be decoded")
	private boolean failFast;

	@Option(names = { "--tolerate-structure-issues" }, description = "Report structure issues without failing")
	private boolean tolerateStructureIssues;
}
