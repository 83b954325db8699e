package com.mainframe.contract.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.contract.service.AnalyzerEngine;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Options describing where a contract is extracted from and how. No validation, no execution logic.
 */
@Getter
public class SourceOptions {

	@Option(names = { "--source", "-s" }, required = true, description = "PL/I program or COBOL copybook to extract the layout from")
	private Path source;

	@Option(names = { "--program" }, defaultValue = "IDP470RA", description = "Program name recorded in the contract (default: ${DEFAULT-VALUE})")
	private String program;

	@Option(names = { "--engine" }, defaultValue = "AUTO", description = "Declaration dialect: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private AnalyzerEngine engine;

	@Option(names = { "--source-encoding" }, defaultValue = "ISO-8859-1", description = "Charset of the source file (default: ${DEFAULT-VALUE})")
	private String sourceEncoding;

	@Option(names = { "--spec-doc" }, description = "Reference document (PDF or plain text) describing the record sections")
	private Path specDoc;

	@Option(names = { "--structure-name" }, description = "Top-level structure to extract (repeatable)")
	private List<String> structureNames = new ArrayList<>();

	@Option(names = { "--structure-prefix" }, description = "Extract structures whose name starts with this prefix (repeatable; PL/I default: DEMAT_, STO_D_)")
	private List<String> structurePrefixes = new ArrayList<>();

	@Option(names = { "--preserve-structure-names" }, description = "Keep full structure names instead of stripping the matched prefix")
	private boolean preserveStructureNames;

	@Option(names = { "--selector-length" }, defaultValue = "3", description = "Length of the PL/I record-type selector (default: ${DEFAULT-VALUE})")
	private int selectorLength;

	@Option(names = { "--disable-strict-length-validation" }, description = "Allow records whose length differs from the line length")
	private boolean disableStrictLengthValidation;

	@Option(names = { "--strict-structure-validation" }, description = "Fail parsing when the record sequence breaks a structure rule")
	private boolean strictStructureValidation;

	@Option(names = { "--no-invoice-rules" }, description = "Do not attach the invoice structure rules")
	private boolean noInvoiceRules;

	@Option(names = { "--raw-fallback" }, description = "Use a single raw-line record when no structure is found")
	private boolean rawFallback;

	@Option(names = { "--raw-fallback-file" }, description = "PL/I file whose RECSIZE/BLKSIZE sets the raw line length")
	private String rawFallbackFile;
}
