package com.mainframe.contract.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.mainframe.contract.cli.exception.OptionsValidationException;
import com.mainframe.contract.cli.model.SourceOptions;
import com.mainframe.contract.service.ExtractionConfig;

/**
 * Checks the extraction options and maps them onto an {@link ExtractionConfig}.
 */
public class SourceOptionsValidator {

	public ExtractionConfig validate(SourceOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSource() == null) {
			errors.add("Source file is required (--source / -s).");
		} else if (!Files.isRegularFile(o.getSource())) {
			errors.add("Source file does not exist: " + o.getSource());
		} else if (o.getSource().getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
			errors.add("Source must be program text, not a PDF: " + o.getSource());
		}

		if (isBlank(o.getProgram())) {
			errors.add("Program name must not be blank (--program).");
		}
		if (o.getSelectorLength() < 1) {
			errors.add("Selector length must be at least 1 (--selector-length).");
		}
		Charset charset = CharsetOptions.resolve(o.getSourceEncoding(), "--source-encoding", errors);

		if (o.getRawFallbackFile() != null && !o.isRawFallback()) {
			errors.add("--raw-fallback-file requires --raw-fallback.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return ExtractionConfig.builder()
				.sourceProgram(o.getProgram().trim())
				.engine(o.getEngine())
				.sourceCharset(charset)
				.strictLengthValidation(!o.isDisableStrictLengthValidation())
				.strictStructureValidation(o.isStrictStructureValidation())
				.structureNames(o.getStructureNames())
				.structurePrefixes(o.getStructurePrefixes())
				.preserveStructureNames(o.isPreserveStructureNames())
				.selectorLength(o.getSelectorLength())
				.invoiceRules(!o.isNoInvoiceRules())
				.referenceDocument(o.getSpecDoc())
				.rawFallback(o.isRawFallback())
				.rawFallbackFileName(o.getRawFallbackFile())
				.build();
	}

	public static Path requireRegularFile(Path path, String option, List<String> errors) {
		if (path == null) {
			errors.add("Missing required file (" + option + ").");
		} else if (!Files.isRegularFile(path)) {
			errors.add("File does not exist (" + option + "): " + path);
		}
		return path;
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
