package com.mainframe.contract.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.contract.cli.exception.OptionsValidationException;
import com.mainframe.contract.cli.model.DecodeOptions;
import com.mainframe.contract.decode.ParseOptions;

/**
 * Checks the decoding options and the data files, then maps them onto {@link ParseOptions}.
 */
public class DecodeOptionsValidator {

	public ParseOptions validate(DecodeOptions o, List<Path> inputs) {
		List<String> errors = new ArrayList<>();

		if (inputs == null || inputs.isEmpty()) {
			errors.add("At least one data file is required (--input / -i).");
		} else {
			for (Path input : inputs) {
				SourceOptionsValidator.requireRegularFile(input, "--input", errors);
			}
		}
		Charset charset = CharsetOptions.resolve(o.getInputEncoding(), "--input-encoding", errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return ParseOptions.builder()
				.charset(charset)
				.continueOnDecodeError(!o.isFailFast())
				.tolerateStructureIssues(o.isTolerateStructureIssues())
				.build();
	}

	public void validateContractFile(Path contract) {
		List<String> errors = new ArrayList<>();
		SourceOptionsValidator.requireRegularFile(contract, "--contract", errors);
		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}
}
