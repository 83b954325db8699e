package com.mainframe.contract.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;

import lombok.experimental.UtilityClass;

@UtilityClass
class CharsetOptions {

	/**
	 * Resolves a charset option, recording an error and returning ISO-8859-1 when it is unknown.
	 */
	static Charset resolve(String name, String option, List<String> errors) {
		if (name == null || name.isBlank()) {
			return StandardCharsets.ISO_8859_1;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			errors.add("Unsupported charset for " + option + ": " + name);
			return StandardCharsets.ISO_8859_1;
		}
	}
}
